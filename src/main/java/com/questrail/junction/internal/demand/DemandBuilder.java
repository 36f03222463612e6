package com.questrail.junction.internal.demand;

import com.questrail.junction.api.Stage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DemandBuilder
 * -----------------------------------------------------------------------------
 * Synthesizes the demand precondition of a transition: the boolean expression
 * saying whether the target stage is wanted at all.
 *
 * <h2>Rules</h2>
 * <ol>
 *   <li>If the target has a detector, {@code IsActive(det)}.</li>
 *   <li>For every stage on the target's waterfall level with a strictly
 *       higher priority (numerically lower sibling priority), other than the
 *       from-stage and the target, that has a detector:
 *       {@code IsInactive(det)}, ascending by priority. This applies whether
 *       or not the target itself has a detector.</li>
 *   <li>When moving exactly one level up ({@code from.level - target.level == 1}),
 *       {@code IsInactive(det)} for every detector-bearing stage on level
 *       {@code from.level + 1}, ascending by priority with undefined
 *       priorities last, skipping parts already present.</li>
 * </ol>
 *
 * Parts are joined with {@code " and "}. When nothing applies the result is
 * the empty string; the literal {@code true} is never produced.
 */
public final class DemandBuilder
{
    private static final String CONJUNCTION = " and ";

    private static final Comparator<Stage> BY_PRIORITY_UNDEFINED_LAST =
            Comparator.comparing(Stage::siblingPriority, Comparator.nullsLast(Comparator.naturalOrder()));

    private final Map<String, Stage> stages;

    public DemandBuilder(Map<String, Stage> stages) {
        this.stages = Objects.requireNonNull(stages, "stages");
    }

    /**
     * @param target the stage being moved to
     * @param from   the stage being moved from
     * @return the demand expression, or {@code ""} if no condition applies
     */
    public String build(String target, String from) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(from, "from");

        Stage targetStage = stages.get(target);
        Stage fromStage = stages.get(from);
        List<String> parts = new ArrayList<>();

        if (targetStage != null && targetStage.hasDetector()) {
            parts.add(isActive(targetStage));
        }

        if (targetStage != null && targetStage.hasWaterfallLevel() && targetStage.hasSiblingPriority()) {
            stages.values().stream()
                    .filter(s -> Objects.equals(s.waterfallLevel(), targetStage.waterfallLevel()))
                    .filter(s -> s.hasSiblingPriority() && s.siblingPriority() < targetStage.siblingPriority())
                    .filter(s -> !s.name().equals(from) && !s.name().equals(target))
                    .filter(Stage::hasDetector)
                    .sorted(BY_PRIORITY_UNDEFINED_LAST)
                    .forEach(s -> parts.add(isInactive(s)));
        }

        if (isOneLevelUp(fromStage, targetStage)) {
            long below = fromStage.waterfallLevel() + 1L;
            stages.values().stream()
                    .filter(s -> s.hasWaterfallLevel() && s.waterfallLevel() == below)
                    .filter(Stage::hasDetector)
                    .sorted(BY_PRIORITY_UNDEFINED_LAST)
                    .map(DemandBuilder::isInactive)
                    .filter(part -> !parts.contains(part))
                    .forEach(parts::add);
        }

        return String.join(CONJUNCTION, parts);
    }

    private static boolean isOneLevelUp(Stage from, Stage target) {
        return from != null && target != null
                && from.hasWaterfallLevel() && target.hasWaterfallLevel()
                && (long) from.waterfallLevel() - target.waterfallLevel() == 1L;
    }

    private static String isActive(Stage stage) {
        return "IsActive(" + stage.detector() + ")";
    }

    private static String isInactive(Stage stage) {
        return "IsInactive(" + stage.detector() + ")";
    }
}
