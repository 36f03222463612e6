package com.questrail.junction.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * SkeletonText
 * -----------------------------------------------------------------------------
 * Parsing of textual stage sequences such as {@code "A0 - B - C - A0"} or
 * {@code "L30→B→A0"}.
 *
 * Separators are {@code -}, {@code ->} and {@code →}; whitespace around stage
 * names is ignored and empty segments are dropped.
 */
public final class SkeletonText
{
    private SkeletonText() {}

    /**
     * Splits a stage sequence into stage names without validating them.
     *
     * @param text the sequence text, may be {@code null}
     * @return the ordered stage names; empty for {@code null} or blank text
     */
    public static List<String> parseStageSequence(String text) {
        List<String> stages = new ArrayList<>();
        if (text == null) {
            return stages;
        }
        String normalized = text.replace("->", "-").replace('→', '-');
        for (String part : normalized.split("-")) {
            String stage = part.strip();
            if (!stage.isEmpty()) {
                stages.add(stage);
            }
        }
        return stages;
    }

    /**
     * Parses the rest-of-skeleton field of a {@link Transition}.
     * <p>
     * Blank text and the case-insensitive literals {@code "end of skeleton"}
     * and {@code "end"} yield an empty list.
     *
     * @param text raw rest-of-skeleton text
     * @return ordered stage names, by convention starting with the target
     * @throws IllegalArgumentException if a segment is not a valid stage name,
     *         i.e. it contains whitespace
     */
    public static List<String> parseRestOfSkeleton(String text) {
        if (text == null) {
            return List.of();
        }
        String trimmed = text.strip();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (trimmed.isEmpty() || lower.equals(Transition.END_OF_SKELETON) || lower.equals("end")) {
            return List.of();
        }

        List<String> stages = parseStageSequence(trimmed);
        for (String stage : stages) {
            if (!Stage.isValidName(stage)) {
                throw new IllegalArgumentException(
                        "Malformed rest of skeleton '" + text + "': '" + stage + "' is not a stage name");
            }
        }
        return List.copyOf(stages);
    }
}
