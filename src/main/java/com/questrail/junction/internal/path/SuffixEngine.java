package com.questrail.junction.internal.path;

import com.questrail.junction.api.MinType;
import com.questrail.junction.api.Stage;
import com.questrail.junction.internal.classify.StageClassifier;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * SuffixEngine
 * -----------------------------------------------------------------------------
 * Decorates stage names for use inside path fragments.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>A decorated name is the stage name followed by its min-type suffix
 *       ({@code Bcpn}, {@code A0min}). Stages without recorded properties
 *       use {@code min}.</li>
 *   <li>In a rendered tail the last element is always bare.</li>
 *   <li>LRT stages, Lig stages and the dequeue marker {@value #DEQUEUE_MARKER}
 *       are bare wherever they appear.</li>
 * </ul>
 */
public final class SuffixEngine
{
    /** Path token marking a queue-release point. */
    public static final String DEQUEUE_MARKER = "DQ";

    private final Map<String, Stage> stages;

    public SuffixEngine(Map<String, Stage> stages) {
        this.stages = Objects.requireNonNull(stages, "stages");
    }

    public String applySuffix(String stage) {
        return stage + minTypeOf(stage).suffix();
    }

    /**
     * Renders the stages that follow a transition's target, up to an anchor,
     * as an underscore-joined path.
     *
     * <pre>{@code
     * [B, C, A0]   -> Bcpn_Ccpn_A0
     * [L30, C, A0] -> L30_Ccpn_A0
     * [A0]         -> A0
     * []           -> ""
     * }</pre>
     */
    public String renderTail(List<String> tail) {
        Objects.requireNonNull(tail, "tail");
        StringJoiner joined = new StringJoiner("_");
        int last = tail.size() - 1;
        for (int i = 0; i < tail.size(); i++) {
            String stage = tail.get(i);
            joined.add(i == last || isAlwaysBare(stage) ? stage : applySuffix(stage));
        }
        return joined.toString();
    }

    /**
     * Returns the green-time operand compared against {@code GT(stage)}:
     * {@code GTcpmin(stage)} for compensated stages, {@code GTmin_stage}
     * otherwise.
     */
    public String greenTimeFunction(String stage) {
        if (minTypeOf(stage) == MinType.CPN) {
            return "GTcpmin(" + stage + ")";
        }
        return "GTmin_" + stage;
    }

    private MinType minTypeOf(String stage) {
        Stage props = stages.get(stage);
        return props == null ? MinType.MIN : props.minType();
    }

    private static boolean isAlwaysBare(String stage) {
        return DEQUEUE_MARKER.equals(stage)
                || StageClassifier.isLrtName(stage)
                || StageClassifier.isLigName(stage);
    }
}
