package com.questrail.junction.api;

import java.util.Objects;

/**
 * A directed transition between two stages.
 *
 * <p>
 * {@code restOfSkeleton} is kept exactly as supplied by the ingestion side:
 * either {@link #END_OF_SKELETON} or a dash/arrow separated stage sequence that
 * starts with the target and runs back to an anchor (e.g. {@code "B-C-A0"}).
 * It is parsed lazily by the compiler so that malformed text only affects the
 * row it belongs to.
 * </p>
 */
public record Transition(
        String from,
        String to,
        String restOfSkeleton
) {
    /** Literal marking an empty rest of skeleton. */
    public static final String END_OF_SKELETON = "end of skeleton";

    public Transition {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (!Stage.isValidName(from) || !Stage.isValidName(to)) {
            throw new IllegalArgumentException("Invalid transition stage names: '" + from + "' -> '" + to + "'");
        }
        restOfSkeleton = restOfSkeleton == null ? "" : restOfSkeleton;
    }

    /**
     * Creates a transition whose target is the end of the skeleton.
     */
    public static Transition toEnd(String from, String to) {
        return new Transition(from, to, END_OF_SKELETON);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
