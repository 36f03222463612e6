package com.questrail.junction.api;

import java.util.Objects;

/**
 * Properties of a single named stage.
 *
 * <p>
 * The stage name is the identity of the stage throughout a junction. Only
 * vehicle stages normally carry a detector, a waterfall level and a sibling
 * priority; light-rail stages usually only carry their min-type.
 * </p>
 *
 * <ul>
 *   <li>{@code detector} is the raw detector expression, or the empty string
 *       when the stage has none. It never contains line breaks.</li>
 *   <li>{@code waterfallLevel} and {@code siblingPriority} are {@code null}
 *       when undefined. A lower sibling priority means a higher priority.</li>
 * </ul>
 */
public record Stage(
        String name,
        MinType minType,
        String detector,
        Integer waterfallLevel,
        Integer siblingPriority
) {
    public Stage {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(minType, "minType");
        if (!isValidName(name)) {
            throw new IllegalArgumentException("Stage name must be non-blank without whitespace: '" + name + "'");
        }
        detector = detector == null ? "" : detector.strip();
        if (detector.indexOf('\n') >= 0 || detector.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Detector of stage " + name + " must be a single line");
        }
    }

    /**
     * Creates a stage with no detector, level or priority.
     */
    public static Stage of(String name, MinType minType) {
        return new Stage(name, minType, "", null, null);
    }

    public boolean hasDetector() {
        return !detector.isEmpty();
    }

    public boolean hasWaterfallLevel() {
        return waterfallLevel != null;
    }

    public boolean hasSiblingPriority() {
        return siblingPriority != null;
    }

    static boolean isValidName(String name) {
        if (name.isEmpty()) return false;
        for (int i = 0; i < name.length(); i++) {
            if (Character.isWhitespace(name.charAt(i))) return false;
        }
        return true;
    }
}
