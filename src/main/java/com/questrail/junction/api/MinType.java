package com.questrail.junction.api;

import java.util.Locale;

/**
 * MinType
 * -----------------------------------------------------------------------------
 * The minimum-green convention attached to a stage.
 *
 * The textual form of each constant is the suffix used when a stage name is
 * decorated inside a path fragment (e.g. {@code B} with {@link #CPN} renders as
 * {@code Bcpn}).
 */
public enum MinType
{
    /** Plain minimum green. This is the default for stages without properties. */
    MIN("min"),

    /** Compensated minimum. */
    CPN("cpn"),

    /** Safety minimum. */
    SAF("saf");

    private final String suffix;

    MinType(String suffix) {
        this.suffix = suffix;
    }

    /**
     * @return the lower-case suffix appended to decorated stage names
     */
    public String suffix() {
        return suffix;
    }

    /**
     * Parses a min-type from its textual form.
     * <p>
     * Matching is case-insensitive and ignores surrounding whitespace. A
     * {@code null} or blank value yields {@link #MIN}.
     *
     * @param text the textual min-type, e.g. {@code "cpn"}
     * @return the matching min-type
     * @throws IllegalArgumentException if the text names no known min-type
     */
    public static MinType parse(String text) {
        if (text == null || text.isBlank()) {
            return MIN;
        }
        String normalized = text.strip().toLowerCase(Locale.ROOT);
        for (MinType type : values()) {
            if (type.suffix.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown minimum type: '" + text + "'");
    }
}
