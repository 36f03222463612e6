package com.questrail.junction.api;

import java.util.Locale;

/**
 * StageCategory
 * -----------------------------------------------------------------------------
 * The closed set of categories a stage name can fall into.
 *
 * Categories are derived purely from the stage name (and, for LRT stages, from
 * the configured LRT anchor). They are never stored on a {@link Stage}.
 *
 * <ul>
 *   <li>{@link #VEHICLE}    – an ordinary traffic phase</li>
 *   <li>{@link #LRT_ANCHOR} – the designated home light-rail phase</li>
 *   <li>{@link #LRT_ENTRY}  – any other light-rail phase</li>
 *   <li>{@link #LIG}        – a light-rail intermediate staging phase</li>
 * </ul>
 */
public enum StageCategory
{
    VEHICLE,
    LRT_ANCHOR,
    LRT_ENTRY,
    LIG;

    /**
     * @return {@code true} for both LRT categories
     */
    public boolean isLrt() {
        return this == LRT_ANCHOR || this == LRT_ENTRY;
    }

    /**
     * Returns the lower-case label used in diagnostics, e.g. {@code lrt-entry}.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
