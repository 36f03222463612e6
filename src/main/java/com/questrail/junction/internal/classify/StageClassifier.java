package com.questrail.junction.internal.classify;

import com.questrail.junction.api.StageCategory;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * StageClassifier
 * -----------------------------------------------------------------------------
 * Maps a stage name to its {@link StageCategory}.
 *
 * <h2>Naming convention</h2>
 * <ul>
 *   <li>LRT stages: {@code L} followed by digits ({@code L30}, {@code L39})</li>
 *   <li>Lig stages: {@code A} followed by exactly two digits, the first in
 *       3–9 ({@code A30}–{@code A99}). Vehicle names such as {@code A0},
 *       {@code A01} and {@code A1}–{@code A9} never match.</li>
 *   <li>everything else is a vehicle stage</li>
 * </ul>
 *
 * The two patterns cannot both match the same name, so classification is
 * total and unambiguous. It depends only on the name and the configured LRT
 * anchor, never on graph position.
 */
public final class StageClassifier
{
    private static final Pattern LRT_PATTERN = Pattern.compile("^L\\d+$");
    private static final Pattern LIG_PATTERN = Pattern.compile("^A[3-9]\\d$");

    private final String lrtAnchor;

    public StageClassifier(String lrtAnchor) {
        this.lrtAnchor = Objects.requireNonNull(lrtAnchor, "lrtAnchor");
    }

    public static boolean isLrtName(String stage) {
        return LRT_PATTERN.matcher(stage).matches();
    }

    public static boolean isLigName(String stage) {
        return LIG_PATTERN.matcher(stage).matches();
    }

    public StageCategory classify(String stage) {
        Objects.requireNonNull(stage, "stage");
        if (isLrtName(stage)) {
            return stage.equals(lrtAnchor) ? StageCategory.LRT_ANCHOR : StageCategory.LRT_ENTRY;
        }
        if (isLigName(stage)) {
            return StageCategory.LIG;
        }
        return StageCategory.VEHICLE;
    }

    public boolean isVehicle(String stage) {
        return classify(stage) == StageCategory.VEHICLE;
    }

    public boolean isLrt(String stage) {
        return isLrtName(stage);
    }
}
