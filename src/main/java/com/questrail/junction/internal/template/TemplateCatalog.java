package com.questrail.junction.internal.template;

import java.util.Objects;

/**
 * TemplateCatalog
 * =============================================================================
 * The seven transition templates. Each template is a pure function from
 * pre-built fragments to a single-line logic code.
 *
 * <h2>Vocabulary</h2>
 * <ul>
 *   <li>{@code EG_x}          – extension-green flag of stage {@code x}</li>
 *   <li>{@code GT(x)}         – elapsed green time of stage {@code x}</li>
 *   <li>{@code PL}            – priority level currently requested</li>
 *   <li>{@code AT_greater}, {@code AT_less} – arrival-time window tests
 *       against a path ending in a j-marker</li>
 *   <li>{@code WTG(path)}     – wait-to-go along a stage path</li>
 *   <li>{@code CloseL}, {@code LIG} – LRT closing and Lig-staging checks</li>
 * </ul>
 *
 * Fragment assembly (suffix decoration, reachability, demand) is done by the
 * caller. Nothing here looks at the topology.
 */
public final class TemplateCatalog
{
    /** Logic code of a Lig-to-vehicle transition without demand. */
    public static final String NO_LOGIC = "NO_LOGIC";

    private TemplateCatalog() {}

    // ---------------------------------------------------------------------
    // Fragments
    // ---------------------------------------------------------------------

    /**
     * @param atTarget        target with suffix, e.g. {@code Bcpn}
     * @param atLrtMarker     j-marker of the nearest LRT, e.g. {@code jL39}
     * @param bypassPath      wait path after {@code current_}, e.g. {@code L30_DQ_Bcpn_A0}
     * @param forcePath       force-move path after {@code current_}, e.g. {@code Bcpn_A0}
     * @param targetHasOutgoingLrt selects between the two skeletons
     */
    public record VehicleToVehicle(String current, String greenTime, String demand,
                                   String atTarget, String atLrtMarker,
                                   String bypassPath, String forcePath,
                                   boolean targetHasOutgoingLrt) {}

    /**
     * @param wtgRest         wait path after the LRT target, e.g. {@code DQ_Bcpn_A0}
     * @param nextVehicleAtPath next vehicle with suffix and its j-marker, e.g. {@code Bcpn_jL31}
     */
    public record VehicleToLrtEntry(String current, String lrtTarget, String greenTime,
                                    String wtgRest, String nextVehicleAtPath) {}

    public record VehicleToLrtAnchor(String current, String lrtAnchor, String greenTime) {}

    /**
     * @param atPath  target with suffix and j-marker, e.g. {@code Bcpn_jL31}
     * @param wtgPath path after {@code DQ_}; the bare target when it is last
     */
    public record LrtToVehicle(String current, String target, String atPath,
                               String wtgPath, String demand) {}

    /**
     * @param atPath  Lig, next vehicle with suffix, j-marker: {@code A30_Bcpn_jL31}
     * @param wtgPath Lig followed by the path to the anchor: {@code A30_Bcpn_Ccpn_A0}
     */
    public record LrtToLig(String current, String lig, String greenTime,
                           String atPath, String wtgPath) {}

    /**
     * @param nextVehicleAtPath next vehicle with suffix and the target's j-marker
     */
    public record LrtToLrt(String current, String lrtTarget, String nextVehicleAtPath) {}

    // ---------------------------------------------------------------------
    // Templates
    // ---------------------------------------------------------------------

    /** Template A: vehicle to vehicle. */
    public static String vehicleToVehicle(VehicleToVehicle f) {
        Objects.requireNonNull(f, "fragments");
        String c = f.current();
        String atPath = c + "_" + f.atTarget() + "_" + f.atLrtMarker();

        String atGreater = f.targetHasOutgoingLrt()
                ? "AT_greater(1, ge, " + atPath + ") and EG_" + c + "=true"
                : "EG_" + c + "=true and AT_greater(1, gt, " + atPath + ")";
        String atLess = "AT_less(1, le, " + atPath + ") and WTG(" + c + "_" + f.bypassPath() + ")=false";

        String core = "(PL=0 and EG_" + c + "=true) "
                + "or (PL>0 and GT(" + c + ") >= " + f.greenTime() + " and "
                + "((" + atGreater + ") or (" + atLess + "))) "
                + "or WTG(" + c + "_" + f.forcePath() + ")=false";

        return f.demand().isEmpty() ? core : f.demand() + " and (" + core + ")";
    }

    /** Template B: vehicle to a non-anchor LRT stage. */
    public static String vehicleToLrtEntry(VehicleToLrtEntry f) {
        Objects.requireNonNull(f, "fragments");
        String c = f.current();
        return "WTG(" + c + "_" + f.lrtTarget() + "_" + f.wtgRest() + ")=true "
                + "and ((GT(" + c + ") >= " + f.greenTime()
                + " and AT_less(0, le, " + c + "_" + jMarker(f.lrtTarget()) + ")) "
                + "or (EG_" + c + "=true and AT_less(0, le, " + c + "_" + f.nextVehicleAtPath() + ")))";
    }

    /** Template C: vehicle to the LRT anchor. */
    public static String vehicleToLrtAnchor(VehicleToLrtAnchor f) {
        Objects.requireNonNull(f, "fragments");
        String c = f.current();
        return "WTG(" + c + "_" + f.lrtAnchor() + ")=true "
                + "and (GT(" + c + ") >= " + f.greenTime()
                + " and AT_less(0, le, " + c + "_" + jMarker(f.lrtAnchor()) + "))";
    }

    /** Template D: LRT to vehicle. No green-time check. */
    public static String lrtToVehicle(LrtToVehicle f) {
        Objects.requireNonNull(f, "fragments");
        String c = f.current();
        String close = "CloseL(" + f.target() + ") and LIG(" + f.target() + ")=false";
        String inner = "(AT_greater(1, ge, " + c + "_" + f.atPath() + ") "
                + "or WTG(" + c + "_DQ_" + f.wtgPath() + ")=false)";
        if (f.demand().isEmpty()) {
            return close + " and " + inner;
        }
        return close + " and " + f.demand() + " and " + inner;
    }

    /** Template E: LRT to its Lig stage. */
    public static String lrtToLig(LrtToLig f) {
        Objects.requireNonNull(f, "fragments");
        String c = f.current();
        return "CloseL(" + f.lig() + ") and LIG(" + f.lig() + ")=true and "
                + "((GT(" + c + ") >= " + f.greenTime()
                + " and AT_greater(1, ge, " + c + "_" + f.atPath() + ")) "
                + "or WTG(" + c + "_DQ_" + f.wtgPath() + ")=false)";
    }

    /** Template F: Lig to vehicle. The logic is the demand alone. */
    public static String ligToVehicle(String demand) {
        Objects.requireNonNull(demand, "demand");
        return demand.isEmpty() ? NO_LOGIC : demand;
    }

    /** Template G: LRT to LRT. */
    public static String lrtToLrt(LrtToLrt f) {
        Objects.requireNonNull(f, "fragments");
        String c = f.current();
        return "(EG_" + c + "=true and AT_less(0, le, " + c + "_" + jMarker(f.lrtTarget()) + ")) "
                + "or (WTG(" + c + "_" + f.lrtTarget() + ")=true "
                + "and AT_less(0, ls, " + c + "_" + f.nextVehicleAtPath() + "))";
    }

    /**
     * @return the j-marker referencing an LRT stage, e.g. {@code L39 -> jL39}
     */
    public static String jMarker(String lrtStage) {
        return "j" + lrtStage;
    }
}
