package com.questrail.junction.internal.template;

import com.questrail.junction.api.StageCategory;
import com.questrail.junction.api.TemplateCode;
import com.questrail.junction.api.UnknownTransitionException;

/**
 * Chooses the template for a transition from the categories of its two stages.
 *
 * <pre>
 *   vehicle -> vehicle     A
 *   vehicle -> lrt-entry   B
 *   vehicle -> lrt-anchor  C
 *   lrt     -> vehicle     D
 *   lrt     -> lig         E
 *   lig     -> vehicle     F
 *   lrt     -> lrt         G
 * </pre>
 *
 * On the from side both LRT categories behave the same.
 */
public final class TemplateSelector
{
    private TemplateSelector() {}

    /**
     * @throws UnknownTransitionException if no template covers the pair
     */
    public static TemplateCode select(String from, StageCategory fromCategory,
                                      String to, StageCategory toCategory) {
        TemplateCode code = switch (fromCategory) {
            case VEHICLE -> switch (toCategory) {
                case VEHICLE -> TemplateCode.A;
                case LRT_ENTRY -> TemplateCode.B;
                case LRT_ANCHOR -> TemplateCode.C;
                case LIG -> null;
            };
            case LRT_ENTRY, LRT_ANCHOR -> switch (toCategory) {
                case VEHICLE -> TemplateCode.D;
                case LIG -> TemplateCode.E;
                case LRT_ENTRY, LRT_ANCHOR -> TemplateCode.G;
            };
            case LIG -> toCategory == StageCategory.VEHICLE ? TemplateCode.F : null;
        };

        if (code == null) {
            throw new UnknownTransitionException(from, fromCategory, to, toCategory);
        }
        return code;
    }
}
