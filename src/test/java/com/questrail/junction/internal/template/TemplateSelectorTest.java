package com.questrail.junction.internal.template;

import com.questrail.junction.api.StageCategory;
import com.questrail.junction.api.TemplateCode;
import com.questrail.junction.api.UnknownTransitionException;
import org.junit.jupiter.api.Test;

import static com.questrail.junction.api.StageCategory.*;
import static org.junit.jupiter.api.Assertions.*;

final class TemplateSelectorTest
{
    private static TemplateCode select(StageCategory from, StageCategory to) {
        return TemplateSelector.select("x", from, "y", to);
    }

    @Test
    void vehicleSide()
    {
        assertEquals(TemplateCode.A, select(VEHICLE, VEHICLE));
        assertEquals(TemplateCode.B, select(VEHICLE, LRT_ENTRY));
        assertEquals(TemplateCode.C, select(VEHICLE, LRT_ANCHOR));
    }

    @Test
    void lrtCategoriesCollapseOnTheFromSide()
    {
        for (StageCategory lrt : new StageCategory[] { LRT_ENTRY, LRT_ANCHOR }) {
            assertEquals(TemplateCode.D, select(lrt, VEHICLE));
            assertEquals(TemplateCode.E, select(lrt, LIG));
            assertEquals(TemplateCode.G, select(lrt, LRT_ENTRY));
            assertEquals(TemplateCode.G, select(lrt, LRT_ANCHOR));
        }
    }

    @Test
    void ligOnlyLeadsToVehicle()
    {
        assertEquals(TemplateCode.F, select(LIG, VEHICLE));
        assertThrows(UnknownTransitionException.class, () -> select(LIG, LIG));
        assertThrows(UnknownTransitionException.class, () -> select(LIG, LRT_ENTRY));
    }

    @Test
    void unknownPairNamesBothStages()
    {
        UnknownTransitionException e = assertThrows(UnknownTransitionException.class,
                () -> TemplateSelector.select("B", VEHICLE, "A30", LIG));

        assertEquals("No template for transition (B:vehicle) -> (A30:lig)", e.getMessage());
    }
}
