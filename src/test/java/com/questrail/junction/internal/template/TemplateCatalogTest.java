package com.questrail.junction.internal.template;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class TemplateCatalogTest
{
    @Test
    void ligToVehicleIsDemandOrNoLogic()
    {
        assertEquals("NO_LOGIC", TemplateCatalog.ligToVehicle(""));
        assertEquals("IsActive(Pc)", TemplateCatalog.ligToVehicle("IsActive(Pc)"));
    }

    @Test
    void vehicleToVehicleWithOutgoingLrt()
    {
        String code = TemplateCatalog.vehicleToVehicle(new TemplateCatalog.VehicleToVehicle(
                "A0", "GTmin_A0", "", "A1min", "jL39", "L39", "A1min_A0", true));

        assertEquals("(PL=0 and EG_A0=true) or (PL>0 and GT(A0) >= GTmin_A0 and "
                + "((AT_greater(1, ge, A0_A1min_jL39) and EG_A0=true) or "
                + "(AT_less(1, le, A0_A1min_jL39) and WTG(A0_L39)=false))) or WTG(A0_A1min_A0)=false", code);
    }

    @Test
    void vehicleToVehicleWithoutOutgoingLrtUsesStrictComparison()
    {
        String code = TemplateCatalog.vehicleToVehicle(new TemplateCatalog.VehicleToVehicle(
                "B", "GTcpmin(B)", "IsActive(Pc)", "Ccpn", "jL30", "L30_DQ_A0", "C", false));

        assertEquals("IsActive(Pc) and ((PL=0 and EG_B=true) or (PL>0 and GT(B) >= GTcpmin(B) and "
                + "((EG_B=true and AT_greater(1, gt, B_Ccpn_jL30)) or "
                + "(AT_less(1, le, B_Ccpn_jL30) and WTG(B_L30_DQ_A0)=false))) or WTG(B_C)=false)", code);
    }

    @Test
    void vehicleToLrtEntry()
    {
        String code = TemplateCatalog.vehicleToLrtEntry(new TemplateCatalog.VehicleToLrtEntry(
                "A0", "L30", "GTmin_A0", "DQ_Bcpn_A0", "Bcpn_jL31"));

        assertEquals("WTG(A0_L30_DQ_Bcpn_A0)=true and ((GT(A0) >= GTmin_A0 and AT_less(0, le, A0_jL30)) "
                + "or (EG_A0=true and AT_less(0, le, A0_Bcpn_jL31)))", code);
    }

    @Test
    void vehicleToLrtAnchor()
    {
        String code = TemplateCatalog.vehicleToLrtAnchor(
                new TemplateCatalog.VehicleToLrtAnchor("C", "L39", "GTcpmin(C)"));

        assertEquals("WTG(C_L39)=true and (GT(C) >= GTcpmin(C) and AT_less(0, le, C_jL39))", code);
    }

    @Test
    void lrtToVehicleWithAndWithoutDemand()
    {
        assertEquals("CloseL(B) and LIG(B)=false and (AT_greater(1, ge, L30_Bcpn_jL31) "
                        + "or WTG(L30_DQ_Bcpn_A0)=false)",
                TemplateCatalog.lrtToVehicle(new TemplateCatalog.LrtToVehicle(
                        "L30", "B", "Bcpn_jL31", "Bcpn_A0", "")));

        assertEquals("CloseL(A0) and LIG(A0)=false and IsActive(Pa) and (AT_greater(1, ge, L30_A0min_jL30) "
                        + "or WTG(L30_DQ_A0)=false)",
                TemplateCatalog.lrtToVehicle(new TemplateCatalog.LrtToVehicle(
                        "L30", "A0", "A0min_jL30", "A0", "IsActive(Pa)")));
    }

    @Test
    void lrtToLig()
    {
        String code = TemplateCatalog.lrtToLig(new TemplateCatalog.LrtToLig(
                "L30", "A30", "GTmin_L30", "A30_Bcpn_jL31", "A30_Bcpn_Ccpn_A0"));

        assertEquals("CloseL(A30) and LIG(A30)=true and ((GT(L30) >= GTmin_L30 and "
                + "AT_greater(1, ge, L30_A30_Bcpn_jL31)) or WTG(L30_DQ_A30_Bcpn_Ccpn_A0)=false)", code);
    }

    @Test
    void lrtToLrt()
    {
        String code = TemplateCatalog.lrtToLrt(new TemplateCatalog.LrtToLrt("L30", "L39", "Bcpn_jL39"));

        assertEquals("(EG_L30=true and AT_less(0, le, L30_jL39)) or "
                + "(WTG(L30_L39)=true and AT_less(0, ls, L30_Bcpn_jL39))", code);
    }
}
