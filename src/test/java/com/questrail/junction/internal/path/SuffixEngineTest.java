package com.questrail.junction.internal.path;

import com.questrail.junction.api.MinType;
import com.questrail.junction.api.Stage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SuffixEngineTest
{
    private final SuffixEngine engine = new SuffixEngine(Map.of(
            "B", Stage.of("B", MinType.CPN),
            "C", Stage.of("C", MinType.CPN),
            "D", Stage.of("D", MinType.SAF),
            "A0", Stage.of("A0", MinType.MIN)));

    @Test
    void suffixFollowsMinTypeAndDefaultsToMin()
    {
        assertEquals("Bcpn", engine.applySuffix("B"));
        assertEquals("Dsaf", engine.applySuffix("D"));
        assertEquals("Xmin", engine.applySuffix("X"));
    }

    @Test
    void lastElementIsBare()
    {
        assertEquals("Bcpn_Ccpn_A0", engine.renderTail(List.of("B", "C", "A0")));
        assertEquals("Bcpn_C", engine.renderTail(List.of("B", "C")));
    }

    @Test
    void lrtLigAndDequeueStayBareMidPath()
    {
        assertEquals("L30_Ccpn_A0", engine.renderTail(List.of("L30", "C", "A0")));
        assertEquals("A30_Bcpn_A0", engine.renderTail(List.of("A30", "B", "A0")));
        assertEquals("DQ_Bcpn_A0", engine.renderTail(List.of("DQ", "B", "A0")));
    }

    @Test
    void shortTails()
    {
        assertEquals("B", engine.renderTail(List.of("B")));
        assertEquals("", engine.renderTail(List.of()));
    }

    @Test
    void greenTimeFunctionDependsOnMinType()
    {
        assertEquals("GTcpmin(B)", engine.greenTimeFunction("B"));
        assertEquals("GTmin_A0", engine.greenTimeFunction("A0"));
        assertEquals("GTmin_D", engine.greenTimeFunction("D"));
        assertEquals("GTmin_L30", engine.greenTimeFunction("L30"));
    }
}
