package com.questrail.junction.api;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class OutputRowTest
{
    @Test
    void failedRowsRenderWithErrorPrefix()
    {
        OutputRow ok = new OutputRow(2, "A30", "B", TemplateCode.F, new RowOutcome.Compiled("NO_LOGIC"));
        OutputRow bad = new OutputRow(3, "B", "A30", null, new RowOutcome.Failed("No template"));

        assertEquals("NO_LOGIC", ok.logicCodeText());
        assertTrue(ok.isSuccess());
        assertEquals("ERROR: No template", bad.logicCodeText());
        assertFalse(bad.isSuccess());
        assertTrue(bad.template().isEmpty());
    }

    @Test
    void resultViews()
    {
        OutputRow ok = new OutputRow(2, "A30", "B", TemplateCode.F, new RowOutcome.Compiled("NO_LOGIC"));
        OutputRow bad = new OutputRow(3, "B", "A30", null, new RowOutcome.Failed("No template"));

        CompilationResult result = new CompilationResult(List.of(ok, bad));

        assertTrue(result.hasFailures());
        assertEquals(1, result.compiledCount());
        assertEquals(List.of(bad), result.failedRows());
    }
}
