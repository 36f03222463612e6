package com.questrail.junction.config;

import com.questrail.junction.compiler.JunctionCompiler;
import com.questrail.junction.observability.NullCompilationObservabilitySink;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class JunctionCompilerConfigTest
{
    @Test
    void defaults()
    {
        JunctionCompilerConfig config = JunctionCompilerConfig.defaults();

        assertEquals(2, config.firstRowNumber());
        assertSame(NullCompilationObservabilitySink.INSTANCE, config.observabilitySink());
    }

    @Test
    void rejectsInvalidValues()
    {
        assertThrows(IllegalArgumentException.class,
                () -> JunctionCompilerConfig.builder().withFirstRowNumber(-1).build());
        assertThrows(NullPointerException.class,
                () -> JunctionCompilerConfig.builder().withObservabilitySink(null).build());
        assertThrows(NullPointerException.class, () -> new JunctionCompiler(null));
    }
}
