package com.questrail.junction.config;

import com.questrail.junction.observability.CompilationObservabilitySink;
import com.questrail.junction.observability.NullCompilationObservabilitySink;

import java.util.Objects;

/**
 * Configuration of a {@code JunctionCompiler}.
 *
 * <ul>
 *   <li><b>firstRowNumber</b>: sequence number of the first output row. The
 *       default of 2 lines rows up with a table whose first line is a header.</li>
 *   <li><b>observabilitySink</b>: receives per-row and topology events.</li>
 * </ul>
 */
public record JunctionCompilerConfig(
    int firstRowNumber,
    CompilationObservabilitySink observabilitySink
) {
    public static final int DEFAULT_FIRST_ROW_NUMBER = 2;

    public JunctionCompilerConfig {
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        if (firstRowNumber < 0) {
            throw new IllegalArgumentException("firstRowNumber must be non-negative");
        }
    }

    public static JunctionCompilerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int firstRowNumber = DEFAULT_FIRST_ROW_NUMBER;
        private CompilationObservabilitySink observabilitySink = NullCompilationObservabilitySink.INSTANCE;

        public Builder withFirstRowNumber(int firstRowNumber) {
            this.firstRowNumber = firstRowNumber;
            return this;
        }

        public Builder withObservabilitySink(CompilationObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public JunctionCompilerConfig build() {
            return new JunctionCompilerConfig(firstRowNumber, observabilitySink);
        }
    }
}
