package com.questrail.junction.api;

import java.util.Objects;

/**
 * RowOutcome
 * -----------------------------------------------------------------------------
 * Result of compiling a single transition.
 *
 * A row either carries a logic code or a diagnostic message. The two cases are
 * kept structurally distinct so that callers never have to inspect the text of
 * a logic code to find out whether compilation succeeded.
 */
public sealed interface RowOutcome
        permits RowOutcome.Compiled, RowOutcome.Failed
{
    /** Prefix used by {@link #displayText()} for failed rows. */
    String ERROR_PREFIX = "ERROR: ";

    /**
     * @return the logic code, or {@code ERROR: <message>} for a failed row
     */
    String displayText();

    default boolean isSuccess() {
        return this instanceof Compiled;
    }

    /** The transition compiled to a single-line logic code. */
    record Compiled(String logicCode) implements RowOutcome {
        public Compiled {
            Objects.requireNonNull(logicCode, "logicCode");
        }

        @Override
        public String displayText() {
            return logicCode;
        }
    }

    /** The transition could not be compiled; the rest of the batch is unaffected. */
    record Failed(String message) implements RowOutcome {
        public Failed {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public String displayText() {
            return ERROR_PREFIX + message;
        }
    }
}
