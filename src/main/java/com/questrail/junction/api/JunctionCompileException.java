package com.questrail.junction.api;

/**
 * Base type of all failures raised while compiling a junction.
 *
 * <ul>
 *   <li>{@link TopologyException} is fatal to the whole compile call</li>
 *   <li>{@link UnknownTransitionException} and {@link FragmentAssemblyException}
 *       are scoped to a single row</li>
 * </ul>
 */
public class JunctionCompileException extends RuntimeException
{
    public JunctionCompileException(String message) {
        super(message);
    }

    public JunctionCompileException(String message, Throwable cause) {
        super(message, cause);
    }
}
