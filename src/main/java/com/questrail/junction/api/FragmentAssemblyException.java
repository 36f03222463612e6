package com.questrail.junction.api;

/**
 * A path fragment required by a template could not be assembled, for example
 * because the rest-of-skeleton text is malformed or no LRT stage is reachable.
 */
public final class FragmentAssemblyException extends JunctionCompileException
{
    public FragmentAssemblyException(String message) {
        super(message);
    }

    public FragmentAssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
