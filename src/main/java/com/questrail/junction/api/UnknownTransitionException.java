package com.questrail.junction.api;

/**
 * No template exists for the classification pair of a transition.
 */
public final class UnknownTransitionException extends JunctionCompileException
{
    public UnknownTransitionException(String from, StageCategory fromCategory,
                                      String to, StageCategory toCategory) {
        super("No template for transition (" + from + ":" + fromCategory.label() + ") -> ("
                + to + ":" + toCategory.label() + ")");
    }
}
