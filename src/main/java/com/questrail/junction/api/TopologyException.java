package com.questrail.junction.api;

import java.util.Objects;

/**
 * Indicates that the transition graph as a whole is unusable, e.g. a stage is
 * reachable but has no outgoing transitions.
 *
 * No rows are produced when this is raised.
 */
public final class TopologyException extends JunctionCompileException
{
    private final String stage;

    public TopologyException(String stage, String message) {
        super(message);
        this.stage = Objects.requireNonNull(stage, "stage");
    }

    /**
     * @return the offending stage
     */
    public String stage() {
        return stage;
    }
}
