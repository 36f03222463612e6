package com.questrail.junction.observability;

/**
 * The transition graph failed validation; no rows were produced.
 */
public record TopologyRejectedEvent(
    String stage,
    String message
) {
}
