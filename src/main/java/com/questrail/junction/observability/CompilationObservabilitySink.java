package com.questrail.junction.observability;

/**
 * Receives observability events emitted while a junction is compiled.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface CompilationObservabilitySink {
    /**
     * Called after a row compiled to a logic code.
     * @param event the compiled row
     */
    void onRowCompiled(RowCompiledEvent event);

    /**
     * Called after a row was turned into an error row.
     * @param event the failure details
     */
    void onRowFailed(RowFailedEvent event);

    /**
     * Called when whole-graph validation rejects the topology.
     * @param event the offending stage and message
     */
    void onTopologyRejected(TopologyRejectedEvent event);
}
