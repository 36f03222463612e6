package com.questrail.junction.observability;

/**
 * No-op implementation of CompilationObservabilitySink.
 */
public final class NullCompilationObservabilitySink implements CompilationObservabilitySink {
    public static final NullCompilationObservabilitySink INSTANCE = new NullCompilationObservabilitySink();

    private NullCompilationObservabilitySink() {}

    @Override
    public void onRowCompiled(RowCompiledEvent event) {}

    @Override
    public void onRowFailed(RowFailedEvent event) {}

    @Override
    public void onTopologyRejected(TopologyRejectedEvent event) {}
}
