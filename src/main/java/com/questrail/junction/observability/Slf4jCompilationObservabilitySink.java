package com.questrail.junction.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of CompilationObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCompilationObservabilitySink implements CompilationObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCompilationObservabilitySink.class);

    @Override
    public void onRowCompiled(RowCompiledEvent event) {
        log.debug("Row {}: {} -> {} compiled with template {}",
            event.sequence(), event.from(), event.to(), event.template());
    }

    @Override
    public void onRowFailed(RowFailedEvent event) {
        log.warn("Row {}: {} -> {} failed: {}",
            event.sequence(), event.from(), event.to(), event.message());
        if (event.cause() != null) {
            log.debug("Row {} failure cause", event.sequence(), event.cause());
        }
    }

    @Override
    public void onTopologyRejected(TopologyRejectedEvent event) {
        log.error("Topology rejected at stage {}: {}", event.stage(), event.message());
    }
}
