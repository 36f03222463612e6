package com.questrail.junction.api;

import java.util.List;
import java.util.Objects;

/**
 * Ordered rows produced by one compile call, in transition input order.
 */
public record CompilationResult(List<OutputRow> rows)
{
    public CompilationResult {
        rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
    }

    public List<OutputRow> failedRows() {
        return rows.stream().filter(r -> !r.isSuccess()).toList();
    }

    public boolean hasFailures() {
        return rows.stream().anyMatch(r -> !r.isSuccess());
    }

    public int compiledCount() {
        return (int) rows.stream().filter(OutputRow::isSuccess).count();
    }
}
