package com.questrail.junction.observability;

import com.questrail.junction.api.TemplateCode;

/**
 * A transition could not be compiled and was emitted as an error row.
 *
 * {@code template} is {@code null} when no template could be selected.
 */
public record RowFailedEvent(
    int sequence,
    String from,
    String to,
    TemplateCode template,
    String message,
    Throwable cause
) {
}
