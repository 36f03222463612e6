package com.questrail.junction.observability;

import com.questrail.junction.api.TemplateCode;

/**
 * A transition compiled successfully.
 */
public record RowCompiledEvent(
    int sequence,
    String from,
    String to,
    TemplateCode template
) {
}
