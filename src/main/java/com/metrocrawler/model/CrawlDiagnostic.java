package com.metrocrawler.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A non-fatal problem met during a crawl. The entity it names is either
 * missing from the output or missing one attribute.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrawlDiagnostic {
    private String entityId;
    private EntityKind entityKind;
    // e.g. NOT_FOUND, TRANSPORT, MALFORMED_ATTRIBUTE, ENTITY_LIMIT
    private String reason;
    private String message;
}
