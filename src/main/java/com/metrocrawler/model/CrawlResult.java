package com.metrocrawler.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything a finished crawl discovered, in first-discovery order. Connections
 * still point at external ids; some of them may name entities that never made
 * it into {@link #stations}.
 */
@Value
@Builder
public class CrawlResult {

    EntityRef system;
    String systemId;

    @Singular
    List<DiscoveredLine> lines;

    @Singular
    List<DiscoveredStation> stations;

    @Singular
    List<RawConnection> connections;

    @Singular
    List<CrawlDiagnostic> diagnostics;

    @Value
    public static class DiscoveredLine {
        EntityRef ref;
        String localId;
        ResolvedAttributes attributes;
    }

    @Value
    public static class DiscoveredStation {
        EntityRef ref;
        String localId;
        String lineId;
        ResolvedAttributes attributes;
    }

    @Value
    public static class RawConnection {
        String fromId;
        String toId;
        ConnectionType type;
    }
}
