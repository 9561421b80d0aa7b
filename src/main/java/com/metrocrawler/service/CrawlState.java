package com.metrocrawler.service;

import com.metrocrawler.model.ConnectionType;
import com.metrocrawler.model.CrawlDiagnostic;
import com.metrocrawler.model.CrawlResult;
import com.metrocrawler.model.EntityRef;
import com.metrocrawler.model.ResolvedAttributes;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Mutable state of one crawl: visited set, frontier and everything discovered
 * so far. Only ever touched by the crawling thread; never outlives the crawl.
 */
class CrawlState {

    static final String REASON_ENTITY_LIMIT = "ENTITY_LIMIT";

    private final int maxEntities;

    private final Set<String> visited = new HashSet<>();
    private final Deque<EntityRef> frontier = new ArrayDeque<>();
    private final Map<String, CrawlResult.DiscoveredLine> lines = new LinkedHashMap<>();
    private final Map<String, CrawlResult.DiscoveredStation> stations = new LinkedHashMap<>();
    private final List<CrawlResult.RawConnection> connections = new ArrayList<>();
    private final List<CrawlDiagnostic> diagnostics = new ArrayList<>();
    // merged item id -> surviving item id
    private final Map<String, String> aliases = new HashMap<>();
    private boolean limitReported;

    CrawlState(int maxEntities) {
        this.maxEntities = maxEntities;
    }

    /**
     * Marks the entity as visited. Returns {@code false} when it was visited
     * before or when the entity limit has been reached.
     */
    boolean visit(EntityRef ref) {
        if (visited.contains(ref.getId())) {
            return false;
        }
        if (maxEntities > 0 && visited.size() >= maxEntities) {
            if (!limitReported) {
                limitReported = true;
                diagnose(ref, REASON_ENTITY_LIMIT, "entity limit of " + maxEntities + " reached, crawl truncated");
            }
            return false;
        }
        visited.add(ref.getId());
        return true;
    }

    /**
     * Records that {@code requested} resolved to the merged item
     * {@code canonical} and visits the latter. Returns {@code false} when the
     * canonical item was already reached under its own id.
     */
    boolean merge(EntityRef requested, EntityRef canonical) {
        aliases.put(requested.getId(), canonical.getId());
        return visit(canonical);
    }

    String canonicalId(String externalId) {
        return aliases.getOrDefault(externalId, externalId);
    }

    void enqueue(EntityRef ref) {
        frontier.addLast(ref);
    }

    EntityRef poll() {
        return frontier.pollFirst();
    }

    boolean hasPendingWork() {
        return !frontier.isEmpty();
    }

    void addLine(EntityRef ref, String localId, ResolvedAttributes attributes) {
        lines.put(ref.getId(), new CrawlResult.DiscoveredLine(ref, localId, attributes));
    }

    void addStation(EntityRef ref, String localId, String lineId, ResolvedAttributes attributes) {
        stations.put(ref.getId(), new CrawlResult.DiscoveredStation(ref, localId, lineId, attributes));
    }

    /**
     * Drops an already added line or station from the output. It stays visited.
     */
    void exclude(EntityRef ref) {
        lines.remove(ref.getId());
        stations.remove(ref.getId());
    }

    boolean hasStation(String externalId) {
        return stations.containsKey(canonicalId(externalId));
    }

    void connect(EntityRef from, EntityRef to, ConnectionType type) {
        connections.add(new CrawlResult.RawConnection(from.getId(), to.getId(), type));
    }

    void diagnose(EntityRef ref, String reason, String message) {
        diagnostics.add(CrawlDiagnostic.builder()
                .entityId(ref.getId())
                .entityKind(ref.getKind())
                .reason(reason)
                .message(message)
                .build());
    }

    int countLines() {
        return lines.size();
    }

    int countStations() {
        return stations.size();
    }

    CrawlResult toResult(EntityRef system, String systemId) {
        return CrawlResult.builder()
                .system(system)
                .systemId(systemId)
                .lines(lines.values())
                .stations(stations.values())
                .connections(connections.stream()
                        .map(c -> new CrawlResult.RawConnection(canonicalId(c.getFromId()), canonicalId(c.getToId()),
                                c.getType()))
                        .collect(Collectors.toList()))
                .diagnostics(diagnostics)
                .build();
    }
}
