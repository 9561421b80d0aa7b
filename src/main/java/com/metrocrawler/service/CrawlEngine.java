package com.metrocrawler.service;

import com.metrocrawler.exception.ExpansionException;
import com.metrocrawler.exception.ResolutionException;
import com.metrocrawler.exception.SeedException;
import com.metrocrawler.model.ConnectionType;
import com.metrocrawler.model.CrawlResult;
import com.metrocrawler.model.CrawlSettings;
import com.metrocrawler.model.EntityKind;
import com.metrocrawler.model.EntityRef;
import com.metrocrawler.model.RelationKind;
import com.metrocrawler.model.ResolvedAttributes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Breadth-first crawl of a transport system, starting from the system entity
 * and one of its stations.
 * <p>
 * Lines come from the system ({@code LINES_OF_SYSTEM}) and from the seed
 * station ({@code LINES_OF_STATION}); stations come from the lines they are
 * part of and belong to the first line that lists them. Station-to-station
 * relations are recorded as connections but never enqueue new stations, so a
 * connection to a station outside every discovered line is dropped later by
 * the {@link GraphAssembler}. The visited set guarantees every entity is
 * expanded at most once, whatever cycles the graph has; an item Wikidata
 * merged into another is kept under the surviving id only.
 * <p>
 * A failure on any single entity removes that entity from the result and is
 * recorded as a diagnostic. Only the two seeds are fatal.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CrawlEngine {

    private static final int PROGRESS_INTERVAL = 50;

    private final EntityResolver entityResolver;
    private final RelationExpander relationExpander;
    private final CrawlSettings settings;

    /**
     * @throws SeedException when the system or the seed station cannot be
     *                       resolved
     */
    public CrawlResult crawl(String systemId, String seedStationId) {
        EntityRef system = EntityRef.system(systemId);
        EntityRef seedStation = EntityRef.station(seedStationId);

        ResolvedAttributes systemAttributes = resolveSeed(system, SeedException.Kind.SYSTEM_NOT_FOUND);
        ResolvedAttributes seedStationAttributes = resolveSeed(seedStation, SeedException.Kind.STATION_NOT_FOUND);

        system = systemAttributes.getRef();
        seedStation = seedStationAttributes.getRef();
        Map<String, ResolvedAttributes> prefetched = new HashMap<>();
        prefetched.put(seedStationId, seedStationAttributes);
        prefetched.put(seedStation.getId(), seedStationAttributes);

        IdentifierAssigner identifiers = new IdentifierAssigner(settings.getIdStrategy(),
                settings.getLocalLanguages());
        String systemLocalId = identifiers.assignSystem(system, systemAttributes);
        CrawlState state = new CrawlState(settings.getMaxEntities());

        ExecutorService executor = settings.getParallelism() > 1
                ? Executors.newFixedThreadPool(settings.getParallelism())
                : null;
        try {
            Traversal traversal = new Traversal(system, state, identifiers, executor,
                    Collections.unmodifiableMap(prefetched));
            traversal.run(seedStation);
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }

        if (!state.hasStation(seedStation.getId())) {
            log.warn("⚠️ Seed station {} is not on any discovered line", seedStation.getId());
        }
        return state.toResult(system, systemLocalId);
    }

    private ResolvedAttributes resolveSeed(EntityRef seed, SeedException.Kind failure) {
        try {
            return entityResolver.resolve(seed);
        } catch (ResolutionException e) {
            throw new SeedException(failure, seed.getId(), e);
        }
    }

    /**
     * One crawl invocation: the frontier loop plus the per-run collaborators.
     */
    private final class Traversal {

        private final EntityRef system;
        private final CrawlState state;
        private final IdentifierAssigner identifiers;
        private final ExecutorService executor;
        private final Map<String, ResolvedAttributes> prefetched;

        private Traversal(EntityRef system, CrawlState state, IdentifierAssigner identifiers,
                ExecutorService executor, Map<String, ResolvedAttributes> prefetched) {
            this.system = system;
            this.state = state;
            this.identifiers = identifiers;
            this.executor = executor;
            this.prefetched = prefetched;
        }

        void run(EntityRef seedStation) {
            discoverLines(system, RelationKind.LINES_OF_SYSTEM, false);
            // Lines only reachable from the station side, e.g. shared with another system
            discoverLines(seedStation, RelationKind.LINES_OF_STATION, false);

            while (state.hasPendingWork()) {
                EntityRef next = state.poll();
                if (next.getKind() == EntityKind.LINE) {
                    expandLine(next);
                } else {
                    expandStation(next);
                }
            }
        }

        private void discoverLines(EntityRef from, RelationKind relation, boolean requireSystem) {
            List<EntityRef> lines = expand(from, relation);
            if (lines == null) {
                return;
            }
            for (EntityRef line : lines) {
                if (!state.visit(line)) {
                    continue;
                }
                if (requireSystem && !belongsToSystem(line)) {
                    log.debug("Ignoring {} reached from {}: not part of {}", line, from, system);
                    continue;
                }
                Resolution resolution = resolve(line);
                if (resolution.failure != null) {
                    skip(line, resolution.failure);
                    continue;
                }
                EntityRef canonical = canonical(resolution);
                if (canonical == null) {
                    continue;
                }
                String lineId = identifiers.assignLine(canonical, resolution.attributes);
                state.addLine(canonical, lineId, resolution.attributes);
                reportProblems(canonical, resolution.attributes);
                state.enqueue(canonical);
                log.info("🚇 Line {} ({}) discovered from {}", lineId, canonical.getId(), from);
            }
        }

        private void expandLine(EntityRef line) {
            List<EntityRef> members = expand(line, RelationKind.STATIONS_OF_LINE);
            if (members == null) {
                state.exclude(line);
                return;
            }
            String lineId = identifiers.lookup(line.getId()).orElseThrow();

            // Claim in discovery order before resolving, so ownership never depends on timing
            List<EntityRef> claimed = new ArrayList<>();
            for (EntityRef station : members) {
                if (state.visit(station)) {
                    claimed.add(station);
                }
            }

            for (Resolution resolution : resolveAll(claimed)) {
                if (resolution.failure != null) {
                    skip(resolution.ref, resolution.failure);
                    continue;
                }
                EntityRef canonical = canonical(resolution);
                if (canonical == null) {
                    continue;
                }
                String stationId = identifiers.assignStation(canonical, lineId, resolution.attributes);
                state.addStation(canonical, stationId, lineId, resolution.attributes);
                reportProblems(canonical, resolution.attributes);
                state.enqueue(canonical);
                if (state.countStations() % PROGRESS_INTERVAL == 0) {
                    log.info("📍 {} stations on {} lines so far", state.countStations(), state.countLines());
                }
            }
            log.debug("Line {}: {} listed, {} new", lineId, members.size(), claimed.size());
        }

        private void expandStation(EntityRef station) {
            List<EntityRef> adjacent = expand(station, RelationKind.ADJACENT_STATIONS);
            List<EntityRef> transfers = adjacent != null ? expand(station, RelationKind.CONNECTING_STATIONS) : null;
            if (adjacent == null || transfers == null) {
                state.exclude(station);
                return;
            }
            adjacent.forEach(target -> state.connect(station, target, ConnectionType.ADJACENT));
            transfers.forEach(target -> state.connect(station, target, ConnectionType.TRANSFER));

            if (settings.isFollowStationLines()) {
                discoverLines(station, RelationKind.LINES_OF_STATION, true);
            }
        }

        private boolean belongsToSystem(EntityRef line) {
            if (line.getId().equals(system.getId())) {
                return true;
            }
            List<EntityRef> systems = expand(line, RelationKind.SYSTEMS_OF_LINE);
            return systems != null && systems.stream().anyMatch(s -> s.getId().equals(system.getId()));
        }

        /**
         * The id to keep the resolved entity under, or {@code null} when it was
         * merged into an item that is already part of the crawl.
         */
        private EntityRef canonical(Resolution resolution) {
            EntityRef canonical = resolution.attributes.getRef();
            if (canonical.getId().equals(resolution.ref.getId())) {
                return resolution.ref;
            }
            if (!state.merge(resolution.ref, canonical)) {
                log.debug("{} is a redirect to {}, already crawled", resolution.ref, canonical.getId());
                return null;
            }
            return canonical;
        }

        /**
         * Related entities, or {@code null} after recording the failure.
         */
        private List<EntityRef> expand(EntityRef ref, RelationKind relation) {
            try (Stream<EntityRef> related = relationExpander.expand(ref, relation)) {
                return related.collect(Collectors.toList());
            } catch (ExpansionException e) {
                log.warn("⚠️ Skipping {}: cannot list {}: {}", ref, relation, e.getMessage());
                state.diagnose(ref, e.getReason(), e.getMessage());
                return null;
            }
        }

        private List<Resolution> resolveAll(List<EntityRef> refs) {
            if (executor == null || refs.size() < 2) {
                return refs.stream().map(this::resolve).collect(Collectors.toList());
            }
            List<CompletableFuture<Resolution>> futures = refs.stream()
                    .map(ref -> CompletableFuture.supplyAsync(() -> resolve(ref), executor))
                    .collect(Collectors.toList());
            List<Resolution> resolutions = new ArrayList<>();
            for (CompletableFuture<Resolution> future : futures) {
                try {
                    resolutions.add(future.join());
                } catch (CompletionException e) {
                    throw e.getCause() instanceof RuntimeException ? (RuntimeException) e.getCause() : e;
                }
            }
            return resolutions;
        }

        // Safe to call from worker threads: reads only the immutable prefetched map
        private Resolution resolve(EntityRef ref) {
            ResolvedAttributes known = prefetched.get(ref.getId());
            if (known != null) {
                return new Resolution(ref, known, null);
            }
            try {
                return new Resolution(ref, entityResolver.resolve(ref), null);
            } catch (ResolutionException e) {
                return new Resolution(ref, null, e);
            }
        }

        private void skip(EntityRef ref, ResolutionException failure) {
            log.warn("⚠️ Skipping {}: {}", ref, failure.getMessage());
            state.diagnose(ref, failure.getReason(), failure.getMessage());
        }

        private void reportProblems(EntityRef ref, ResolvedAttributes attributes) {
            for (String problem : attributes.getProblems()) {
                log.warn("⚠️ {}: {}", ref, problem);
                state.diagnose(ref, ResolutionException.Kind.MALFORMED_ATTRIBUTE.name(), problem);
            }
        }
    }

    private static final class Resolution {
        private final EntityRef ref;
        private final ResolvedAttributes attributes;
        private final ResolutionException failure;

        private Resolution(EntityRef ref, ResolvedAttributes attributes, ResolutionException failure) {
            this.ref = ref;
            this.attributes = attributes;
            this.failure = failure;
        }
    }
}
