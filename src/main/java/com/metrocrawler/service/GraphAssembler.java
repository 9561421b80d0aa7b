package com.metrocrawler.service;

import com.metrocrawler.exception.AssemblyException;
import com.metrocrawler.model.ConnectionDocument;
import com.metrocrawler.model.CrawlResult;
import com.metrocrawler.model.LineDocument;
import com.metrocrawler.model.NetworkDocument;
import com.metrocrawler.model.ResolvedAttributes;
import com.metrocrawler.model.StationDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the network document from a finished crawl: stations and lines keep
 * their discovery order, connections are rewritten to local ids and the ones
 * pointing outside the document are dropped.
 */
@Component
@Slf4j
public class GraphAssembler {

    public NetworkDocument assemble(CrawlResult result) {
        if (result.getLines().isEmpty()) {
            throw new AssemblyException(AssemblyException.Kind.EMPTY_SYSTEM, result.getSystem().getId(),
                    "No lines discovered for system " + result.getSystem().getId());
        }

        Map<String, String> stationIds = new HashMap<>();
        for (CrawlResult.DiscoveredStation station : result.getStations()) {
            stationIds.put(station.getRef().getId(), station.getLocalId());
        }

        Map<String, Set<ConnectionDocument>> connections = new HashMap<>();
        int dropped = 0;
        for (CrawlResult.RawConnection connection : result.getConnections()) {
            String from = stationIds.get(connection.getFromId());
            String to = stationIds.get(connection.getToId());
            if (from == null || to == null) {
                dropped++;
                continue;
            }
            if (from.equals(to)) {
                continue;
            }
            connections.computeIfAbsent(from, k -> new LinkedHashSet<>())
                    .add(new ConnectionDocument(to, connection.getType()));
        }
        if (dropped > 0) {
            log.info("✂️ Dropped {} connections to stations outside the network", dropped);
        }

        List<StationDocument> stations = result.getStations().stream()
                .map(station -> toStation(station, connections.get(station.getLocalId())))
                .collect(Collectors.toList());
        List<LineDocument> lines = result.getLines().stream()
                .map(this::toLine)
                .collect(Collectors.toList());

        return NetworkDocument.builder()
                .id(result.getSystemId())
                .stations(stations)
                .lines(lines)
                .build();
    }

    private StationDocument toStation(CrawlResult.DiscoveredStation station, Set<ConnectionDocument> connections) {
        ResolvedAttributes attributes = station.getAttributes();

        List<String> geoPositions = attributes.getGeoPosition()
                .map(position -> List.of(String.valueOf(position.getLatitude()),
                        String.valueOf(position.getLongitude())))
                .orElse(List.of());

        List<Map<String, String>> siteLinks = attributes.getSiteLinks().entrySet().stream()
                .map(siteLink -> Map.of(siteLink.getKey(), siteLink.getValue()))
                .collect(Collectors.toList());

        return StationDocument.builder()
                .id(station.getLocalId())
                .line(station.getLineId())
                .names(new LinkedHashMap<>(attributes.getNames()))
                .openTime(attributes.getOpenDate().map(Object::toString).orElse(""))
                .status(attributes.getStatus().orElse(null))
                .geoPositions(new ArrayList<>(geoPositions))
                .height(attributes.getHeight().orElse(null))
                .connections(connections != null ? new ArrayList<>(connections) : new ArrayList<>())
                .siteLinks(siteLinks)
                .build();
    }

    private LineDocument toLine(CrawlResult.DiscoveredLine line) {
        return LineDocument.builder()
                .id(line.getLocalId())
                .names(new LinkedHashMap<>(line.getAttributes().getNames()))
                .color(line.getAttributes().getColor().orElse(null))
                .build();
    }
}
