package com.metrocrawler.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Attributes of one entity, normalized from the raw Wikidata bundle.
 * Geo-position, height, opening date and status are only filled for stations,
 * color only for lines. {@link #getRef()} is the surviving item when the
 * requested one was merged into another. Attributes that were present but could not be parsed are absent and
 * described in {@link #getProblems()}.
 */
@Getter
@Builder
public class ResolvedAttributes {

    private final EntityRef ref;

    @Singular
    private final Map<String, String> names;

    @Singular
    private final Map<String, String> siteLinks;

    @Getter(AccessLevel.NONE)
    private final GeoPosition geoPosition;

    // Metres relative to the surface, negative underground
    @Getter(AccessLevel.NONE)
    private final Double height;

    @Getter(AccessLevel.NONE)
    private final LocalDate openDate;

    @Getter(AccessLevel.NONE)
    private final StationStatus status;

    @Getter(AccessLevel.NONE)
    private final String color;

    @Singular
    private final List<String> problems;

    public Optional<GeoPosition> getGeoPosition() {
        return Optional.ofNullable(geoPosition);
    }

    public Optional<Double> getHeight() {
        return Optional.ofNullable(height);
    }

    public Optional<StationStatus> getStatus() {
        return Optional.ofNullable(status);
    }

    public Optional<LocalDate> getOpenDate() {
        return Optional.ofNullable(openDate);
    }

    public Optional<String> getColor() {
        return Optional.ofNullable(color);
    }
}
