package com.metrocrawler.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({ "id", "line", "names", "open_time", "status", "geo_positions", "height", "connections", "site_links" })
public class StationDocument {

    // "<line-id>/<short-id>"
    private String id;

    private String line;

    @Builder.Default
    private Map<String, String> names = new LinkedHashMap<>();

    @JsonProperty("open_time")
    @Builder.Default
    private String openTime = "";

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private StationStatus status;

    // [latitude, longitude], empty when unknown
    @JsonProperty("geo_positions")
    @Builder.Default
    private List<String> geoPositions = new ArrayList<>();

    // Metres, negative below the surface
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Double height;

    @Builder.Default
    private List<ConnectionDocument> connections = new ArrayList<>();

    // One single-entry map per site: {"enwiki": "Baker Street tube station"}
    @JsonProperty("site_links")
    @Builder.Default
    private List<Map<String, String>> siteLinks = new ArrayList<>();
}
