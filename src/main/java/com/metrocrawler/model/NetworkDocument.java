package com.metrocrawler.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The harvested network: one system, its lines and their stations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NetworkDocument {
    private String id;

    @Builder.Default
    private List<StationDocument> stations = new ArrayList<>();

    @Builder.Default
    private List<LineDocument> lines = new ArrayList<>();
}
