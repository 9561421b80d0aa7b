package com.metrocrawler.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrawlSettings {

    @Builder.Default
    private IdStrategy idStrategy = IdStrategy.ENTITY_ID;

    // Preferred name languages after English, for NAME ids
    @Builder.Default
    private List<String> localLanguages = new ArrayList<>();

    // Threads resolving the stations of one line; 1 keeps the crawl sequential
    @Builder.Default
    private int parallelism = 1;

    private boolean followStationLines;

    // 0 = unlimited
    private int maxEntities;
}
