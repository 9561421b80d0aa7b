package com.metrocrawler.config;

import com.metrocrawler.model.CrawlSettings;
import com.metrocrawler.model.IdStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.stream.Collectors;

@Configuration
@Slf4j
public class CrawlConfig {

    @Value("${metro.crawl.id-strategy:ENTITY_ID}")
    private IdStrategy idStrategy;

    @Value("${metro.crawl.local-languages:}")
    private String localLanguages;

    @Value("${metro.crawl.parallelism:1}")
    private int parallelism;

    @Value("${metro.crawl.follow-station-lines:false}")
    private boolean followStationLines;

    @Value("${metro.crawl.max-entities:0}")
    private int maxEntities;

    @Bean
    public CrawlSettings crawlSettings() {
        CrawlSettings settings = CrawlSettings.builder()
                .idStrategy(idStrategy)
                .localLanguages(Arrays.stream(localLanguages.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .collect(Collectors.toList()))
                .parallelism(Math.max(1, parallelism))
                .followStationLines(followStationLines)
                .maxEntities(Math.max(0, maxEntities))
                .build();
        log.info("⚙️ Crawl settings: {}", settings);
        return settings;
    }
}
