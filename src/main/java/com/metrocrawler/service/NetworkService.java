package com.metrocrawler.service;

import com.metrocrawler.model.CrawlDiagnostic;
import com.metrocrawler.model.CrawlReport;
import com.metrocrawler.model.CrawlResult;
import com.metrocrawler.model.NetworkDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class NetworkService {

    private final CrawlEngine crawlEngine;
    private final GraphAssembler graphAssembler;

    /**
     * Crawls the system starting from the two seeds and assembles the network
     * document. Seed and empty-system failures propagate to the caller.
     */
    public CrawlReport harvest(String systemId, String seedStationId) {
        log.info("╔═══════════════════════════════════════════════════════════════════");
        log.info("║ 🚀 CRAWL STARTED | System: {} | Seed station: {}", systemId, seedStationId);
        log.info("╚═══════════════════════════════════════════════════════════════════");
        long startTime = System.currentTimeMillis();

        CrawlResult result = crawlEngine.crawl(systemId, seedStationId);
        NetworkDocument document = graphAssembler.assemble(result);
        long duration = System.currentTimeMillis() - startTime;

        if (!result.getDiagnostics().isEmpty()) {
            log.warn("⚠️ {} entities skipped or incomplete:", result.getDiagnostics().size());
            for (CrawlDiagnostic diagnostic : result.getDiagnostics()) {
                log.warn("   {} {} [{}] {}", diagnostic.getEntityKind(), diagnostic.getEntityId(),
                        diagnostic.getReason(), diagnostic.getMessage());
            }
        }

        log.info("╔═══════════════════════════════════════════════════════════════════");
        log.info("║ ✅ CRAWL COMPLETED | System: {} | Lines: {} | Stations: {} | Warnings: {} | {} ms",
                document.getId(), document.getLines().size(), document.getStations().size(),
                result.getDiagnostics().size(), duration);
        log.info("╚═══════════════════════════════════════════════════════════════════");

        return CrawlReport.builder()
                .document(document)
                .diagnostics(result.getDiagnostics())
                .durationMs(duration)
                .build();
    }
}
