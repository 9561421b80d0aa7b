package com.metrocrawler.runner;

import com.metrocrawler.exception.CrawlException;
import com.metrocrawler.model.CrawlReport;
import com.metrocrawler.service.NetworkDocumentWriter;
import com.metrocrawler.service.NetworkService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * One-shot crawl from the command line:
 * {@code --system-id=Q5499 --station-id=Q1811956 [--output=out]}.
 * Without {@code --system-id} the application just serves the HTTP API.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CrawlCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String OPTION_SYSTEM_ID = "system-id";
    static final String OPTION_STATION_ID = "station-id";
    static final String OPTION_OUTPUT = "output";

    static final int EXIT_CRAWL_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final NetworkService networkService;
    private final NetworkDocumentWriter documentWriter;

    @Value("${metro.output.directory:out}")
    private String defaultOutputDirectory;

    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(OPTION_SYSTEM_ID)) {
            return;
        }
        String systemId = singleValue(args, OPTION_SYSTEM_ID);
        String stationId = singleValue(args, OPTION_STATION_ID);
        if (systemId == null || stationId == null) {
            log.error("❌ Usage: --system-id=<Wikidata id> --station-id=<Wikidata id> [--output=<directory>]");
            exitCode = EXIT_USAGE;
            return;
        }
        String output = singleValue(args, OPTION_OUTPUT);
        Path directory = Path.of(output != null ? output : defaultOutputDirectory);

        try {
            CrawlReport report = networkService.harvest(systemId, stationId);
            documentWriter.write(report.getDocument(), directory);
        } catch (CrawlException e) {
            log.error("❌ Crawl failed [{}]: {}", e.getReason(), e.getMessage());
            exitCode = EXIT_CRAWL_FAILED;
        } catch (IOException e) {
            log.error("❌ Cannot write network document to {}", directory, e);
            exitCode = EXIT_CRAWL_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static String singleValue(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0).trim();
    }
}
