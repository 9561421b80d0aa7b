package com.metrocrawler.controller;

import com.metrocrawler.model.CrawlReport;
import com.metrocrawler.model.NetworkDocument;
import com.metrocrawler.service.NetworkService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/networks")
@RequiredArgsConstructor
@Tag(name = "Networks", description = "On-demand crawl of a transit network from Wikidata")
public class NetworkController {

    private final NetworkService networkService;

    @Operation(summary = "Crawl Network", description = "Crawls the transport system from its Wikidata item and one of its stations and returns the network document.")
    @ApiResponse(responseCode = "200", description = "Network crawled")
    @ApiResponse(responseCode = "404", description = "A seed entity does not exist")
    @ApiResponse(responseCode = "422", description = "No line could be discovered")
    @GetMapping
    public NetworkDocument getNetwork(
            @Parameter(description = "Wikidata id of the transport system (e.g. Q5499)", required = true) @RequestParam String systemId,
            @Parameter(description = "Wikidata id of one station of the system", required = true) @RequestParam String stationId) {
        return networkService.harvest(systemId, stationId).getDocument();
    }

    @Operation(summary = "Crawl Network With Diagnostics", description = "Same crawl, also returning the entities that were skipped or incomplete.")
    @GetMapping("/report")
    public CrawlReport getReport(
            @Parameter(description = "Wikidata id of the transport system", required = true) @RequestParam String systemId,
            @Parameter(description = "Wikidata id of one station of the system", required = true) @RequestParam String stationId) {
        return networkService.harvest(systemId, stationId);
    }
}
