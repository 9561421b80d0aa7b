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
public class CrawlReport {
    private NetworkDocument document;

    @Builder.Default
    private List<CrawlDiagnostic> diagnostics = new ArrayList<>();

    private long durationMs;
}
