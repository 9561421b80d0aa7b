package com.metrocrawler.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metrocrawler.model.NetworkDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
@RequiredArgsConstructor
@Slf4j
public class NetworkDocumentWriter {

    private final ObjectMapper objectMapper;

    /**
     * Writes {@code <directory>/<system-id>.json}, creating the directory if
     * needed, and returns the file written.
     */
    public Path write(NetworkDocument document, Path directory) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve(document.getId() + ".json");
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, document);
        }
        log.info("💾 Network {} written to {}", document.getId(), file);
        return file;
    }
}
