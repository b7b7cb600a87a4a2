package com.architecture.dotspace.service.diagram;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a whole diagram source eagerly as UTF-8 text.
 */
@Component
@Slf4j
public class DiagramSourceReader {

    public String read(Path file) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            log.debug("[pipeline] Read {} characters from {}", content.length(), file);
            return content;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read diagram file " + file, e);
        }
    }

    public String read(InputStream input) {
        try {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read diagram from stream", e);
        }
    }
}
