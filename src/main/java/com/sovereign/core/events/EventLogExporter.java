package com.sovereign.core.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes an event log snapshot as JSON lines, one event per line, for offline
 * diagnosis of a run. Serializes with the application's {@link ObjectMapper};
 * indentation is always off so every event stays on one line.
 */
public class EventLogExporter {

    private static final Logger log = LoggerFactory.getLogger(EventLogExporter.class);

    private final ObjectWriter writer;

    public EventLogExporter(ObjectMapper objectMapper) {
        this.writer = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJsonLine(SovereignEvent event) {
        try {
            return writer.writeValueAsString(event);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize event " + event.type(), e);
        }
    }

    /**
     * Writes {@code events} to {@code target}, replacing any existing file.
     *
     * @return number of lines written
     */
    public int export(List<SovereignEvent> events, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                for (SovereignEvent event : events) {
                    writer.write(toJsonLine(event));
                    writer.newLine();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write event log to " + target, e);
        }
        log.info("Wrote {} events to {}", events.size(), target);
        return events.size();
    }
}
