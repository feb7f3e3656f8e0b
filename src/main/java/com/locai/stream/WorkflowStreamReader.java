package com.locai.stream;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Consumer side of the event stream. Reads newline-delimited records in arrival order and hands
 * each decoded event to a listener. Lines that do not decode are skipped, counted and logged so a
 * broken producer shows up instead of silently thinning the stream.
 */
@Slf4j
public class WorkflowStreamReader {

    private final WorkflowEventCodec codec;

    public WorkflowStreamReader(WorkflowEventCodec codec) {
        this.codec = codec;
    }

    public ReadStats read(InputStream in, Consumer<WorkflowEvent> listener) {
        return read(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)), listener);
    }

    public ReadStats read(BufferedReader reader, Consumer<WorkflowEvent> listener) {
        int events = 0;
        int dropped = 0;
        int lineNumber = 0;
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                WorkflowEvent event;
                try {
                    event = codec.decode(line);
                } catch (MalformedEventException ex) {
                    dropped++;
                    log.warn("Skipping malformed event line {} ({}): {}", lineNumber, ex.getMessage(),
                            line.length() > 200 ? line.substring(0, 200) + "..." : line);
                    continue;
                }
                events++;
                listener.accept(event);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read workflow event stream", ex);
        }
        if (dropped > 0) {
            log.warn("Event stream finished with {} malformed line(s) dropped out of {}", dropped, events + dropped);
        }
        return new ReadStats(events, dropped);
    }

    public record ReadStats(int events, int droppedLines) {
    }
}
