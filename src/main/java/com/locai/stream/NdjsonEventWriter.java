package com.locai.stream;

import com.locai.workflow.runtime.CancellationToken;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes each event as one newline-terminated JSON line and flushes immediately.
 * A failed write means the client went away: the run's token is cancelled and later events are dropped.
 * <p>
 * A disconnect is only noticed when the next event is written. A model call or tool dispatch that emits
 * nothing keeps running until it returns or its step deadline passes, so an aborted client can leave the
 * run working for up to one step timeout.
 */
@Slf4j
public class NdjsonEventWriter implements WorkflowEventEmitter {

    private final OutputStream out;
    private final WorkflowEventCodec codec;
    private final CancellationToken token;
    private boolean closed;

    public NdjsonEventWriter(OutputStream out, WorkflowEventCodec codec, CancellationToken token) {
        this.out = out;
        this.codec = codec;
        this.token = token;
    }

    @Override
    public synchronized void emit(WorkflowEvent event) {
        if (closed) {
            log.debug("Dropping {} event, client disconnected", event.type());
            return;
        }
        byte[] line = (codec.encode(event) + "\n").getBytes(StandardCharsets.UTF_8);
        try {
            out.write(line);
            out.flush();
        } catch (IOException ex) {
            closed = true;
            log.info("Event stream closed by client ({}), cancelling run", ex.getMessage());
            token.cancel("Client disconnected");
        }
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
