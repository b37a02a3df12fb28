package com.phillippitts.grillstats.service.stream;

import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ClientConnection} over a Server-Sent Events emitter.
 */
public class SseClientConnection implements ClientConnection {

    private final SseEmitter emitter;
    private final AtomicBoolean closed = new AtomicBoolean();

    public SseClientConnection(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(StreamUpdate update) throws IOException {
        if (closed.get()) {
            throw new IOException("Connection closed");
        }
        SseEmitter.SseEventBuilder event = SseEmitter.event()
                .id(Long.toString(update.sequence()))
                .name(update.type().eventName());
        if (update.payload() != null) {
            event.data(update.payload(), MediaType.APPLICATION_JSON);
        } else {
            event.comment("heartbeat");
        }
        emitter.send(event);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            emitter.complete();
        }
    }

    /**
     * Runs {@code callback} once the emitter completes, times out or fails. The connection is
     * closed before the callback runs.
     */
    public void onTermination(Runnable callback) {
        Runnable terminate = () -> {
            markClosed();
            callback.run();
        };
        emitter.onCompletion(terminate);
        emitter.onTimeout(terminate);
        emitter.onError(error -> terminate.run());
    }

    /** Marks the connection closed without touching the emitter, which the container already finished. */
    void markClosed() {
        closed.set(true);
    }
}
