package com.phillippitts.grillstats.service.stream;

import java.io.IOException;

/**
 * Outbound side of a dashboard connection. {@link #send} may block on network flush and is only
 * called from the dispatch executor, one call at a time per connection.
 */
public interface ClientConnection {

    /**
     * @throws IOException when the client is gone or the write fails
     */
    void send(StreamUpdate update) throws IOException;

    /** Closes the connection. Idempotent. */
    void close();
}
