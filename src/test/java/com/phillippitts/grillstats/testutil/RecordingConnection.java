package com.phillippitts.grillstats.testutil;

import com.phillippitts.grillstats.service.stream.ClientConnection;
import com.phillippitts.grillstats.service.stream.StreamUpdate;
import com.phillippitts.grillstats.service.stream.UpdateType;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ClientConnection that records what it was sent. Can be told to fail, to simulate a client
 * that went away.
 */
public class RecordingConnection implements ClientConnection {

    public final List<StreamUpdate> received = new CopyOnWriteArrayList<>();
    public volatile boolean failSends;
    public volatile boolean closed;

    @Override
    public void send(StreamUpdate update) throws IOException {
        if (failSends) {
            throw new IOException("Broken pipe");
        }
        received.add(update);
    }

    @Override
    public void close() {
        closed = true;
    }

    public List<UpdateType> types() {
        return received.stream().map(StreamUpdate::type).toList();
    }

    public List<Long> sequences() {
        return received.stream().map(StreamUpdate::sequence).toList();
    }
}
