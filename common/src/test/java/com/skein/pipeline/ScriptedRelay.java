package com.skein.pipeline;

import com.skein.transport.ConnectionLostException;
import com.skein.transport.RelayMessage;
import com.skein.transport.RelayStream;
import com.skein.transport.RelayTransport;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Relay that plays back one script per connection.  A script entry is either a
 * {@link RelayMessage}, or a {@link ConnectionLostException} or {@link RuntimeException}
 * to throw.  Once a script is
 * exhausted the stream blocks until it is closed.
 */
class ScriptedRelay implements RelayTransport {

    private static final Object CLOSED = new Object();

    private final Deque<List<Object>> scripts = new ArrayDeque<>();
    private final List<OptionalLong> connectCursors = Collections.synchronizedList(new ArrayList<>());

    ScriptedRelay connection(Object... entries) {
        scripts.add(List.of(entries));
        return this;
    }

    List<OptionalLong> connectCursors() {
        synchronized (connectCursors) {
            return List.copyOf(connectCursors);
        }
    }

    @Override
    public synchronized RelayStream connect(OptionalLong cursor) {
        connectCursors.add(cursor);
        List<Object> script = scripts.isEmpty() ? List.of() : scripts.poll();
        BlockingQueue<Object> signals = new LinkedBlockingQueue<>(script);
        return new RelayStream() {
            @Override
            public RelayMessage next() throws ConnectionLostException {
                Object signal;
                try {
                    signal = signals.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ConnectionLostException("Interrupted", e);
                }
                if (signal == CLOSED) {
                    signals.add(CLOSED);
                    throw new ConnectionLostException("Stream closed");
                }
                if (signal instanceof ConnectionLostException) {
                    throw (ConnectionLostException) signal;
                }
                if (signal instanceof RuntimeException) {
                    throw (RuntimeException) signal;
                }
                return (RelayMessage) signal;
            }

            @Override
            public void close() {
                signals.add(CLOSED);
            }
        };
    }
}
