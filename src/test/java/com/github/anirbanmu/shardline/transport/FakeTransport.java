package com.github.anirbanmu.shardline.transport;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

// in-memory transport. each open hands back a FakeSession the test drives as the server.
public final class FakeTransport implements Transport {
    private final List<FakeSession> sessions = new CopyOnWriteArrayList<>();
    private final AtomicInteger failuresLeft = new AtomicInteger();
    private volatile Consumer<FakeSession> onOpen = session -> {
    };

    @Override
    public TransportSession open(URI uri, Duration handshakeTimeout, TransportListener listener) throws TransportException {
        if (failuresLeft.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new TransportException("connection refused");
        }
        FakeSession session = new FakeSession(uri, listener);
        sessions.add(session);
        onOpen.accept(session);
        return session;
    }

    // the next n opens fail before a session exists
    public void failNextOpens(int n) {
        failuresLeft.set(n);
    }

    // runs on the opening thread, before open returns
    public void onOpen(Consumer<FakeSession> callback) {
        this.onOpen = callback;
    }

    public List<FakeSession> sessions() {
        return new ArrayList<>(sessions);
    }

    public int openCount() {
        return sessions.size();
    }

    public FakeSession session(int index) {
        return sessions.get(index);
    }

    // waits for the nth (1-based) session to be opened
    public FakeSession awaitSession(int n) {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (sessions.size() < n) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("timed out waiting for session " + n + ", have " + sessions.size());
            }
            sleep();
        }
        return sessions.get(n - 1);
    }

    static void sleep() {
        try {
            Thread.sleep(5);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("interrupted", e);
        }
    }

    public static final class FakeSession implements TransportSession {
        private final URI uri;
        private final TransportListener listener;
        private final List<String> sent = new CopyOnWriteArrayList<>();
        private volatile Integer closeCode;
        private volatile boolean aborted;
        private volatile boolean autoAck;
        private volatile Consumer<String> onSend = payload -> {
        };

        FakeSession(URI uri, TransportListener listener) {
            this.uri = uri;
            this.listener = listener;
        }

        public URI uri() {
            return uri;
        }

        @Override
        public void sendText(String payload) throws TransportException {
            if (isClosed()) {
                throw new TransportException("socket closed");
            }
            sent.add(payload);
            onSend.accept(payload);
            if (autoAck && payload.startsWith("{\"op\":1,")) {
                receive("{\"op\":11}");
            }
        }

        @Override
        public void close(int code, String reason) {
            closeCode = code;
        }

        @Override
        public void abort() {
            aborted = true;
        }

        public boolean isClosed() {
            return aborted || closeCode != null;
        }

        // close code the client sent, null if it didn't send one
        public Integer closeCode() {
            return closeCode;
        }

        public boolean aborted() {
            return aborted;
        }

        public void autoAck(boolean enabled) {
            this.autoAck = enabled;
        }

        public void onSend(Consumer<String> callback) {
            this.onSend = callback;
        }

        public List<String> sent() {
            return new ArrayList<>(sent);
        }

        public List<String> sent(int op) {
            String prefix = "{\"op\":" + op + ",";
            List<String> matching = new ArrayList<>();
            for (String payload : sent) {
                if (payload.startsWith(prefix)) {
                    matching.add(payload);
                }
            }
            return matching;
        }

        // waits for the nth (1-based) payload with this op
        public String awaitSent(int op, int n) {
            long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
            while (sent(op).size() < n) {
                if (System.nanoTime() > deadline) {
                    throw new AssertionError("timed out waiting for op " + op + " #" + n + ", sent " + sent);
                }
                sleep();
            }
            return sent(op).get(n - 1);
        }

        public void receive(String json) {
            listener.onMessage(json.getBytes(StandardCharsets.UTF_8), false);
        }

        public void receiveBinary(byte[] data) {
            listener.onMessage(data, true);
        }

        public void hello(int intervalMs) {
            receive("{\"op\":10,\"d\":{\"heartbeat_interval\":" + intervalMs + "}}");
        }

        public void ready(String sessionId, int seq, String resumeUrl) {
            dispatch("READY", seq, "{\"v\":10,\"session_id\":\"" + sessionId + "\",\"resume_gateway_url\":\"" + resumeUrl + "\",\"guilds\":[]}");
        }

        public void resumed(int seq) {
            dispatch("RESUMED", seq, "{}");
        }

        public void dispatch(String type, int seq, String data) {
            receive("{\"op\":0,\"t\":\"" + type + "\",\"s\":" + seq + ",\"d\":" + data + "}");
        }

        public void ack() {
            receive("{\"op\":11}");
        }

        public void serverClose(int code, String reason) {
            listener.onClosed(code, reason);
        }

        public void fail(Throwable error) {
            listener.onError(error);
        }
    }
}
