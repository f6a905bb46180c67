package com.github.anirbanmu.shardline.transport;

import com.github.anirbanmu.shardline.util.Http;
import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

// java.net.http websocket. reassembles fragmented messages before handing them to the listener.
public class JdkWebSocketTransport implements Transport {
    private static final long SEND_TIMEOUT_MS = 10_000;

    private final HttpClient client;

    public JdkWebSocketTransport() {
        this(Http.CLIENT);
    }

    public JdkWebSocketTransport(HttpClient client) {
        this.client = client;
    }

    @Override
    public TransportSession open(URI uri, Duration handshakeTimeout, TransportListener listener) throws TransportException, InterruptedException {
        CompletableFuture<WebSocket> pending = client.newWebSocketBuilder()
            .connectTimeout(handshakeTimeout)
            .buildAsync(uri, new Adapter(listener));
        try {
            return new Session(pending.get(handshakeTimeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (ExecutionException ex) {
            throw new TransportException("websocket handshake failed: " + uri.getHost(), ex.getCause());
        } catch (TimeoutException ex) {
            abandon(pending);
            throw new TransportException("websocket handshake timed out after " + handshakeTimeout.toMillis() + "ms", ex);
        } catch (InterruptedException ex) {
            abandon(pending);
            throw ex;
        }
    }

    // a handshake that completes after we gave up must not leave a socket behind
    private static void abandon(CompletableFuture<WebSocket> pending) {
        pending.thenAccept(WebSocket::abort);
        pending.cancel(true);
    }

    private static final class Session implements TransportSession {
        private final WebSocket socket;

        Session(WebSocket socket) {
            this.socket = socket;
        }

        @Override
        public void sendText(String payload) throws TransportException {
            try {
                socket.sendText(payload, true).get(SEND_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (ExecutionException ex) {
                throw new TransportException("send failed", ex.getCause());
            } catch (TimeoutException ex) {
                throw new TransportException("send timed out", ex);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new TransportException("send interrupted", ex);
            } catch (IllegalStateException ex) {
                throw new TransportException("socket not writable", ex);
            }
        }

        @Override
        public void close(int code, String reason) {
            if (!socket.isOutputClosed()) {
                socket.sendClose(code, reason).whenComplete((ws, err) -> socket.abort());
            } else {
                socket.abort();
            }
        }

        @Override
        public void abort() {
            socket.abort();
        }
    }

    private static final class Adapter implements WebSocket.Listener {
        private final TransportListener listener;
        private final StringBuilder textBuffer = new StringBuilder();
        private final ByteArrayOutputStream binaryBuffer = new ByteArrayOutputStream();

        Adapter(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            textBuffer.append(data);
            if (last) {
                listener.onMessage(textBuffer.toString().getBytes(StandardCharsets.UTF_8), false);
                textBuffer.setLength(0);
                textBuffer.trimToSize();
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            byte[] chunk = new byte[data.remaining()];
            data.get(chunk);
            binaryBuffer.write(chunk, 0, chunk.length);
            if (last) {
                listener.onMessage(binaryBuffer.toByteArray(), true);
                binaryBuffer.reset();
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error);
        }
    }
}
