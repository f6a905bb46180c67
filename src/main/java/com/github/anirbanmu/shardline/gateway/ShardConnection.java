package com.github.anirbanmu.shardline.gateway;

import com.github.anirbanmu.shardline.config.GatewayConfig;
import com.github.anirbanmu.shardline.discord.json.GatewayEvent;
import com.github.anirbanmu.shardline.discord.json.GatewayEventParser.ParseResult;
import com.github.anirbanmu.shardline.discord.json.Identify;
import com.github.anirbanmu.shardline.discord.json.Opcode;
import com.github.anirbanmu.shardline.discord.json.Ready;
import com.github.anirbanmu.shardline.discord.json.RequestGuildMembers;
import com.github.anirbanmu.shardline.discord.json.Resume;
import com.github.anirbanmu.shardline.discord.json.UpdatePresence;
import com.github.anirbanmu.shardline.discord.json.UpdateVoiceState;
import com.github.anirbanmu.shardline.gateway.codec.PayloadCodec;
import com.github.anirbanmu.shardline.gateway.codec.ProtocolException;
import com.github.anirbanmu.shardline.log.Log;
import com.github.anirbanmu.shardline.transport.Transport;
import com.github.anirbanmu.shardline.transport.TransportException;
import com.github.anirbanmu.shardline.transport.TransportListener;
import com.github.anirbanmu.shardline.transport.TransportSession;
import com.github.anirbanmu.shardline.util.Threads;
import java.io.IOException;
import java.net.URI;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleSupplier;

// one gateway shard. a driver thread owns the state machine and drains a queue of signals from the
// transport, heartbeat thread and identify waiter. signals from an older socket are dropped.
public final class ShardConnection {
    private static final long JOIN_TIMEOUT_MS = 5_000;

    private final ShardDescriptor shard;
    private final String token;
    private final String gatewayUrl;
    private final GatewayConfig config;
    private final Transport transport;
    private final IdentifyRateLimiter limiter;
    private final EventBroadcaster events;
    private final Log log;
    private final DoubleSupplier jitter;
    private final Runnable onStopped;
    private final Backoff backoff;

    private final BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();
    private final AtomicLong connectionId = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Object stateLock = new Object();
    private final Object writeLock = new Object();

    private volatile ConnectionState state = ConnectionState.NO_SESSION;
    private volatile SessionInfo session;
    private volatile Thread driver;
    private volatile Thread heartbeatThread;
    private volatile Thread identifyWaiter;

    // guarded by writeLock
    private TransportSession socket;

    // driver thread only
    private PayloadCodec codec;
    private HeartbeatState heartbeat;
    private long readySince;

    // what ended a connection
    private record ConnectionEnd(CloseKind kind, String reason, boolean remote) {
    }

    public ShardConnection(ShardDescriptor shard, String token, String gatewayUrl, GatewayConfig config, Transport transport, IdentifyRateLimiter limiter, EventBroadcaster events, Log log) {
        this(shard, token, gatewayUrl, config, transport, limiter, events, log, Math::random, () -> {
        });
    }

    ShardConnection(ShardDescriptor shard, String token, String gatewayUrl, GatewayConfig config, Transport transport, IdentifyRateLimiter limiter, EventBroadcaster events, Log log, DoubleSupplier jitter) {
        this(shard, token, gatewayUrl, config, transport, limiter, events, log, jitter, () -> {
        });
    }

    // onStopped runs once, on whichever thread moves the shard to STOPPED
    ShardConnection(ShardDescriptor shard, String token, String gatewayUrl, GatewayConfig config, Transport transport, IdentifyRateLimiter limiter, EventBroadcaster events, Log log, DoubleSupplier jitter, Runnable onStopped) {
        this.shard = shard;
        this.token = token;
        this.gatewayUrl = gatewayUrl;
        this.config = config;
        this.transport = transport;
        this.limiter = limiter;
        this.events = events;
        this.log = log;
        this.jitter = jitter;
        this.onStopped = onStopped;
        this.backoff = new Backoff(config.backoffMin(), config.backoffMax());
    }

    public ShardDescriptor shard() {
        return shard;
    }

    public ConnectionState state() {
        return state;
    }

    public long connectionId() {
        return connectionId.get();
    }

    // null when there is nothing to resume
    public SessionInfo session() {
        return session;
    }

    // starts the driver; later calls are no-ops
    public void connect() {
        if (state == ConnectionState.STOPPED) {
            log.warn("gateway.connect_ignored", "reason", "stopped");
            return;
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        driver = Threads.start("shardline-" + shard.name(), this::run);
    }

    // safe from any state and any thread; returns once the driver has exited
    public void disconnect() {
        ConnectionState previous;
        synchronized (stateLock) {
            previous = state;
            state = ConnectionState.STOPPED;
            connectionId.incrementAndGet();
        }
        log.info("gateway.disconnect", "previous", previous);
        limiter.forget(shard.index());

        stopWorkers();
        closeSocket(new ConnectionEnd(CloseKind.NON_RESUMABLE, "disconnect", false));
        session = null;

        Thread d = driver;
        if (d != null && d != Thread.currentThread()) {
            d.interrupt();
            try {
                d.join(JOIN_TIMEOUT_MS);
                if (d.isAlive()) {
                    log.warn("gateway.driver_join_timeout");
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
        if (previous != ConnectionState.STOPPED) {
            onStopped.run();
        }
    }

    public boolean sendPresence(UpdatePresence presence) {
        return sendCommand(Opcode.PRESENCE_UPDATE, presence);
    }

    public boolean sendVoiceState(UpdateVoiceState voiceState) {
        return sendCommand(Opcode.VOICE_STATE_UPDATE, voiceState);
    }

    public boolean sendRequestGuildMembers(RequestGuildMembers request) {
        return sendCommand(Opcode.REQUEST_GUILD_MEMBERS, request);
    }

    // application commands only go out on a READY session
    boolean sendCommand(int op, Object payload) {
        ConnectionState current = state;
        if (current != ConnectionState.READY) {
            log.warn("gateway.command_rejected", "op", op, "state", current);
            return false;
        }
        try {
            write(PayloadCodec.encode(op, payload));
            return true;
        } catch (IOException ex) {
            log.warn("gateway.command_send_failed", "op", op, "error", ex.getMessage());
            return false;
        }
    }

    private void run() {
        try {
            long id;
            while ((id = beginAttempt()) > 0) {
                ConnectionEnd end = runConnection(id);
                if (end == null) {
                    return;
                }
                if (end.kind() == CloseKind.FATAL) {
                    stopInternal();
                    return;
                }
                if (!transition(ConnectionState.RECONNECTING)) {
                    return;
                }
                long delay = backoff.nextDelayMs();
                log.info("gateway.reconnect_scheduled", "attempt", backoff.attempt(), "delay_ms", delay, "resume", session != null);
                Thread.sleep(delay);
            }
        } catch (InterruptedException ex) {
            log.debug("gateway.driver_interrupted");
        } finally {
            stopWorkers();
            closeSocket(new ConnectionEnd(CloseKind.RESUMABLE, "driver exit", false));
            if (codec != null) {
                codec.close();
            }
            stopInternal();
        }
    }

    // one socket's lifetime. null when the shard was stopped underneath us.
    private ConnectionEnd runConnection(long id) throws InterruptedException {
        if (codec != null) {
            codec.close();
        }
        codec = new PayloadCodec(config.compression());
        heartbeat = null;
        readySince = 0;

        URI uri = connectUri();
        log.info("gateway.connecting", "host", uri.getHost(), "connection", id, "resume", session != null);

        TransportSession opened;
        try {
            opened = transport.open(uri, config.connectTimeout(), new Listener(id));
        } catch (TransportException ex) {
            log.warn("gateway.connect_failed", "connection", id, "error", ex.getMessage());
            return new ConnectionEnd(CloseKind.RESUMABLE, "connect failed", true);
        }
        synchronized (writeLock) {
            if (id != connectionId.get()) {
                opened.abort();
                return null;
            }
            socket = opened;
        }
        log.info("gateway.connected", "connection", id);

        while (true) {
            Signal signal = signals.take();
            if (signal.connectionId() != id) {
                log.debug("gateway.stale_signal", "signal", signal.getClass().getSimpleName(), "connection", signal.connectionId(), "current", id);
                continue;
            }

            ConnectionEnd end;
            try {
                end = handle(signal);
            } catch (ProtocolException ex) {
                log.error("gateway.protocol_error", ex, "connection", id);
                end = new ConnectionEnd(CloseKind.NON_RESUMABLE, "protocol error", false);
            } catch (TransportException ex) {
                log.warn("gateway.send_failed", "connection", id, "error", ex.getMessage());
                end = new ConnectionEnd(CloseKind.RESUMABLE, "send failed", false);
            } catch (IOException | RuntimeException ex) {
                log.error("gateway.message_error", ex, "connection", id);
                end = new ConnectionEnd(CloseKind.NON_RESUMABLE, "message error", false);
            }

            if (end != null) {
                endConnection(end);
                return end;
            }
        }
    }

    private ConnectionEnd handle(Signal signal) throws IOException, InterruptedException {
        if (signal instanceof Signal.Frame frame) {
            ParseResult result = codec.decode(frame.data(), frame.binary());
            if (result == null) {
                return null;
            }
            if (result.event() == null) {
                log.debug("gateway.unhandled_payload");
                return null;
            }
            return onEvent(result.event(), signal.connectionId());
        }
        if (signal instanceof Signal.HeartbeatTick) {
            return onHeartbeatTick();
        }
        if (signal instanceof Signal.IdentifyGranted) {
            if (state == ConnectionState.IDENTIFYING) {
                sendIdentify();
            }
            return null;
        }
        if (signal instanceof Signal.Closed closed) {
            CloseKind kind = CloseCode.classify(closed.code());
            CloseCode known = CloseCode.of(closed.code());
            if (kind == CloseKind.FATAL) {
                log.critical("gateway.fatal_close", "code", closed.code(), "name", known, "reason", closed.reason());
            } else {
                log.info("gateway.closed", "code", closed.code(), "name", known, "reason", closed.reason(), "kind", kind);
            }
            return new ConnectionEnd(kind, "closed " + closed.code(), true);
        }
        if (signal instanceof Signal.Failed failed) {
            log.error("gateway.transport_error", failed.error());
            return new ConnectionEnd(CloseKind.RESUMABLE, "transport error", true);
        }
        throw new IllegalStateException("unknown signal " + signal);
    }

    private ConnectionEnd onEvent(GatewayEvent event, long id) throws IOException, InterruptedException {
        if (event instanceof GatewayEvent.Hello hello) {
            onHello(hello, id);
            return null;
        }
        if (event instanceof GatewayEvent.Dispatch dispatch) {
            onDispatch(dispatch);
            return null;
        }
        if (event instanceof GatewayEvent.HeartbeatAck) {
            if (heartbeat != null) {
                heartbeat.acked();
            }
            return null;
        }
        if (event instanceof GatewayEvent.HeartbeatRequest) {
            sendHeartbeat();
            return null;
        }
        if (event instanceof GatewayEvent.Reconnect) {
            log.info("gateway.reconnect_requested");
            return new ConnectionEnd(CloseKind.RESUMABLE, "reconnect requested", false);
        }
        if (event instanceof GatewayEvent.InvalidSession invalid) {
            log.info("gateway.invalid_session", "resumable", invalid.resumable());
            return invalid.resumable()
                ? new ConnectionEnd(CloseKind.RESUMABLE, "invalid session", false)
                : new ConnectionEnd(CloseKind.NON_RESUMABLE, "invalid session", false);
        }
        return null;
    }

    private void onHello(GatewayEvent.Hello hello, long id) throws IOException {
        if (heartbeat != null) {
            log.warn("gateway.duplicate_hello");
            return;
        }
        log.info("gateway.hello", "interval_ms", hello.heartbeatInterval());
        heartbeat = new HeartbeatState(hello.heartbeatInterval());
        startHeartbeat(id, hello.heartbeatInterval());

        SessionInfo s = session;
        if (s != null) {
            if (!transition(ConnectionState.RESUMING)) {
                return;
            }
            write(PayloadCodec.encode(Opcode.RESUME, new Resume(token, s.sessionId(), s.lastSequence())));
            log.info("gateway.resume_sent", "session", s.redactedId(), "seq", s.lastSequence());
        } else {
            if (!transition(ConnectionState.IDENTIFYING)) {
                return;
            }
            requestIdentifySlot(id);
        }
    }

    private void sendIdentify() throws IOException {
        Identify identify = Identify.create(token, config.intents(), shard.index(), shard.count(), config.presence(), config.largeThreshold());
        write(PayloadCodec.encode(Opcode.IDENTIFY, identify));
        log.info("gateway.identify_sent", "intents", config.intents());
    }

    private void onDispatch(GatewayEvent.Dispatch dispatch) throws IOException, InterruptedException {
        Integer seq = dispatch.sequence();
        switch (dispatch.type()) {
            case "READY" -> {
                Ready ready = codec.ready(dispatch);
                SessionInfo s = new SessionInfo(ready.sessionId(), seq, ready.resumeGatewayUrl());
                session = s;
                markReady();
                log.info("gateway.ready", "session", s.redactedId(), "seq", seq);
            }
            case "RESUMED" -> {
                updateSequence(seq);
                markReady();
                log.info("gateway.resumed", "seq", session == null ? null : session.lastSequence());
            }
            default -> updateSequence(seq);
        }
        events.publish(new DispatchEvent(shard.index(), dispatch));
    }

    private void updateSequence(Integer seq) {
        SessionInfo s = session;
        if (s != null && seq != null) {
            session = s.withSequence(seq);
        }
    }

    private void markReady() {
        if (transition(ConnectionState.READY)) {
            readySince = System.nanoTime();
        }
    }

    private ConnectionEnd onHeartbeatTick() throws TransportException {
        if (heartbeat == null) {
            return null;
        }
        switch (heartbeat.onTick(System.nanoTime())) {
            case SEND -> sendHeartbeat();
            case SKIP -> log.debug("gateway.heartbeat_tick_skipped");
            case ZOMBIED -> {
                log.warn("gateway.heartbeat_timeout", "missed", heartbeat.missed());
                return new ConnectionEnd(CloseKind.RESUMABLE, "zombied", false);
            }
        }
        return null;
    }

    // requested or ticked, every heartbeat needs an ack before the next tick judges it
    private void sendHeartbeat() throws TransportException {
        SessionInfo s = session;
        write(PayloadCodec.heartbeat(s == null ? null : s.lastSequence()));
        if (heartbeat != null) {
            heartbeat.sent(System.nanoTime());
        }
    }

    private void endConnection(ConnectionEnd end) {
        stopWorkers();
        closeSocket(end);
        if (end.kind() != CloseKind.RESUMABLE) {
            session = null;
        }
        if (readySince > 0 && heartbeat != null) {
            long readyMs = (System.nanoTime() - readySince) / 1_000_000;
            if (readyMs > heartbeat.intervalMs() * config.stableReadyHeartbeats()) {
                backoff.reset();
            }
        }
        log.info("gateway.connection_ended", "reason", end.reason(), "kind", end.kind(), "connection", connectionId.get());
    }

    private void startHeartbeat(long id, long intervalMs) {
        // initial jitter per discord docs
        long initialDelay = (long) (intervalMs * jitter.getAsDouble());
        heartbeatThread = Threads.start("shardline-heartbeat-" + shard.index(), () -> {
            try {
                Thread.sleep(initialDelay);
                while (!Thread.currentThread().isInterrupted()) {
                    signals.put(new Signal.HeartbeatTick(id));
                    Thread.sleep(intervalMs);
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });
    }

    // the wait can be long with many shards, so it happens off the driver thread
    private void requestIdentifySlot(long id) {
        identifyWaiter = Threads.start("shardline-identify-" + shard.index(), () -> {
            try {
                limiter.acquire(shard.index());
                signals.put(new Signal.IdentifyGranted(id));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });
    }

    private void stopWorkers() {
        Thread hb = heartbeatThread;
        if (hb != null) {
            hb.interrupt();
            heartbeatThread = null;
        }
        Thread waiter = identifyWaiter;
        if (waiter != null) {
            waiter.interrupt();
            identifyWaiter = null;
        }
    }

    // a resumable end must not send 1000/1001, which would invalidate the session
    private void closeSocket(ConnectionEnd end) {
        synchronized (writeLock) {
            TransportSession s = socket;
            socket = null;
            if (s == null) {
                return;
            }
            if (end.remote() || end.kind() == CloseKind.RESUMABLE) {
                s.abort();
            } else {
                s.close(CloseCode.NORMAL.code(), end.reason());
            }
        }
    }

    private void write(String payload) throws TransportException {
        synchronized (writeLock) {
            TransportSession s = socket;
            if (s == null) {
                throw new TransportException("not connected");
            }
            s.sendText(payload);
        }
    }

    private boolean transition(ConnectionState next) {
        ConnectionState previous;
        synchronized (stateLock) {
            previous = state;
            if (previous == ConnectionState.STOPPED) {
                return false;
            }
            state = next;
        }
        if (previous != next) {
            log.debug("gateway.state", "from", previous, "to", next);
        }
        return true;
    }

    // CONNECTING with a fresh connection id, or -1 once stopped. a disconnect can't land in between.
    private long beginAttempt() {
        ConnectionState previous;
        long id;
        synchronized (stateLock) {
            previous = state;
            if (previous == ConnectionState.STOPPED) {
                return -1;
            }
            state = ConnectionState.CONNECTING;
            id = connectionId.incrementAndGet();
        }
        if (previous != ConnectionState.CONNECTING) {
            log.debug("gateway.state", "from", previous, "to", ConnectionState.CONNECTING);
        }
        return id;
    }

    // terminal stop from inside: fatal close or driver exit
    private void stopInternal() {
        synchronized (stateLock) {
            if (state == ConnectionState.STOPPED) {
                return;
            }
            state = ConnectionState.STOPPED;
            connectionId.incrementAndGet();
        }
        session = null;
        limiter.forget(shard.index());
        log.info("gateway.stopped", "connection", connectionId.get());
        onStopped.run();
    }

    private URI connectUri() {
        SessionInfo s = session;
        String base = s != null && s.resumeUrl() != null ? s.resumeUrl() : gatewayUrl;
        StringBuilder sb = new StringBuilder(base);
        if (!base.endsWith("/")) {
            sb.append('/');
        }
        sb.append("?v=").append(config.apiVersion()).append("&encoding=json");
        if (config.compression()) {
            sb.append("&compress=zlib-stream");
        }
        return URI.create(sb.toString());
    }

    private final class Listener implements TransportListener {
        private final long id;

        Listener(long id) {
            this.id = id;
        }

        @Override
        public void onMessage(byte[] data, boolean binary) {
            signals.offer(new Signal.Frame(id, data, binary));
        }

        @Override
        public void onClosed(int code, String reason) {
            signals.offer(new Signal.Closed(id, code, reason));
        }

        @Override
        public void onError(Throwable error) {
            signals.offer(new Signal.Failed(id, error));
        }
    }
}
