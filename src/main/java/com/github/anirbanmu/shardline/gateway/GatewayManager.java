package com.github.anirbanmu.shardline.gateway;

import com.github.anirbanmu.shardline.config.GatewayConfig;
import com.github.anirbanmu.shardline.discord.DiscordResult;
import com.github.anirbanmu.shardline.discord.GatewayBotSource;
import com.github.anirbanmu.shardline.discord.json.GatewayBot;
import com.github.anirbanmu.shardline.discord.json.RequestGuildMembers;
import com.github.anirbanmu.shardline.discord.json.UpdatePresence;
import com.github.anirbanmu.shardline.discord.json.UpdateVoiceState;
import com.github.anirbanmu.shardline.log.Log;
import com.github.anirbanmu.shardline.transport.Transport;
import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleSupplier;

// owns every shard of a bot, their shared identify limiter and the event fan-out.
// transient failures stay inside the shards; only a fatal close shows up, as a STOPPED shard.
public final class GatewayManager {
    private final String token;
    private final GatewayConfig config;
    private final GatewayBotSource gatewayBot;
    private final Transport transport;
    private final Log log;
    private final DoubleSupplier jitter;
    private final EventBroadcaster events;

    private volatile List<ShardConnection> shards = List.of();
    private volatile IdentifyRateLimiter limiter;
    private boolean started;
    private volatile boolean stopped;

    private record Endpoint(String url, int shardCount, int maxConcurrency) {
    }

    public GatewayManager(String token, GatewayConfig config, GatewayBotSource gatewayBot, Transport transport, Log log) {
        this(token, config, gatewayBot, transport, log, Math::random);
    }

    GatewayManager(String token, GatewayConfig config, GatewayBotSource gatewayBot, Transport transport, Log log, DoubleSupplier jitter) {
        this.token = token;
        this.config = config;
        this.gatewayBot = gatewayBot;
        this.transport = transport;
        this.log = log;
        this.jitter = jitter;
        this.events = new EventBroadcaster(config.eventBuffer());
    }

    // starts every shard and returns; shards identify as the limiter allows
    public synchronized void connect() {
        if (stopped) {
            log.warn("manager.connect_ignored", "reason", "stopped");
            return;
        }
        if (started) {
            return;
        }
        started = true;

        Endpoint endpoint = resolveEndpoint();
        IdentifyRateLimiter sharedLimiter = new IdentifyRateLimiter(endpoint.maxConcurrency(), config.identifySpacing());
        List<ShardConnection> created = new ArrayList<>(endpoint.shardCount());
        for (int i = 0; i < endpoint.shardCount(); i++) {
            ShardDescriptor descriptor = new ShardDescriptor(i, endpoint.shardCount());
            sharedLimiter.expect(i);
            created.add(new ShardConnection(descriptor, token, endpoint.url(), config, transport, sharedLimiter, events, log.child(descriptor.name()), jitter, this::shardStopped));
        }
        limiter = sharedLimiter;
        shards = List.copyOf(created);

        log.info("manager.connecting", "shards", endpoint.shardCount(), "max_concurrency", endpoint.maxConcurrency());
        for (ShardConnection shard : created) {
            shard.connect();
        }
    }

    // stops every shard, then ends all event streams
    public synchronized void disconnect() {
        if (stopped) {
            return;
        }
        stopped = true;
        log.info("manager.disconnecting", "shards", shards.size());
        for (ShardConnection shard : shards) {
            shard.disconnect();
        }
        events.close();
        log.info("manager.stopped");
    }

    // streams end once every shard has stopped, whether or not disconnect was called
    private void shardStopped() {
        List<ShardConnection> current = shards;
        if (current.isEmpty()) {
            return;
        }
        for (ShardConnection shard : current) {
            if (shard.state() != ConnectionState.STOPPED) {
                return;
            }
        }
        if (!stopped) {
            log.warn("manager.all_shards_stopped", "shards", current.size());
        }
        events.close();
    }

    public EventStream makeEventsStream() {
        return events.subscribe();
    }

    // GUILD_MEMBERS_CHUNK replies arrive on the event stream
    public boolean requestGuildMembersChunk(RequestGuildMembers request) {
        return shardForGuild(request.guildId()).sendRequestGuildMembers(request);
    }

    public boolean updateVoiceState(UpdateVoiceState voiceState) {
        return shardForGuild(voiceState.guildId()).sendVoiceState(voiceState);
    }

    // sent on every shard; true only if all of them took it
    public boolean updatePresence(UpdatePresence presence) {
        List<ShardConnection> current = shards;
        if (current.isEmpty()) {
            log.warn("manager.command_rejected", "reason", "not connected");
            return false;
        }
        boolean all = true;
        for (ShardConnection shard : current) {
            all &= shard.sendPresence(presence);
        }
        return all;
    }

    // READY or STOPPED when every shard agrees, otherwise the first shard that is neither
    public ConnectionState state() {
        List<ShardConnection> current = shards;
        if (current.isEmpty()) {
            return stopped ? ConnectionState.STOPPED : ConnectionState.NO_SESSION;
        }
        boolean allReady = true;
        boolean allStopped = true;
        ConnectionState first = null;
        for (ShardConnection shard : current) {
            ConnectionState s = shard.state();
            allReady &= s == ConnectionState.READY;
            allStopped &= s == ConnectionState.STOPPED;
            if (first == null && s != ConnectionState.READY && s != ConnectionState.STOPPED) {
                first = s;
            }
        }
        if (allReady) {
            return ConnectionState.READY;
        }
        if (allStopped) {
            return ConnectionState.STOPPED;
        }
        return first != null ? first : ConnectionState.RECONNECTING;
    }

    public List<ShardConnection> shards() {
        return shards;
    }

    public ShardConnection shard(int index) {
        return shards.get(index);
    }

    public int shardCount() {
        return shards.size();
    }

    IdentifyRateLimiter limiter() {
        return limiter;
    }

    private ShardConnection shardForGuild(String guildId) {
        List<ShardConnection> current = shards;
        if (current.isEmpty()) {
            throw new IllegalStateException("gateway manager is not connected");
        }
        return current.get(ShardDescriptor.indexForGuild(guildId, current.size()));
    }

    private Endpoint resolveEndpoint() {
        DiscordResult<GatewayBot> result = gatewayBot.getGatewayBot();
        if (result instanceof DiscordResult.Success<GatewayBot> success) {
            GatewayBot bot = success.value();
            GatewayBot.SessionStartLimit limit = bot.sessionStartLimit();
            int count = config.shardCount() > 0 ? config.shardCount() : Math.max(1, bot.shards());
            int concurrency = limit == null ? 1 : Math.max(1, limit.maxConcurrency());
            if (limit != null && limit.remaining() < count) {
                log.warn("manager.session_starts_low", "remaining", limit.remaining(), "shards", count, "reset_after_ms", limit.resetAfter());
            }
            log.info("manager.endpoint", "recommended_shards", bot.shards(), "max_concurrency", concurrency);
            return new Endpoint(bot.url(), count, concurrency);
        }

        DiscordResult.Failure<GatewayBot> failure = (DiscordResult.Failure<GatewayBot>) result;
        if (failure.exception() != null) {
            log.error("manager.endpoint_lookup_failed", failure.exception(), "message", failure.message());
        } else {
            log.warn("manager.endpoint_lookup_failed", "message", failure.message(), "status", failure.statusCode());
        }
        return new Endpoint(config.defaultGatewayUrl(), Math.max(1, config.shardCount()), 1);
    }
}
