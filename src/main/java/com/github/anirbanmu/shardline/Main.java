package com.github.anirbanmu.shardline;

import com.github.anirbanmu.shardline.config.ConfigLoader;
import com.github.anirbanmu.shardline.config.GatewayConfig;
import com.github.anirbanmu.shardline.discord.DiscordHttpClient;
import com.github.anirbanmu.shardline.gateway.ConnectionState;
import com.github.anirbanmu.shardline.gateway.DispatchEvent;
import com.github.anirbanmu.shardline.gateway.EventStream;
import com.github.anirbanmu.shardline.gateway.GatewayManager;
import com.github.anirbanmu.shardline.log.Log;
import com.github.anirbanmu.shardline.transport.JdkWebSocketTransport;
import com.github.anirbanmu.shardline.util.Threads;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;

public class Main {
    public static void main(String[] args) {
        Log log = Log.create("main");
        String token = System.getenv("DISCORD_TOKEN");

        if (token == null) {
            log.error("startup.missing_token", "message", "DISCORD_TOKEN env var is required");
            System.exit(1);
        }

        String configPathStr = System.getProperty("config", "gateway.toml");
        Path configPath = Path.of(configPathStr);

        GatewayConfig config;
        try {
            if (Files.exists(configPath)) {
                config = ConfigLoader.load(configPath);
                log.info("startup.config_loaded", "path", configPath.toAbsolutePath().toString());
            } else {
                config = GatewayConfig.defaults();
                log.info("startup.config_defaults", "path", configPath.toAbsolutePath().toString());
            }
        } catch (Exception e) {
            log.error("startup.config_error", e);
            System.exit(1);
            return;
        }

        Log gatewayLog = Log.create("gateway");
        GatewayManager manager = new GatewayManager(
            token,
            config,
            new DiscordHttpClient(token, config.apiVersion(), Log.create("http")),
            new JdkWebSocketTransport(),
            gatewayLog);

        int healthPort = Integer.parseInt(System.getenv().getOrDefault("HEALTH_PORT", "8080"));
        try {
            startHealthCheck(healthPort, () -> manager.state() == ConnectionState.READY, log);
        } catch (Exception e) {
            log.error("startup.health_server_failed", e);
            System.exit(1);
        }

        EventStream events = manager.makeEventsStream();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("shutdown.requested");
            manager.disconnect();
        }));

        manager.connect();

        Threads.start("event-logger", () -> {
            while (events.hasNext()) {
                DispatchEvent event = events.next();
                log.debug("event.dispatch", "shard", event.shard(), "type", event.type(), "seq", event.sequence());
            }
            log.info("event.stream_ended");
        });

        // keep main thread alive until every shard has stopped
        while (manager.state() != ConnectionState.STOPPED) {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        manager.disconnect();
        log.error("shutdown.all_shards_stopped");
        System.exit(2);
    }

    private static void startHealthCheck(int port, BooleanSupplier healthy, Log log) throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
        server.setExecutor(Executors.newCachedThreadPool(Threads.daemonFactory("health")));
        server.createContext("/health", exchange -> {
            boolean ok = healthy.getAsBoolean();
            int status = ok ? 200 : 503;
            byte[] body = (ok ? "ok" : "unhealthy").getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();
        log.info("health.started", "port", port);
    }
}
