package com.github.anirbanmu.shardline.discord;

import com.github.anirbanmu.shardline.discord.json.GatewayBot;
import com.github.anirbanmu.shardline.log.Log;
import com.github.anirbanmu.shardline.util.Http;
import com.github.anirbanmu.shardline.util.Json;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

public class DiscordHttpClient implements GatewayBotSource {
    private static final String BASE_URL = "https://discord.com/api/v";
    private static final Duration REQUEST_TIMEOUT = Duration.ofMillis(2500);

    private final String token;
    private final String baseUrl;
    private final Log log;

    public DiscordHttpClient(String token, int apiVersion, Log log) {
        this.token = token;
        this.baseUrl = BASE_URL + apiVersion;
        this.log = log;
    }

    @Override
    public DiscordResult<GatewayBot> getGatewayBot() {
        String url = baseUrl + "/gateway/bot";
        log.info("http.get_gateway_bot", "url", url);

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Authorization", "Bot " + token)
            .timeout(REQUEST_TIMEOUT)
            .GET()
            .build();

        try {
            HttpResponse<byte[]> response = Http.CLIENT.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() >= 400) {
                log.error("http.request_failed", "status", response.statusCode());
                return new DiscordResult.Failure<>("Discord API error", response.statusCode());
            }
            byte[] body = response.body();
            GatewayBot bot = Json.DSL.deserialize(GatewayBot.class, body, body.length);
            if (bot == null || bot.url() == null) {
                return new DiscordResult.Failure<>("Empty gateway response", response.statusCode());
            }
            return new DiscordResult.Success<>(bot);
        } catch (IOException e) {
            return new DiscordResult.Failure<>("HTTP request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new DiscordResult.Failure<>("HTTP request interrupted", e);
        }
    }
}
