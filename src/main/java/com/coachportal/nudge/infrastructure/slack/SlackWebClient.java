package com.coachportal.nudge.infrastructure.slack;

import com.coachportal.nudge.application.port.output.ChatMessenger;
import com.coachportal.nudge.domain.model.MessageRef;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Slack Web API client.
 *
 * Implements ChatMessenger over:
 * - chat.postMessage (new message, returns channel + ts)
 * - chat.update (replace blocks of an existing message)
 *
 * Every call is authorized with the bot token of the workspace the channel
 * belongs to; the client itself holds no credential.
 *
 * API Docs: https://api.slack.com/web
 */
public class SlackWebClient implements ChatMessenger {
    private static final Logger log = LoggerFactory.getLogger(SlackWebClient.class);

    public static final String DEFAULT_BASE_URL = "https://slack.com/api";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration requestTimeout;

    /**
     * @param baseUrl        API base URL without trailing slash
     * @param requestTimeout Connect and per-request timeout
     */
    public SlackWebClient(String baseUrl, Duration requestTimeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(requestTimeout)
            .build();
    }

    @Override
    public MessageRef postMessage(String botToken, String channel, ArrayNode blocks, String text) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("channel", channel);
        body.set("blocks", blocks);
        body.put("text", text);

        JsonNode response = call("chat.postMessage", botToken, body);

        String ts = response.path("ts").asText(null);
        if (ts == null || ts.isEmpty()) {
            throw new SlackApiException("chat.postMessage", "missing_ts", "Response carried no message ts");
        }
        String postedChannel = response.path("channel").asText(channel);

        log.debug("[SLACK] Posted message channel={} ts={}", postedChannel, ts);
        return new MessageRef(postedChannel, ts);
    }

    @Override
    public void updateMessage(String botToken, MessageRef message, ArrayNode blocks, String text) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("channel", message.channelId());
        body.put("ts", message.ts());
        body.set("blocks", blocks);
        body.put("text", text);

        call("chat.update", botToken, body);
        log.debug("[SLACK] Updated message channel={} ts={}", message.channelId(), message.ts());
    }

    private JsonNode call(String method, String botToken, ObjectNode body) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new SlackApiException(method, "serialization_error", e.getMessage(), e);
        }

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/" + method))
            .timeout(requestTimeout)
            .header("Authorization", "Bearer " + botToken)
            .header("Content-Type", "application/json; charset=utf-8")
            .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SlackApiException(method, "transport_error", e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SlackApiException(method, "interrupted", "Call interrupted", e);
        }

        if (response.statusCode() != 200) {
            log.error("[SLACK] {} HTTP {}: {}", method, response.statusCode(), response.body());
            throw new SlackApiException(method, "http_" + response.statusCode(), "HTTP error " + response.statusCode());
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new SlackApiException(method, "invalid_response", e.getMessage(), e);
        }

        if (!json.path("ok").asBoolean(false)) {
            String error = json.path("error").asText("unknown_error");
            throw new SlackApiException(method, error, "Slack rejected the call");
        }
        return json;
    }
}
