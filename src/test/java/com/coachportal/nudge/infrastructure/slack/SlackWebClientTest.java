package com.coachportal.nudge.infrastructure.slack;

import com.coachportal.nudge.domain.model.MessageRef;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Runs the client against a local fake of the Slack Web API.
 */
@DisplayName("SlackWebClient")
class SlackWebClientTest {

    private static final int TEST_PORT = 19181;

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<JsonNode> requests = new CopyOnWriteArrayList<>();
    private final List<String> authHeaders = new CopyOnWriteArrayList<>();
    private volatile int status = 200;
    private volatile String reply = "{\"ok\":true,\"channel\":\"D123\",\"ts\":\"1760450000.000100\"}";

    private Undertow server;
    private SlackWebClient client;

    @BeforeEach
    void setUp() {
        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path()
                .addPrefixPath("/api", this::fakeSlack))
            .build();
        server.start();
        client = new SlackWebClient("http://localhost:" + TEST_PORT + "/api/", Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private void fakeSlack(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::fakeSlack);
            return;
        }
        exchange.startBlocking();
        JsonNode body = mapper.readTree(exchange.getInputStream().readAllBytes());
        ((ObjectNode) body).put("_method", exchange.getRelativePath());
        requests.add(body);
        authHeaders.add(exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION));

        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(reply, StandardCharsets.UTF_8);
    }

    private ArrayNode blocks() {
        ArrayNode blocks = mapper.createArrayNode();
        blocks.addObject().put("type", "divider");
        return blocks;
    }

    @Test
    @DisplayName("postMessage sends blocks with the bot token and returns channel + ts")
    void postMessage() {
        MessageRef ref = client.postMessage("xoxb-1", "U123", blocks(), "fallback");

        assertEquals(new MessageRef("D123", "1760450000.000100"), ref);
        JsonNode sent = requests.get(0);
        assertEquals("/chat.postMessage", sent.path("_method").asText());
        assertEquals("U123", sent.path("channel").asText());
        assertEquals("fallback", sent.path("text").asText());
        assertEquals("divider", sent.path("blocks").get(0).path("type").asText());
        assertEquals("Bearer xoxb-1", authHeaders.get(0));
    }

    @Test
    @DisplayName("updateMessage targets the message by channel and ts")
    void updateMessage() {
        reply = "{\"ok\":true}";

        client.updateMessage("xoxb-1", new MessageRef("D123", "1.2"), blocks(), "Action items updated");

        JsonNode sent = requests.get(0);
        assertEquals("/chat.update", sent.path("_method").asText());
        assertEquals("D123", sent.path("channel").asText());
        assertEquals("1.2", sent.path("ts").asText());
    }

    @Test
    @DisplayName("ok=false surfaces the Slack error code")
    void apiError() {
        reply = "{\"ok\":false,\"error\":\"channel_not_found\"}";

        SlackApiException e = assertThrows(SlackApiException.class,
            () -> client.postMessage("xoxb-1", "C0", blocks(), "t"));
        assertEquals("channel_not_found", e.getErrorCode());
        assertEquals("chat.postMessage", e.getMethod());
    }

    @Test
    @DisplayName("Non-200 responses are errors")
    void httpError() {
        status = 503;
        reply = "{}";

        SlackApiException e = assertThrows(SlackApiException.class,
            () -> client.updateMessage("xoxb-1", new MessageRef("D1", "1.2"), blocks(), "t"));
        assertEquals("http_503", e.getErrorCode());
    }

    @Test
    @DisplayName("A post response without ts is an error")
    void missingTs() {
        reply = "{\"ok\":true,\"channel\":\"D123\"}";

        SlackApiException e = assertThrows(SlackApiException.class,
            () -> client.postMessage("xoxb-1", "U123", blocks(), "t"));
        assertEquals("missing_ts", e.getErrorCode());
    }
}
