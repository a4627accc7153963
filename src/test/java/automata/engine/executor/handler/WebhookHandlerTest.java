package automata.engine.executor.handler;

import automata.engine.exception.ActionException;
import automata.engine.executor.ExecutionLog;
import automata.engine.model.action.WebhookAction;
import automata.engine.support.TestWebhookServer;
import automata.engine.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.*;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Webhook action against a local HTTP server")
class WebhookHandlerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private TestWebhookServer server;
    private WebhookHandler handler;
    private ExecutionLog log;

    @BeforeEach
    void setUp() {
        server = new TestWebhookServer();
        handler = new WebhookHandler(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(TIMEOUT)
                .build(), TIMEOUT);
        log = new ExecutionLog();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("POSTs the JSON body with custom headers and returns status and data")
    void postsJsonAndParsesResponse() {
        server.respondWith(201, "application/json", "{\"id\":42}").recordHeader("X-Api-Key");
        WebhookAction action = new WebhookAction(server.url("/hooks/deploy"), null,
                Map.of("X-Api-Key", "secret"), Json.object().put("env", "prod"));

        JsonNode result = handler.handle(action, log);

        assertEquals(201, result.get("status").asInt());
        assertEquals(42, result.get("data").get("id").asInt());

        TestWebhookServer.Received request = server.received().get(0);
        assertEquals("POST", request.method());
        assertEquals("/hooks/deploy", request.uri());
        assertEquals("application/json", request.contentType());
        assertEquals("secret", request.header());
        assertEquals("prod", Json.parse(request.body()).get("env").asText());

        assertEquals("Calling webhook: POST " + server.url("/hooks/deploy") + "...", log.lines().get(0));
        assertEquals("Webhook responded with status 201", log.lines().get(1));
    }

    @Test
    @DisplayName("non-JSON response yields empty data and keeps the raw text")
    void nonJsonResponse() {
        server.respondWith(200, "text/plain", "accepted");

        JsonNode result = handler.handle(new WebhookAction(server.url("/ping"), "GET", null, null), log);

        assertEquals(200, result.get("status").asInt());
        assertTrue(result.get("data").isObject());
        assertEquals(0, result.get("data").size());
        assertEquals("accepted", result.get("raw").asText());
        assertEquals("GET", server.received().get(0).method());
    }

    @Test
    @DisplayName("non-2xx response fails with status and body")
    void errorStatusFails() {
        server.respondWith(503, "application/json", "{\"error\":\"maintenance\"}");

        ActionException e = assertThrows(ActionException.class,
                () -> handler.handle(new WebhookAction(server.url("/hook"), "POST", null, null), log));

        assertTrue(e.getMessage().contains("503"));
        assertTrue(e.getMessage().contains("maintenance"));
        assertTrue(log.contains("Webhook responded with status 503"));
        assertTrue(log.lines().get(log.size() - 1).startsWith("Webhook failed: Webhook failed with status 503"));
    }

    @Test
    @DisplayName("connection failure is reported as an action failure")
    void unreachableEndpoint() {
        String url = server.url("/gone");
        server.close();

        assertThrows(ActionException.class,
                () -> handler.handle(new WebhookAction(url, "POST", null, null), log));
        assertTrue(log.lines().get(log.size() - 1).startsWith("Webhook failed: "));
    }
}
