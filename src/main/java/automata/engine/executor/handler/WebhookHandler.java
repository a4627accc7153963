package automata.engine.executor.handler;

import automata.engine.exception.ActionException;
import automata.engine.executor.ExecutionLog;
import automata.engine.model.action.WebhookAction;
import automata.engine.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Calls an HTTP endpoint with a JSON body. Responses outside 2xx fail the action.
 */
public class WebhookHandler extends AbstractActionHandler<WebhookAction> {

    private final HttpClient httpClient;
    private final Duration timeout;

    public WebhookHandler(Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), timeout);
    }

    public WebhookHandler(HttpClient httpClient, Duration timeout) {
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    @Override
    protected String startMessage(WebhookAction action) {
        return "Calling webhook: " + action.method() + " " + action.url() + "...";
    }

    @Override
    protected String failurePrefix() {
        return "Webhook failed";
    }

    @Override
    protected JsonNode run(WebhookAction action, ExecutionLog executionLog) {
        HttpRequest.BodyPublisher body = action.body() != null
                ? HttpRequest.BodyPublishers.ofString(Json.write(action.body()))
                : HttpRequest.BodyPublishers.noBody();

        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(action.url()))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .method(action.method(), body);
        for (Map.Entry<String, String> header : action.headers().entrySet()) {
            request.setHeader(header.getKey(), header.getValue());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ActionException(action.method() + " " + action.url() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActionException("Interrupted while calling " + action.url(), e);
        }

        int status = response.statusCode();
        String raw = response.body() == null ? "" : response.body();
        JsonNode data = parseOrNull(raw);

        executionLog.append("Webhook responded with status " + status);

        if (status < 200 || status >= 300) {
            String detail = data != null ? Json.write(data) : raw;
            throw new ActionException("Webhook failed with status " + status + ": " + detail);
        }

        ObjectNode result = Json.object();
        result.put("status", status);
        if (data != null) {
            result.set("data", data);
        } else {
            result.set("data", Json.object());
            if (!raw.isEmpty()) {
                result.put("raw", raw);
            }
        }
        return result;
    }

    private static JsonNode parseOrNull(String raw) {
        try {
            return Json.parse(raw);
        } catch (IllegalArgumentException e) {
            // not JSON, kept as raw text
            return null;
        }
    }
}
