package com.chimera.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.function.BiConsumer;
import java.util.stream.Stream;

/**
 * Thin JSON client for the operator REST API, used by the CLI commands.
 */
@Component
public class ApiClient {

    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final HttpClient http = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    public ApiClient(ObjectMapper objectMapper, @Value("${chimera.cli.url:http://localhost:8080}") String baseUrl) {
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public JsonNode get(String path) {
        return send(HttpRequest.newBuilder(uri(path)).GET().build());
    }

    public JsonNode post(String path, Object body) {
        String json;
        try {
            json = body == null ? "{}" : objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize request body", e);
        }
        return send(HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build());
    }

    /**
     * Streams an SSE endpoint, handing each (event name, data) pair to the
     * consumer until the server closes the stream.
     */
    public void stream(String path, BiConsumer<String, String> onEvent) {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        try {
            HttpResponse<Stream<String>> response = http.send(request, HttpResponse.BodyHandlers.ofLines());
            if (response.statusCode() != 200) {
                throw new ApiException(response.statusCode(), "Server returned HTTP " + response.statusCode());
            }
            final String[] currentEvent = {""};
            response.body().forEach(line -> {
                if (line.startsWith("event:")) {
                    currentEvent[0] = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    String name = currentEvent[0].isEmpty() ? "message" : currentEvent[0];
                    onEvent.accept(name, line.substring(5).trim());
                    currentEvent[0] = "";
                }
            });
        } catch (ConnectException e) {
            throw new ApiException("Cannot connect to Chimera server at " + baseUrl, e);
        } catch (IOException e) {
            throw new ApiException("Request to " + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException("Interrupted", e);
        }
    }

    private JsonNode send(HttpRequest request) {
        try {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            JsonNode body = response.body() == null || response.body().isBlank()
                    ? objectMapper.createObjectNode()
                    : objectMapper.readTree(response.body());
            if (response.statusCode() >= 400) {
                String message = body.hasNonNull("error") ? body.get("error").asText()
                        : body.hasNonNull("reason") ? body.get("reason").asText()
                        : "HTTP " + response.statusCode();
                throw new ApiException(response.statusCode(), message);
            }
            return body;
        } catch (ConnectException e) {
            throw new ApiException("Cannot connect to Chimera server at " + baseUrl, e);
        } catch (IOException e) {
            throw new ApiException("Request to " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException("Interrupted", e);
        }
    }

    private URI uri(String path) {
        return URI.create(baseUrl + path);
    }
}
