package io.github.drompincen.ledgersync.runtime.triage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.ledgersync.protocol.api.ClassifyRequest;
import io.github.drompincen.ledgersync.protocol.api.Persona;
import io.github.drompincen.ledgersync.protocol.api.TriageClassification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * Asks an external classifier for the persona of an item. Any failure (timeout, non-2xx,
 * body without a known persona) yields an empty result so the caller can fall back.
 */
@Component
public class RemoteTriageClient {

    private static final Logger log = LoggerFactory.getLogger(RemoteTriageClient.class);

    private final ObjectMapper objectMapper;
    private final HttpClient client;

    @Autowired
    public RemoteTriageClient(ObjectMapper objectMapper) {
        this(objectMapper, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(3)).build());
    }

    RemoteTriageClient(ObjectMapper objectMapper, HttpClient client) {
        this.objectMapper = objectMapper;
        this.client = client;
    }

    public Optional<TriageClassification> classify(String endpoint, Duration timeout, ClassifyRequest body) {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                log.warn("Triage endpoint returned {}", response.statusCode());
                return Optional.empty();
            }
            JsonNode json = objectMapper.readTree(response.body());
            Persona persona = Persona.parse(json.path("persona").asText(null));
            if (persona == Persona.UNKNOWN) return Optional.empty();
            double confidence = json.path("confidence").isNumber() ? json.path("confidence").asDouble() : 1.0;
            String theme = json.path("theme").asText(null);
            if (theme == null || theme.isBlank()) theme = json.path("suggestedTheme").asText(null);
            return Optional.of(new TriageClassification(persona, confidence, "remote",
                    theme == null || theme.isBlank() ? null : theme));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            log.warn("Triage endpoint {} unavailable: {}", endpoint, e.getMessage());
            return Optional.empty();
        }
    }
}
