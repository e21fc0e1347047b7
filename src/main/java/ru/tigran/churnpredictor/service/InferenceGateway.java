package ru.tigran.churnpredictor.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import ru.tigran.churnpredictor.dto.LabelScore;
import ru.tigran.churnpredictor.dto.ZeroShotResult;
import ru.tigran.churnpredictor.exception.EnrichmentException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the hosted text-inference API.
 *
 * Every call is a single POST to {@code {base-url}{modelId}} guarded by the inference circuit
 * breaker. There is no retry: a failed call raises {@link EnrichmentException} and the caller
 * decides how to degrade.
 */
@Slf4j
@Service
public class InferenceGateway {

    // Maximum response size (1 MB) to prevent memory exhaustion
    private static final int MAX_RESPONSE_SIZE_BYTES = 1024 * 1024;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final String apiToken;
    private final String sentimentModel;
    private final String zeroShotModel;

    public InferenceGateway(
            @Qualifier("inferenceRestClient") RestClient restClient,
            ObjectMapper objectMapper,
            @Qualifier("inferenceCircuitBreaker") CircuitBreaker circuitBreaker,
            @Value("${app.inference.api-token:}") String apiToken,
            @Value("${app.inference.sentiment-model}") String sentimentModel,
            @Value("${app.inference.zero-shot-model}") String zeroShotModel
    ) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.circuitBreaker = circuitBreaker;
        this.apiToken = apiToken;
        this.sentimentModel = sentimentModel;
        this.zeroShotModel = zeroShotModel;
    }

    /**
     * Runs the single-label sentiment classifier.
     *
     * The API answers with a list of candidate lists, {@code [[{"label":..,"score":..}, ..]]};
     * only the first list is used. A flat list is accepted as well.
     *
     * @return label/score pairs in the order the model returned them, possibly empty
     */
    public List<LabelScore> classifySentiment(String text) {
        Map<String, Object> body = Map.of("inputs", text);
        JsonNode root = call(sentimentModel, body);

        if (!root.isArray()) {
            throw new EnrichmentException("Sentiment response is not an array");
        }
        JsonNode candidates = root.size() > 0 && root.get(0).isArray() ? root.get(0) : root;

        List<LabelScore> result = new ArrayList<>();
        for (JsonNode candidate : candidates) {
            JsonNode label = candidate.get("label");
            JsonNode score = candidate.get("score");
            if (label == null || !label.isTextual() || score == null || !score.isNumber()) {
                throw new EnrichmentException("Sentiment response entry is malformed: " + candidate);
            }
            result.add(new LabelScore(label.asText(), score.asDouble()));
        }
        return result;
    }

    /**
     * Runs the zero-shot classifier in multi-label mode against the candidate labels.
     */
    public ZeroShotResult classifyZeroShot(String text, Collection<String> candidateLabels) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("candidate_labels", List.copyOf(candidateLabels));
        parameters.put("multi_label", true);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("inputs", text);
        body.put("parameters", parameters);

        JsonNode root = call(zeroShotModel, body);
        try {
            return objectMapper.treeToValue(root, ZeroShotResult.class);
        } catch (Exception e) {
            throw new EnrichmentException("Failed to parse zero-shot response: " + e.getMessage(), e);
        }
    }

    private JsonNode call(String modelId, Object requestBody) {
        if (apiToken == null || apiToken.isBlank()) {
            throw new EnrichmentException("HF_TOKEN is not configured");
        }
        try {
            return circuitBreaker.executeSupplier(() -> post(modelId, requestBody));
        } catch (CallNotPermittedException e) {
            throw new EnrichmentException("Inference circuit is open, call to " + modelId + " skipped", e);
        }
    }

    private JsonNode post(String modelId, Object requestBody) {
        log.debug("Calling inference model {}", modelId);
        byte[] response;
        try {
            response = restClient.post()
                    .uri(modelId)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(requestBody)
                    .exchange((request, clientResponse) -> {
                        byte[] body = readBounded(clientResponse.getBody());
                        if (clientResponse.getStatusCode().isError()) {
                            int statusCode = clientResponse.getStatusCode().value();
                            String errorBody = new String(body, 0, Math.min(body.length, MAX_RESPONSE_SIZE_BYTES),
                                    StandardCharsets.UTF_8);
                            log.warn("Inference API ({}) returned non-2xx status: {}. Response body: {}",
                                    modelId, statusCode, abbreviate(errorBody));
                            throw new EnrichmentException(describeError(modelId, statusCode, errorBody));
                        }
                        return body;
                    });
        } catch (EnrichmentException e) {
            throw e;
        } catch (RestClientException e) {
            throw new EnrichmentException("Error sending request to inference API (" + modelId + "): " + e.getMessage(), e);
        }

        validateResponseSize(response);
        try {
            return objectMapper.readTree(response);
        } catch (Exception e) {
            log.warn("Error parsing inference response from {}. Body: {}",
                    modelId, abbreviate(new String(response, StandardCharsets.UTF_8)));
            throw new EnrichmentException("Failed to parse inference response: " + e.getMessage(), e);
        }
    }

    // Reads at most one byte past the limit so oversized bodies are never buffered whole
    private static byte[] readBounded(InputStream body) throws IOException {
        if (body == null) {
            return new byte[0];
        }
        return body.readNBytes(MAX_RESPONSE_SIZE_BYTES + 1);
    }

    /**
     * Builds the log message for a failed call. The API reports a loading model with
     * {@code {"error": "...", "estimated_time": 20.0}}.
     */
    private String describeError(String modelId, int statusCode, String errorBody) {
        try {
            JsonNode error = objectMapper.readTree(errorBody);
            String message = error.path("error").asText("");
            if (!message.isEmpty()) {
                double estimatedTime = error.path("estimated_time").asDouble(0);
                if (estimatedTime > 0) {
                    return String.format("Inference API error for %s (model loading, try again in %.0fs): %s",
                            modelId, estimatedTime, message);
                }
                return String.format("Inference API error for %s: %s", modelId, message);
            }
        } catch (Exception e) {
            log.debug("Error body from {} is not JSON", modelId);
        }
        return String.format("Inference API (%s) request failed with status %d", modelId, statusCode);
    }

    private void validateResponseSize(byte[] responseBody) {
        if (responseBody == null || responseBody.length == 0) {
            throw new EnrichmentException("Empty response from inference API");
        }
        if (responseBody.length > MAX_RESPONSE_SIZE_BYTES) {
            throw new EnrichmentException(String.format(
                    "Inference response exceeds maximum allowed size of %d bytes", MAX_RESPONSE_SIZE_BYTES));
        }
    }

    private static String abbreviate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() > 500 ? value.substring(0, 500) + "..." : value;
    }
}
