package ru.tigran.churnpredictor.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import ru.tigran.churnpredictor.dto.LabelScore;
import ru.tigran.churnpredictor.dto.ZeroShotResult;
import ru.tigran.churnpredictor.exception.EnrichmentException;
import ru.tigran.churnpredictor.model.ChurnPrediction;
import ru.tigran.churnpredictor.model.FeedbackRecord;
import ru.tigran.churnpredictor.repository.ChurnPredictionRepository;
import ru.tigran.churnpredictor.repository.FeedbackRecordRepository;
import ru.tigran.churnpredictor.service.InferenceGateway;

import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.*;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Сквозной сценарий POST /predict на H2 с замоканным inference API.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public class PredictionFlowIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private FeedbackRecordRepository feedbackRecordRepository;

    @Autowired
    private ChurnPredictionRepository churnPredictionRepository;

    @Autowired
    private MeterRegistry meterRegistry;

    @MockBean
    private InferenceGateway inferenceGateway;

    @AfterEach
    public void tearDown() {
        churnPredictionRepository.deleteAll();
        feedbackRecordRepository.deleteAll();
    }

    private JsonNode postPrediction(String body, String idempotencyKey) throws Exception {
        MockHttpServletRequestBuilder request = post("/predict").contentType(MediaType.APPLICATION_JSON).content(body);
        if (idempotencyKey != null) {
            request.header("Idempotency-Key", idempotencyKey);
        }
        MvcResult result = mockMvc.perform(request)
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    public void testPredictStoresFeedbackAndPrediction() throws Exception {
        when(inferenceGateway.classifySentiment("The pricing is terrible"))
                .thenReturn(List.of(new LabelScore("NEGATIVE", 0.97), new LabelScore("POSITIVE", 0.03)));
        when(inferenceGateway.classifyZeroShot(anyString(), any()))
                .thenReturn(new ZeroShotResult("The pricing is terrible",
                        List.of("pricing", "service"), List.of(0.93, 0.2)));

        JsonNode response = postPrediction("{\"nls_score\": 2, \"feedback_text\": \"The pricing is terrible\"}", null);

        assertEquals(0.8, response.get("churn_probability").asDouble());
        assertEquals("NEGATIVE", response.get("comment_sentiment").asText());
        assertEquals("pricing", response.get("comment_topics").get(0).asText());

        UUID feedbackId = UUID.fromString(response.get("customer_id").asText());
        FeedbackRecord stored = feedbackRecordRepository.findById(feedbackId).orElseThrow();
        assertEquals(2, stored.getRating());
        assertEquals("NEGATIVE", stored.getCommentSentiment());
        assertEquals(List.of("pricing"), stored.getCommentTopics());

        ChurnPrediction prediction = churnPredictionRepository.findByFeedbackRecordId(feedbackId).orElseThrow();
        assertEquals(0.8, prediction.getChurnProbability());
    }

    @Test
    public void testEnrichmentFailureDoesNotFailRequest() throws Exception {
        when(inferenceGateway.classifySentiment(anyString()))
                .thenThrow(new EnrichmentException("Inference API request failed with status 503"));
        when(inferenceGateway.classifyZeroShot(anyString(), any()))
                .thenThrow(new EnrichmentException("Inference API request failed with status 503"));

        JsonNode response = postPrediction("{\"nls_score\": 6, \"feedback_text\": \"It's fine\"}", null);

        assertEquals(0.4, response.get("churn_probability").asDouble());
        assertEquals("UNKNOWN", response.get("comment_sentiment").asText());
        assertFalse(response.has("comment_topics"));
        assertEquals(1, feedbackRecordRepository.count());
        assertEquals(1, churnPredictionRepository.count());
        assertTrue(meterRegistry.get("churn.enrichment.degraded").tag("operation", "sentiment").counter().count() >= 1);
    }

    @Test
    public void testEmptyFeedbackSkipsInference() throws Exception {
        JsonNode response = postPrediction("{\"nls_score\": 9}", null);

        assertEquals(0.1, response.get("churn_probability").asDouble());
        assertEquals("NEUTRAL", response.get("comment_sentiment").asText());
        verifyNoInteractions(inferenceGateway);
    }

    @Test
    public void testRepeatedIdempotencyKeyReturnsSameRecord() throws Exception {
        when(inferenceGateway.classifySentiment(anyString()))
                .thenReturn(List.of(new LabelScore("POSITIVE", 0.9)));
        when(inferenceGateway.classifyZeroShot(anyString(), any()))
                .thenReturn(new ZeroShotResult("Fast", List.of("speed"), List.of(0.9)));

        JsonNode first = postPrediction("{\"nls_score\": 8, \"feedback_text\": \"Fast\"}", "order-42");
        JsonNode second = postPrediction("{\"nls_score\": 8, \"feedback_text\": \"Fast\"}", "order-42");

        assertEquals(first.get("customer_id").asText(), second.get("customer_id").asText());
        assertEquals(1, feedbackRecordRepository.count());
        assertEquals(1, churnPredictionRepository.count());
        verify(inferenceGateway, times(1)).classifySentiment(anyString());
    }

    @Test
    public void testReusedIdempotencyKeyWithDifferentBodyIsRejected() throws Exception {
        postPrediction("{\"nls_score\": 9}", "same");

        mockMvc.perform(post("/predict")
                        .header("Idempotency-Key", "same")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"nls_score\": 1, \"feedback_text\": \"terrible\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("Idempotency key was already used with a different request.")));

        assertEquals(1, feedbackRecordRepository.count());
        assertEquals(1, churnPredictionRepository.count());
        verify(inferenceGateway, never()).classifySentiment(anyString());
    }

    @Test
    public void testTooLongIdempotencyKeyIsClientError() throws Exception {
        mockMvc.perform(post("/predict")
                        .header("Idempotency-Key", "x".repeat(200))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"nls_score\": 9}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("Idempotency key must be at most 128 characters.")));

        assertEquals(0, feedbackRecordRepository.count());
        verifyNoInteractions(inferenceGateway);
    }

    @Test
    public void testFractionalRatingIsRejected() throws Exception {
        mockMvc.perform(post("/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"nls_score\": 9.7}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("Invalid JSON request body.")));

        assertEquals(0, feedbackRecordRepository.count());
    }

    @Test
    public void testInvalidRequestStoresNothing() throws Exception {
        mockMvc.perform(post("/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"nls_score\": -1, \"feedback_text\": \"bad\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("NLS score must be between 0 and 10.")));

        assertEquals(0, feedbackRecordRepository.count());
        verifyNoInteractions(inferenceGateway);
    }

    @Test
    public void testStoredFeedbackCanBeFetched() throws Exception {
        when(inferenceGateway.classifySentiment(anyString()))
                .thenReturn(List.of(new LabelScore("NEGATIVE", 0.8)));
        when(inferenceGateway.classifyZeroShot(anyString(), any()))
                .thenReturn(new ZeroShotResult("Poor support", List.of("customer support"), List.of(0.85)));

        JsonNode created = postPrediction("{\"nls_score\": 4, \"feedback_text\": \"Poor support\"}", null);
        String feedbackId = created.get("customer_id").asText();

        mockMvc.perform(get("/api/v1/feedback/{id}", feedbackId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id", is(feedbackId)))
                .andExpect(jsonPath("$.feedback_text", is("Poor support")))
                .andExpect(jsonPath("$.comment_topics", contains("customer support")))
                .andExpect(jsonPath("$.prediction.churn_probability", is(0.8)));
    }

    @Test
    public void testHealthReportsInferenceCircuit() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.inference.details.circuitBreakerState", is("CLOSED")));
    }
}
