package ru.tigran.churnpredictor.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import ru.tigran.churnpredictor.dto.ChurnScore;
import ru.tigran.churnpredictor.dto.Enrichment;
import ru.tigran.churnpredictor.dto.PredictRequest;
import ru.tigran.churnpredictor.dto.PredictResponse;
import ru.tigran.churnpredictor.exception.ApplicationException;
import ru.tigran.churnpredictor.exception.ErrorCode;
import ru.tigran.churnpredictor.exception.StorageException;
import ru.tigran.churnpredictor.exception.ValidationException;
import ru.tigran.churnpredictor.model.ChurnPrediction;
import ru.tigran.churnpredictor.model.FeedbackRecord;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs one prediction request end to end:
 * validate, enrich, score, store feedback, store prediction, build the response.
 *
 * Validation and storage failures stop the pipeline. Enrichment never does; it hands back
 * degraded defaults instead.
 */
@Slf4j
@Service
public class PredictionService {

    private final FeedbackValidator feedbackValidator;
    private final EnrichmentService enrichmentService;
    private final ChurnScoringEngine scoringEngine;
    private final PersistenceGateway persistenceGateway;
    private final MeterRegistry meterRegistry;
    private final Timer predictionTimer;

    public PredictionService(
            FeedbackValidator feedbackValidator,
            EnrichmentService enrichmentService,
            ChurnScoringEngine scoringEngine,
            PersistenceGateway persistenceGateway,
            MeterRegistry meterRegistry
    ) {
        this.feedbackValidator = feedbackValidator;
        this.enrichmentService = enrichmentService;
        this.scoringEngine = scoringEngine;
        this.persistenceGateway = persistenceGateway;
        this.meterRegistry = meterRegistry;
        this.predictionTimer = Timer.builder("churn.prediction.time")
                .description("Time to enrich, score and store one feedback")
                .register(meterRegistry);
    }

    public PredictResponse predict(PredictRequest request) {
        return predict(request, null);
    }

    /**
     * @param idempotencyKey optional client key; a repeated key resumes or replays the earlier
     *                       submission instead of storing a second feedback record
     */
    public PredictResponse predict(PredictRequest request, String idempotencyKey) {
        try {
            PredictResponse response = predictionTimer.record(() -> execute(request, idempotencyKey));
            countOutcome("success");
            return response;
        } catch (ApplicationException e) {
            countOutcome(e.getErrorCode());
            throw e;
        }
    }

    private PredictResponse execute(PredictRequest request, String idempotencyKey) {
        feedbackValidator.validate(request, idempotencyKey);

        if (idempotencyKey != null && !idempotencyKey.isBlank()) {
            Optional<FeedbackRecord> stored = persistenceGateway.findByIdempotencyKey(idempotencyKey);
            if (stored.isPresent()) {
                return resume(stored.get(), request);
            }
        } else {
            idempotencyKey = null;
        }

        String feedbackText = request.feedbackTextOrEmpty();
        Enrichment enrichment = enrichmentService.enrich(feedbackText);
        ChurnScore score = scoringEngine.score(request.rating(), feedbackText, enrichment.sentimentLabel());

        FeedbackRecord record = new FeedbackRecord();
        record.setRating(request.rating());
        record.setFeedbackText(feedbackText);
        record.setCreatedAt(LocalDateTime.now());
        record.setCommentSentiment(enrichment.sentimentLabel());
        record.setCommentTopics(new ArrayList<>(enrichment.topicSet()));
        record.setIdempotencyKey(idempotencyKey);

        log.info("Storing customer data (with insights)...");
        UUID feedbackId = store(() -> persistenceGateway.insertFeedback(record), ErrorCode.FEEDBACK_STORAGE_FAILED);

        log.info("Storing churn prediction for feedback {}...", feedbackId);
        ChurnPrediction prediction = store(
                () -> persistenceGateway.insertPrediction(feedbackId, newPrediction(score)),
                ErrorCode.PREDICTION_STORAGE_FAILED
        );

        return toResponse(feedbackId, prediction, record.getCommentSentiment(), record.getCommentTopics());
    }

    /**
     * Continues a submission whose feedback record already exists. A record left without a
     * prediction by an earlier failure is scored from its stored values and completed.
     *
     * @throws ValidationException if the key was stored with a different rating or text
     */
    private PredictResponse resume(FeedbackRecord stored, PredictRequest request) {
        UUID feedbackId = stored.getId();
        if (!matches(stored, request)) {
            log.warn("Idempotency key of feedback {} reused with a different request", feedbackId);
            throw new ValidationException(ErrorCode.IDEMPOTENCY_KEY_REUSED);
        }

        Optional<ChurnPrediction> existing = persistenceGateway.findPrediction(feedbackId);
        if (existing.isPresent()) {
            log.info("Replaying stored prediction for feedback {}", feedbackId);
            return toResponse(feedbackId, existing.get(), stored.getCommentSentiment(), stored.getCommentTopics());
        }

        log.info("Feedback {} has no prediction yet, completing it", feedbackId);
        ChurnScore score = scoringEngine.score(stored.getRating(), stored.getFeedbackText(), stored.getCommentSentiment());
        ChurnPrediction prediction = store(
                () -> persistenceGateway.insertPrediction(feedbackId, newPrediction(score)),
                ErrorCode.PREDICTION_STORAGE_FAILED
        );
        return toResponse(feedbackId, prediction, stored.getCommentSentiment(), stored.getCommentTopics());
    }

    private static boolean matches(FeedbackRecord stored, PredictRequest request) {
        String storedText = stored.getFeedbackText() == null ? "" : stored.getFeedbackText();
        return Objects.equals(stored.getRating(), request.rating())
                && storedText.equals(request.feedbackTextOrEmpty());
    }

    private static ChurnPrediction newPrediction(ChurnScore score) {
        ChurnPrediction prediction = new ChurnPrediction();
        prediction.setChurnProbability(score.probability());
        prediction.setReason(score.reason());
        prediction.setPredictedAt(LocalDateTime.now());
        return prediction;
    }

    // Commit-time failures surface outside the gateway's own handling
    private static <T> T store(Supplier<T> write, ErrorCode errorCode) {
        try {
            return write.get();
        } catch (DataAccessException | TransactionException e) {
            throw new StorageException(errorCode.getDefaultMessage(), errorCode.getCode(), e);
        }
    }

    private static PredictResponse toResponse(UUID feedbackId, ChurnPrediction prediction,
                                              String sentiment, List<String> topics) {
        return new PredictResponse(
                feedbackId.toString(),
                prediction.getChurnProbability(),
                prediction.getReason(),
                sentiment,
                topics == null ? List.of() : List.copyOf(topics)
        );
    }

    private void countOutcome(String outcome) {
        meterRegistry.counter("churn.prediction.requests", "outcome", outcome).increment();
    }
}
