package ru.tigran.churnpredictor.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import ru.tigran.churnpredictor.exception.ErrorCode;
import ru.tigran.churnpredictor.exception.StorageException;
import ru.tigran.churnpredictor.model.ChurnPrediction;
import ru.tigran.churnpredictor.model.FeedbackRecord;
import ru.tigran.churnpredictor.repository.ChurnPredictionRepository;
import ru.tigran.churnpredictor.repository.FeedbackRecordRepository;

import java.util.Optional;
import java.util.UUID;

/**
 * Writes feedback records and churn predictions.
 *
 * The two inserts run in separate transactions and are never retried. If the prediction
 * insert fails, the feedback row stays in place without a prediction; it is not deleted.
 * A later request carrying the same idempotency key finds that row and only inserts the
 * missing prediction, which is why {@link #insertPrediction} is idempotent per feedback id.
 */
@Slf4j
@Service
public class PersistenceGateway {

    private final FeedbackRecordRepository feedbackRecordRepository;
    private final ChurnPredictionRepository churnPredictionRepository;

    public PersistenceGateway(
            FeedbackRecordRepository feedbackRecordRepository,
            ChurnPredictionRepository churnPredictionRepository
    ) {
        this.feedbackRecordRepository = feedbackRecordRepository;
        this.churnPredictionRepository = churnPredictionRepository;
    }

    /**
     * Stores the feedback record.
     *
     * @return identifier assigned on insert
     * @throws StorageException if the write fails or no identifier comes back
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public UUID insertFeedback(FeedbackRecord record) {
        FeedbackRecord saved;
        try {
            saved = feedbackRecordRepository.saveAndFlush(record);
        } catch (DataAccessException e) {
            throw new StorageException(
                    "Error storing customer data: " + e.getMostSpecificCause().getMessage(),
                    ErrorCode.FEEDBACK_STORAGE_FAILED.getCode(),
                    e
            );
        }
        if (saved == null || saved.getId() == null) {
            throw new StorageException("No data returned after insert", ErrorCode.FEEDBACK_STORAGE_FAILED.getCode());
        }
        log.info("Customer data stored successfully. ID: {}", saved.getId());
        return saved.getId();
    }

    /**
     * Stores the prediction for an already stored feedback record.
     * If that record already has a prediction, the existing one is returned unchanged.
     *
     * @param feedbackId identifier returned by {@link #insertFeedback}
     * @throws StorageException if the write fails
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ChurnPrediction insertPrediction(UUID feedbackId, ChurnPrediction prediction) {
        if (feedbackId == null) {
            throw new IllegalArgumentException("Prediction requires the identifier of a stored feedback record");
        }
        try {
            Optional<ChurnPrediction> existing = churnPredictionRepository.findByFeedbackRecordId(feedbackId);
            if (existing.isPresent()) {
                log.info("Churn prediction for feedback {} already stored, reusing {}", feedbackId, existing.get().getId());
                return existing.get();
            }

            prediction.setFeedbackRecord(feedbackRecordRepository.getReferenceById(feedbackId));
            ChurnPrediction saved = churnPredictionRepository.saveAndFlush(prediction);
            log.info("Churn prediction stored successfully. ID: {}, feedback: {}", saved.getId(), feedbackId);
            return saved;
        } catch (DataAccessException e) {
            throw new StorageException(
                    "Error storing churn prediction: " + e.getMostSpecificCause().getMessage(),
                    ErrorCode.PREDICTION_STORAGE_FAILED.getCode(),
                    e
            );
        }
    }

    @Transactional(readOnly = true)
    public Optional<FeedbackRecord> findByIdempotencyKey(String idempotencyKey) {
        return feedbackRecordRepository.findByIdempotencyKey(idempotencyKey);
    }

    @Transactional(readOnly = true)
    public Optional<ChurnPrediction> findPrediction(UUID feedbackId) {
        return churnPredictionRepository.findByFeedbackRecordId(feedbackId);
    }
}
