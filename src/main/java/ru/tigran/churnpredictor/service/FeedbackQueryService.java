package ru.tigran.churnpredictor.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.tigran.churnpredictor.dto.FeedbackRecordResponse;
import ru.tigran.churnpredictor.exception.ErrorCode;
import ru.tigran.churnpredictor.exception.ResourceNotFoundException;
import ru.tigran.churnpredictor.model.FeedbackRecord;
import ru.tigran.churnpredictor.repository.ChurnPredictionRepository;
import ru.tigran.churnpredictor.repository.FeedbackRecordRepository;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
public class FeedbackQueryService {

    private final FeedbackRecordRepository feedbackRecordRepository;
    private final ChurnPredictionRepository churnPredictionRepository;

    public FeedbackQueryService(
            FeedbackRecordRepository feedbackRecordRepository,
            ChurnPredictionRepository churnPredictionRepository
    ) {
        this.feedbackRecordRepository = feedbackRecordRepository;
        this.churnPredictionRepository = churnPredictionRepository;
    }

    /**
     * Loads a feedback record with its prediction, if one was stored.
     *
     * @throws ResourceNotFoundException when no record has this identifier
     */
    @Transactional(readOnly = true)
    public FeedbackRecordResponse getFeedback(UUID feedbackId) {
        log.debug("Fetching feedback record {}", feedbackId);

        FeedbackRecord record = feedbackRecordRepository.findById(feedbackId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Feedback record " + feedbackId + " not found",
                        ErrorCode.FEEDBACK_NOT_FOUND.getCode()
                ));

        FeedbackRecordResponse.PredictionView prediction = churnPredictionRepository
                .findByFeedbackRecordId(feedbackId)
                .map(p -> new FeedbackRecordResponse.PredictionView(
                        p.getId(), p.getChurnProbability(), p.getReason(), p.getPredictedAt()))
                .orElse(null);

        return new FeedbackRecordResponse(
                record.getId(),
                record.getRating(),
                record.getFeedbackText(),
                record.getCreatedAt(),
                record.getCommentSentiment(),
                record.getCommentTopics() == null ? List.of() : List.copyOf(record.getCommentTopics()),
                prediction
        );
    }
}
