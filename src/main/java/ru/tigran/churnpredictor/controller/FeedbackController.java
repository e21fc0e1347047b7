package ru.tigran.churnpredictor.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.tigran.churnpredictor.dto.FeedbackRecordResponse;
import ru.tigran.churnpredictor.service.FeedbackQueryService;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/feedback")
@Tag(name = "Feedback", description = "Просмотр сохраненных отзывов и предсказаний")
public class FeedbackController {

    private final FeedbackQueryService feedbackQueryService;

    public FeedbackController(FeedbackQueryService feedbackQueryService) {
        this.feedbackQueryService = feedbackQueryService;
    }

    @GetMapping("/{feedbackId}")
    @Operation(
            summary = "Получить отзыв по ID",
            description = "Возвращает сохраненный отзыв с результатами анализа и предсказанием оттока, если оно есть."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Отзыв найден",
                    content = @Content(schema = @Schema(implementation = FeedbackRecordResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "ID не является UUID"),
            @ApiResponse(responseCode = "404", description = "Отзыв с указанным ID не найден")
    })
    public ResponseEntity<FeedbackRecordResponse> getFeedback(
            @PathVariable
            @Parameter(description = "ID отзыва", example = "3f6c1a52-0c1e-4a8e-9d55-2b0f3f2e7c11")
            UUID feedbackId
    ) {
        log.info("GET /api/v1/feedback/{}", feedbackId);
        return ResponseEntity.ok(feedbackQueryService.getFeedback(feedbackId));
    }
}
