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
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import ru.tigran.churnpredictor.dto.ErrorResponse;
import ru.tigran.churnpredictor.dto.PredictRequest;
import ru.tigran.churnpredictor.dto.PredictResponse;
import ru.tigran.churnpredictor.service.PredictionService;

@Slf4j
@RestController
@Tag(name = "Churn Prediction", description = "Оценка риска оттока клиента по отзыву")
public class PredictionController {

    private final PredictionService predictionService;

    public PredictionController(PredictionService predictionService) {
        this.predictionService = predictionService;
    }

    /**
     * Enriches the feedback, scores it and stores both the feedback and the prediction.
     * The call is synchronous; the response carries the identifier of the stored feedback.
     *
     * @param request        NLS score with optional feedback text
     * @param idempotencyKey optional client key; a repeated key returns the stored result
     * @return 200 OK with the churn prediction
     */
    @PostMapping("/predict")
    @Operation(
            summary = "Предсказать риск оттока",
            description = "Анализирует тональность и темы отзыва, вычисляет вероятность оттока " +
                    "и сохраняет отзыв вместе с предсказанием. " +
                    "Ошибки внешнего сервиса анализа текста не прерывают запрос."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Предсказание рассчитано и сохранено",
                    content = @Content(schema = @Schema(implementation = PredictResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Некорректный JSON, отсутствует NLS score или он вне диапазона 0..10",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "405",
                    description = "Метод отличается от POST",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "500",
                    description = "Ошибка сохранения данных",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<PredictResponse> predict(
            @RequestBody PredictRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false)
            @Parameter(description = "Ключ идемпотентности, опционально")
            String idempotencyKey
    ) {
        log.info("POST /predict - nls_score: {}, idempotent: {}", request.rating(), idempotencyKey != null);

        PredictResponse response = predictionService.predict(request, idempotencyKey);

        log.info("Prediction for customer {}: probability={}, reason={}",
                response.customerId(), response.churnProbability(), response.reason());
        return ResponseEntity.ok(response);
    }
}
