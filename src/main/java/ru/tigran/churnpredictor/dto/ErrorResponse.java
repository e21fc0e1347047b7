package ru.tigran.churnpredictor.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Error body returned for every non-2xx response")
public record ErrorResponse(
        @Schema(description = "Stable, human readable error message", example = "NLS score is required.")
        String error
) {
}
