package uk.gegc.intellicode.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "MessageResponse", description = "Plain confirmation message")
public record MessageResponse(
        @Schema(description = "Human readable message")
        String message
) {}
