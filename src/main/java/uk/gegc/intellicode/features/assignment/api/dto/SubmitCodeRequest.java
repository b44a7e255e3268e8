package uk.gegc.intellicode.features.assignment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "SubmitCodeRequest", description = "Source code submitted for a code sandbox assignment")
public record SubmitCodeRequest(
        @Schema(description = "Submitted source code", example = "print('hello')")
        @NotBlank(message = "Code cannot be empty")
        String code,

        @Schema(description = "Programming language of the code", example = "python")
        @NotBlank(message = "Programming language must be specified")
        @Size(max = 50, message = "Language must not exceed 50 characters")
        String language
) {
}
