package uk.gegc.intellicode.features.assignment.api.dto;

import uk.gegc.intellicode.features.assignment.domain.model.StoredFileType;

import java.time.LocalDateTime;
import java.util.UUID;

public record SubmissionFileDto(
        UUID id,
        String originalName,
        String mimeType,
        StoredFileType fileType,
        long size,
        String publicUrl,
        LocalDateTime uploadedAt
) {
}
