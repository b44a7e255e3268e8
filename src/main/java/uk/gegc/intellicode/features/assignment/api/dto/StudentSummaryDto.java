package uk.gegc.intellicode.features.assignment.api.dto;

import java.util.UUID;

public record StudentSummaryDto(UUID id, String firstName, String lastName, String email) {
}
