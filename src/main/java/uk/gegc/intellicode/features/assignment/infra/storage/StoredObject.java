package uk.gegc.intellicode.features.assignment.infra.storage;

public record StoredObject(String key, String publicUrl) {
}
