package uk.gegc.intellicode.features.assignment.domain.model;

public enum StoredFileType {
    IMAGE,
    VIDEO,
    PDF,
    DOCUMENT;

    public static StoredFileType fromMimeType(String mimeType) {
        if (mimeType == null) {
            return DOCUMENT;
        }
        if (mimeType.startsWith("image/")) {
            return IMAGE;
        }
        if (mimeType.startsWith("video/")) {
            return VIDEO;
        }
        if (mimeType.equals("application/pdf")) {
            return PDF;
        }
        return DOCUMENT;
    }
}
