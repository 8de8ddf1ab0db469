package io.deedchain.core.model;

public record DocumentRecord(
        String title,
        String documentType,
        String hash,
        long uploadedAt,
        String uploader,
        String description
) {
}
