package io.deedchain.core.model;

public record PropertyInfo(
        long propertyId,
        String owner,
        PropertyMetadata metadata,
        VerificationRecord verification
) {
}
