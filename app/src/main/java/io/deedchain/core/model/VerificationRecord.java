package io.deedchain.core.model;

/**
 * Verification state of a property. {@code verifier} is null until verified.
 */
public record VerificationRecord(
        boolean verified,
        String verifier,
        long verifiedAt,
        String notes
) {

    public static VerificationRecord unverified() {
        return new VerificationRecord(false, null, 0L, "");
    }

    public static VerificationRecord verifiedBy(String verifier, long height, String notes) {
        return new VerificationRecord(true, verifier, height, notes);
    }
}
