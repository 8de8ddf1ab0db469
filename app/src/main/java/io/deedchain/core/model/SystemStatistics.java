package io.deedchain.core.model;

public record SystemStatistics(
        long totalProperties,
        long totalTransfers,
        long totalVerified,
        long height
) {
}
