package io.deedchain.core.model;

/**
 * Descriptive fields supplied by callers on registration and metadata updates.
 */
public record PropertyDetails(
        String title,
        String description,
        String location,
        String category,
        long totalArea,
        String areaUnit
) {
}
