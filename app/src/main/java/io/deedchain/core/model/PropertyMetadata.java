package io.deedchain.core.model;

/**
 * Canonical record of a property. Timestamps are block heights.
 */
public record PropertyMetadata(
        String title,
        String description,
        String location,
        String category,
        long totalArea,
        String areaUnit,
        long registeredAt,
        long lastModified,
        PropertyStatus status
) {

    public static PropertyMetadata registered(PropertyDetails details, long height) {
        return new PropertyMetadata(
                details.title(),
                details.description(),
                details.location(),
                details.category(),
                details.totalArea(),
                details.areaUnit(),
                height,
                height,
                PropertyStatus.ACTIVE
        );
    }

    /** Replace the descriptive fields; status and registration height are kept. */
    public PropertyMetadata withDetails(PropertyDetails details, long height) {
        return new PropertyMetadata(
                details.title(),
                details.description(),
                details.location(),
                details.category(),
                details.totalArea(),
                details.areaUnit(),
                registeredAt,
                height,
                status
        );
    }

    public PropertyMetadata withStatus(PropertyStatus newStatus, long height) {
        return new PropertyMetadata(title, description, location, category, totalArea, areaUnit,
                registeredAt, height, newStatus);
    }

    public PropertyMetadata touchedAt(long height) {
        return new PropertyMetadata(title, description, location, category, totalArea, areaUnit,
                registeredAt, height, status);
    }

    public PropertyDetails details() {
        return new PropertyDetails(title, description, location, category, totalArea, areaUnit);
    }
}
