package dev.wizards.survey.model;

/**
 * A surveyed building, identified by its 17-digit building code and its registry UUID.
 */
public record Building(
    String buildingId,
    String buildingUuid,
    String address
) {}
