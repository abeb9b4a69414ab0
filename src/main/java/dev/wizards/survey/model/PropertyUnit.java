package dev.wizards.survey.model;

/**
 * A unit inside a building (apartment, shop, ...).
 */
public record PropertyUnit(
    String unitId,
    String unitUuid,
    String unitType,
    Integer floorNumber
) {}
