package dev.wizards.survey.model;

public record Household(
    String headName,
    int size,
    String occupancyType
) {}
