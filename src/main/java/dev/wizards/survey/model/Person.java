package dev.wizards.survey.model;

public record Person(
    String personId,
    String fullName,
    String nationalId
) {}
