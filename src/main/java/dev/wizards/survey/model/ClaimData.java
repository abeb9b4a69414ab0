package dev.wizards.survey.model;

/**
 * Claim created for the surveyed unit. {@code caseStatus} is {@code submitted} when evidence
 * backs the claim, {@code draft} otherwise.
 */
public record ClaimData(
    String claimId,
    String claimType,
    String caseStatus
) {}
