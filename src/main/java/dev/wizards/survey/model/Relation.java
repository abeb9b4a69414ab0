package dev.wizards.survey.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Tenure relation between a person and the surveyed unit, e.g. owner or tenant.
 */
public record Relation(
    String personId,
    String relationType,
    int evidenceCount
) {
    @JsonIgnore
    public boolean isOwnership() {
        return "owner".equals(relationType) || "co_owner".equals(relationType);
    }
}
