package dev.wizards.survey;

import java.util.List;
import java.util.Map;

public class ReviewStep extends SurveyStep {

    private static final List<String> LABELS = List.of(
        "Reference", "Building", "Unit", "Persons", "Relations", "Claim");

    public ReviewStep(SurveyContext context) {
        super(context, SurveyStepRules.STEP_REVIEW);
    }

    @Override
    protected List<String> fieldLabels() {
        return LABELS;
    }

    @Override
    protected Map<String, String> currentValues() {
        Map<String, Object> summary = context().getSummary();
        Object unit = Boolean.TRUE.equals(summary.get("is_new_unit")) ? "new unit" : summary.get("unit_id");
        return Map.of(
            "Reference", orEmpty(summary.get("reference_number")),
            "Building", orEmpty(summary.get("building_id")),
            "Unit", orEmpty(unit),
            "Persons", orEmpty(summary.get("persons_count")),
            "Relations", orEmpty(summary.get("relations_count")),
            "Claim", Boolean.TRUE.equals(summary.get("has_claim")) ? orEmpty(context().claimData().claimId()) : "none");
    }

    @Override
    public Map<String, Object> collectData() {
        return context().getSummary();
    }

    @Override
    public String getStepDescription() {
        return "Check the collected data before finishing";
    }
}
