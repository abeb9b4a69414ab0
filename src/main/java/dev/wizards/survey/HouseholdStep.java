package dev.wizards.survey;

import java.util.List;
import java.util.Map;

/**
 * Household registration. Optional: an empty household list only produces a warning.
 */
public class HouseholdStep extends SurveyStep {

    public HouseholdStep(SurveyContext context) {
        super(context, SurveyStepRules.STEP_HOUSEHOLD);
    }

    @Override
    protected List<String> fieldLabels() {
        return List.of("Households", "Occupants");
    }

    @Override
    protected Map<String, String> currentValues() {
        int occupants = context().households().stream().mapToInt(h -> h.size()).sum();
        return Map.of(
            "Households", String.valueOf(context().households().size()),
            "Occupants", String.valueOf(occupants));
    }

    @Override
    public Map<String, Object> collectData() {
        return Map.of("households_count", context().households().size());
    }

    @Override
    public boolean isOptional() {
        return true;
    }
}
