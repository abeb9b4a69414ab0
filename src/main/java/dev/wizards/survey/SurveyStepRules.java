package dev.wizards.survey;

import dev.wizards.model.ValidationResult;

/**
 * Data checks for each office survey step, evaluated against the context only.
 */
public final class SurveyStepRules {

    public static final int STEP_BUILDING = 0;
    public static final int STEP_UNIT = 1;
    public static final int STEP_HOUSEHOLD = 2;
    public static final int STEP_PERSONS = 3;
    public static final int STEP_RELATIONS = 4;
    public static final int STEP_CLAIM = 5;
    public static final int STEP_REVIEW = 6;

    private static final String[] STEP_NAMES = {
        "Building selection",
        "Property unit",
        "Household and occupancy",
        "Persons",
        "Relations and evidence",
        "Claim",
        "Final review"
    };

    private SurveyStepRules() {}

    public static ValidationResult validate(int stepIndex, SurveyContext context) {
        var result = ValidationResult.valid();
        switch (stepIndex) {
            case STEP_BUILDING -> {
                if (context.building() == null) {
                    result.addError("A building must be selected to continue");
                }
            }
            case STEP_UNIT -> {
                if (context.unit() == null && !context.isNewUnit()) {
                    result.addError("A property unit must be selected or created");
                }
            }
            case STEP_HOUSEHOLD -> {
                if (context.households().isEmpty()) {
                    result.addWarning("No household was recorded for this unit");
                }
            }
            case STEP_PERSONS -> {
                if (context.persons().isEmpty()) {
                    result.addError("At least one person must be registered");
                }
            }
            case STEP_RELATIONS -> {
                if (context.relations().isEmpty()) {
                    result.addError("At least one relation must be added to continue");
                } else if (context.relations().stream().allMatch(r -> r.evidenceCount() == 0)) {
                    result.addWarning("No evidence is attached to any relation");
                }
            }
            case STEP_CLAIM -> {
                // Claim is created by the step itself
            }
            case STEP_REVIEW -> {
                if (context.building() == null) {
                    result.addError("No building selected");
                }
                if (context.unit() == null && !context.isNewUnit()) {
                    result.addError("No unit selected");
                }
                if (context.persons().isEmpty()) {
                    result.addError("No persons registered");
                }
            }
            default -> {
            }
        }
        return result;
    }

    public static String stepName(int stepIndex) {
        if (stepIndex >= 0 && stepIndex < STEP_NAMES.length) {
            return STEP_NAMES[stepIndex];
        }
        return "";
    }
}
