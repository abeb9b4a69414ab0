package dev.wizards.survey;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class RelationStep extends SurveyStep {

    public RelationStep(SurveyContext context) {
        super(context, SurveyStepRules.STEP_RELATIONS);
    }

    @Override
    protected List<String> fieldLabels() {
        return List.of("Relations", "Evidence");
    }

    @Override
    protected Map<String, String> currentValues() {
        String relations = context().relations().stream()
            .map(r -> r.personId() + " (" + r.relationType() + ")")
            .collect(Collectors.joining(", "));
        int evidence = context().relations().stream().mapToInt(r -> r.evidenceCount()).sum();
        return Map.of("Relations", relations, "Evidence", String.valueOf(evidence));
    }

    @Override
    public Map<String, Object> collectData() {
        return Map.of("relations_count", context().relations().size());
    }
}
