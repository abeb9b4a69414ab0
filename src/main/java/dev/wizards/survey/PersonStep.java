package dev.wizards.survey;

import dev.wizards.survey.model.Person;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class PersonStep extends SurveyStep {

    public PersonStep(SurveyContext context) {
        super(context, SurveyStepRules.STEP_PERSONS);
    }

    @Override
    protected List<String> fieldLabels() {
        return List.of("Persons");
    }

    @Override
    protected Map<String, String> currentValues() {
        return Map.of("Persons", context().persons().stream()
            .map(Person::fullName)
            .collect(Collectors.joining(", ")));
    }

    @Override
    public Map<String, Object> collectData() {
        return Map.of("persons_count", context().persons().size());
    }

    @Override
    public String getStepDescription() {
        return "Register every person linked to the unit";
    }
}
