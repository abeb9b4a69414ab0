package dev.wizards.survey;

import dev.wizards.engine.BaseStep;
import dev.wizards.model.ValidationResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Office survey step backed by {@link SurveyStepRules}. Its presentation is a list of labelled
 * fields, declared once and refreshed from the context on every show.
 */
public abstract class SurveyStep extends BaseStep<SurveyContext> {

    private final int stepIndex;
    private final Map<String, String> fields = new LinkedHashMap<>();

    protected SurveyStep(SurveyContext context, int stepIndex) {
        super(context);
        this.stepIndex = stepIndex;
    }

    /** Labels of the fields this step displays, in display order. */
    protected abstract List<String> fieldLabels();

    /** Current values for the fields, read from the context. */
    protected abstract Map<String, String> currentValues();

    @Override
    protected void setupUi() {
        for (String label : fieldLabels()) {
            fields.put(label, "");
        }
    }

    @Override
    protected void populateData() {
        Map<String, String> values = currentValues();
        fields.replaceAll((label, old) -> values.getOrDefault(label, ""));
    }

    @Override
    public ValidationResult validate() {
        return SurveyStepRules.validate(stepIndex, context());
    }

    /** Re-run the rules after the host edited this step's data and publish the outcome. */
    public ValidationResult revalidate() {
        ValidationResult result = validate();
        emitValidationChanged(result.isValid());
        return result;
    }

    @Override
    public String getStepTitle() {
        return SurveyStepRules.stepName(stepIndex);
    }

    public int stepIndex() { return stepIndex; }

    public Map<String, String> fields() {
        return Collections.unmodifiableMap(fields);
    }

    /** Plain-text rendering of the step for console hosts. */
    public String render() {
        String body = fields.entrySet().stream()
            .map(e -> "  %s: %s".formatted(e.getKey(), e.getValue().isEmpty() ? "-" : e.getValue()))
            .collect(Collectors.joining("\n"));
        String description = getStepDescription();
        return description.isEmpty()
            ? getStepTitle() + "\n" + body
            : getStepTitle() + " - " + description + "\n" + body;
    }

    static String orEmpty(Object value) {
        return value == null ? "" : value.toString();
    }
}
