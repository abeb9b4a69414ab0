package dev.wizards.engine;

import dev.wizards.model.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Step whose validation outcome is scripted by the test, recording every lifecycle call.
 */
class ScriptedStep extends BaseStep<TestContext> {

    final String name;
    final List<String> calls;
    Supplier<ValidationResult> validation = ValidationResult::valid;
    Runnable onNextAction = () -> {};
    boolean skippable;
    int setupCount;
    int validateCount;
    TestContext contextSeenOnShow;

    ScriptedStep(TestContext context, String name, List<String> calls) {
        super(context);
        this.name = name;
        this.calls = calls;
    }

    ScriptedStep(TestContext context, String name) {
        this(context, name, new ArrayList<>());
    }

    ScriptedStep failingWith(String... errors) {
        validation = () -> ValidationResult.invalid(errors);
        return this;
    }

    void reportValidity(boolean valid) {
        emitValidationChanged(valid);
    }

    void store(String key, Object value) {
        saveToContext(key, value);
    }

    @Override
    protected void setupUi() {
        setupCount++;
        calls.add(name + ":setup");
    }

    @Override
    protected void populateData() {
        contextSeenOnShow = context();
        calls.add(name + ":populate");
    }

    @Override
    public ValidationResult validate() {
        validateCount++;
        calls.add(name + ":validate");
        return validation.get();
    }

    @Override
    public Map<String, Object> collectData() {
        return Map.of("step", name);
    }

    @Override
    public void onNext() {
        calls.add(name + ":next");
        onNextAction.run();
    }

    @Override
    public void onHide() {
        calls.add(name + ":hide");
    }

    @Override
    public boolean canSkip() {
        return skippable;
    }

    @Override
    public String getStepTitle() {
        return name;
    }
}
