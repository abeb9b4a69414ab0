package dev.wizards.engine;

import dev.wizards.model.EventEmitter;
import dev.wizards.model.StepEvent;
import dev.wizards.model.ValidationResult;

import java.util.Map;
import java.util.function.Consumer;

/**
 * A single page of a wizard. Steps are created once per wizard and only shown and hidden
 * afterwards, so {@link #populateData()} runs on every show to resync with the shared context.
 *
 * @param <C> the context type shared by all steps of the wizard
 */
public abstract class BaseStep<C extends WizardContext> {

    private final EventEmitter<StepEvent> events = new EventEmitter<>();
    private C context;
    private boolean initialized;

    protected BaseStep(C context) {
        this.context = context;
    }

    /** Build the step's presentation. Runs at most once, on first display. */
    protected abstract void setupUi();

    /** Check the step's data. A result with errors keeps the wizard on this step. */
    public abstract ValidationResult validate();

    /** This step's contribution to the overall submission. */
    public abstract Map<String, Object> collectData();

    /** Refresh the presentation from the context. Called on every show, including re-visits. */
    protected void populateData() {
    }

    /**
     * Side effect run after successful validation and before the next step is shown.
     * Failures propagate to the caller.
     *
     * @throws StepActionException if the side effect fails and the wizard must stay on this step
     */
    public void onNext() {
    }

    public void onHide() {
    }

    public boolean canSkip() {
        return false;
    }

    public boolean isOptional() {
        return false;
    }

    public String getStepTitle() {
        return getClass().getSimpleName();
    }

    public String getStepDescription() {
        return "";
    }

    public final void initialize() {
        if (!initialized) {
            setupUi();
            initialized = true;
        }
    }

    public final void onShow() {
        initialize();
        populateData();
    }

    public boolean isInitialized() { return initialized; }

    public C context() { return context; }

    void bindContext(C context) {
        this.context = context;
    }

    public EventEmitter.Subscription subscribe(Consumer<? super StepEvent> listener) {
        return events.subscribe(listener);
    }

    /** Write to the shared data bag and publish {@link StepEvent.DataChanged}. */
    protected void saveToContext(String key, Object value) {
        context.updateData(key, value);
        events.emit(new StepEvent.DataChanged(key, value));
    }

    /** Tell the navigator the step's validity changed while it is being edited. */
    protected void emitValidationChanged(boolean valid) {
        events.emit(new StepEvent.ValidationChanged(valid));
    }

    protected <T> T getFromContext(String key, Class<T> type, T defaultValue) {
        return context.getData(key, type, defaultValue);
    }

    protected ValidationResult createValidationResult() {
        return ValidationResult.valid();
    }
}
