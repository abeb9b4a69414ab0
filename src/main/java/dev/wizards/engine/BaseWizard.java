package dev.wizards.engine;

import dev.wizards.model.EventEmitter;
import dev.wizards.model.NavigationEvent;
import dev.wizards.model.ValidationResult;
import dev.wizards.model.WizardEvent;
import dev.wizards.model.WizardStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Owns the context, the steps and the navigator of one wizard run, and binds the navigation,
 * submit, cancel and save-draft controls to them.
 *
 * <p>Subclasses supply the context, the ordered steps and the submission hook. A wizard is built
 * by {@link #open()}, which creates everything and shows the first step.
 */
public abstract class BaseWizard<C extends WizardContext> {

    private static final Logger logger = LoggerFactory.getLogger(BaseWizard.class);

    private final EventEmitter<WizardEvent> events = new EventEmitter<>();
    private WizardView view = WizardView.NONE;
    private C context;
    private List<BaseStep<C>> steps;
    private StepNavigator<C> navigator;
    private boolean opened;
    private boolean closed;

    protected abstract C createContext();

    protected abstract List<BaseStep<C>> createSteps(C context);

    /**
     * Persist the finished run. Implementations surface their own failures to the user before
     * returning {@code false}.
     */
    protected abstract boolean onSubmit();

    /** @return whether cancellation should proceed */
    protected boolean onCancel() {
        return true;
    }

    /** @return the id of the saved draft, or empty if nothing was saved */
    protected Optional<String> onSaveDraft() {
        return Optional.empty();
    }

    protected StepNavigator<C> createNavigator(C context, List<BaseStep<C>> steps) {
        return new StepNavigator<>(context, steps);
    }

    public String getWizardTitle() {
        return "Wizard";
    }

    public String getSubmitButtonText() {
        return "Finish";
    }

    public String getNextButtonText() {
        return "Next";
    }

    /**
     * Create the context, the steps and the navigator, then activate the first step with no
     * validation.
     */
    public void open() {
        if (opened) {
            throw new IllegalStateException("Wizard already opened: " + getWizardTitle());
        }
        opened = true;
        context = createContext();
        steps = List.copyOf(createSteps(context));
        navigator = createNavigator(context, steps);
        navigator.subscribe(this::onNavigationEvent);

        logger.info("Opened {} ({} steps, reference {})", getWizardTitle(), steps.size(), context.referenceNumber());
        navigator.start();
    }

    public void setView(WizardView view) {
        this.view = view == null ? WizardView.NONE : view;
    }

    public EventEmitter.Subscription subscribe(Consumer<? super WizardEvent> listener) {
        return events.subscribe(listener);
    }

    public C context() { return context; }
    public StepNavigator<C> navigator() { return navigator; }
    public List<BaseStep<C>> steps() { return steps; }
    public boolean isOpen() { return opened && !closed; }
    public boolean isClosed() { return closed; }

    /**
     * Next control: submits on the last step, otherwise advances. A failing {@code onNext()} side
     * effect is surfaced like a validation failure and the step stays active.
     */
    public boolean handleNext() {
        if (!isOpen()) {
            return false;
        }
        if (navigator.isLastStep()) {
            return handleSubmit();
        }
        boolean moved;
        try {
            moved = navigator.nextStep();
        } catch (RuntimeException e) {
            logger.error("Step {} failed before advancing", navigator.getCurrentStep().getStepTitle(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            onValidationFailed(ValidationResult.invalid(message));
            return false;
        }
        if (moved && context.status() == WizardStatus.DRAFT) {
            context.setStatus(WizardStatus.IN_PROGRESS);
        }
        return moved;
    }

    public boolean handlePrevious() {
        if (!isOpen()) {
            return false;
        }
        return navigator.previousStep();
    }

    /**
     * Re-validate the last step, then hand over to {@link #onSubmit()}. On success the wizard
     * publishes {@link WizardEvent.Completed} and closes. Refused on any other step.
     */
    public boolean handleSubmit() {
        if (!isOpen()) {
            return false;
        }
        if (!navigator.isLastStep()) {
            logger.warn("Submit refused for {} at step {} of {}", context.referenceNumber(),
                navigator.getCurrentIndex() + 1, navigator.getStepCount());
            return false;
        }
        ValidationResult result = navigator.getCurrentStep().validate();
        if (!result.isValid()) {
            onValidationFailed(result);
            return false;
        }
        context.markStepCompleted(navigator.getCurrentIndex());

        boolean submitted;
        try {
            submitted = onSubmit();
        } catch (RuntimeException e) {
            logger.error("Submission of {} failed", context.referenceNumber(), e);
            view.showError("Submission failed: " + e.getMessage());
            return false;
        }
        if (!submitted) {
            return false;
        }

        context.setStatus(WizardStatus.COMPLETED);
        Map<String, Object> snapshot;
        try {
            snapshot = context.toMap();
        } catch (RuntimeException e) {
            logger.warn("Could not serialize completed context {}", context.referenceNumber(), e);
            snapshot = Map.of();
        }
        logger.info("Completed {}", context.referenceNumber());
        events.emit(new WizardEvent.Completed(snapshot));
        close();
        return true;
    }

    public boolean handleCancel() {
        if (!isOpen()) {
            return false;
        }
        if (!onCancel()) {
            return false;
        }
        context.setStatus(WizardStatus.CANCELLED);
        logger.info("Cancelled {}", context.referenceNumber());
        events.emit(new WizardEvent.Cancelled());
        close();
        return true;
    }

    public Optional<String> handleSaveDraft() {
        if (!isOpen()) {
            return Optional.empty();
        }
        Optional<String> draftId = onSaveDraft().filter(id -> !id.isBlank());
        draftId.ifPresent(id -> {
            events.emit(new WizardEvent.DraftSaved(id));
            view.showSuccess("Draft saved\nDraft ID: " + id);
        });
        return draftId;
    }

    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        view.close();
    }

    /**
     * Replace the fresh context with a restored one, rebind every step to it and move to the
     * stored step without validation. An out-of-range stored index falls back to the first step.
     */
    public void restoreContext(C restored) {
        if (!opened) {
            throw new IllegalStateException("Wizard must be opened before restoring a context");
        }
        int saved = restored.currentStepIndex();
        if (saved < 0 || saved >= steps.size()) {
            logger.warn("Stored step {} out of range for {} steps, starting over", saved, steps.size());
            saved = 0;
        }
        context = restored;
        for (BaseStep<C> step : steps) {
            step.bindContext(restored);
        }
        navigator.bindContext(restored);

        if (saved == navigator.getCurrentIndex()) {
            restored.setCurrentStepIndex(saved);
            navigator.getCurrentStep().onShow();
            updateProgress();
            updateNavigation();
        } else {
            navigator.gotoStep(saved, true);
        }
    }

    /**
     * Open a fresh wizard and resume it from a draft snapshot.
     *
     * @param factory  builds an unopened wizard
     * @param restorer rebuilds the concrete context from the snapshot
     */
    public static <C extends WizardContext, W extends BaseWizard<C>> W resumeFromDraft(
            Supplier<W> factory, Function<Map<String, ?>, C> restorer, Map<String, ?> snapshot) {
        C restored = restorer.apply(snapshot);
        W wizard = factory.get();
        wizard.open();
        wizard.restoreContext(restored);
        logger.info("Resumed {} at step {}", restored.referenceNumber(), restored.currentStepIndex());
        return wizard;
    }

    protected void onValidationFailed(ValidationResult result) {
        view.showWarning(ValidationMessages.format(result));
    }

    protected WizardView view() {
        return view;
    }

    private void onNavigationEvent(NavigationEvent event) {
        if (event instanceof NavigationEvent.StepChanged changed) {
            view.showStep(changed.newIndex(), navigator.getStep(changed.newIndex()));
            updateProgress();
            updateNavigation();
        } else if (event instanceof NavigationEvent.CanGoNextChanged
                || event instanceof NavigationEvent.CanGoPreviousChanged) {
            updateNavigation();
        } else if (event instanceof NavigationEvent.ValidationFailed failed) {
            onValidationFailed(failed.result());
        }
    }

    private void updateProgress() {
        view.updateProgress(navigator.getCurrentIndex() + 1, navigator.getStepCount(),
            (int) navigator.getProgressPercentage());
    }

    private void updateNavigation() {
        String nextLabel = navigator.isLastStep() ? getSubmitButtonText() : getNextButtonText();
        view.updateNavigation(navigator.canGoPrevious(), nextLabel);
    }
}
