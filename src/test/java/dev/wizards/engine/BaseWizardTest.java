package dev.wizards.engine;

import dev.wizards.model.ValidationResult;
import dev.wizards.model.WizardEvent;
import dev.wizards.model.WizardStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BaseWizardTest {

    private TestWizard wizard;
    private RecordingView view;
    private List<WizardEvent> events;

    @BeforeEach
    void setUp() {
        wizard = new TestWizard(3);
        view = new RecordingView();
        wizard.setView(view);
        events = new ArrayList<>();
        wizard.subscribe(events::add);
        wizard.open();
    }

    @Test
    void openShowsFirstStepWithoutValidation() {
        assertThat(wizard.navigator().getCurrentIndex()).isZero();
        assertThat(wizard.step(0).isInitialized()).isTrue();
        assertThat(wizard.step(0).validateCount).isZero();
        assertThat(view.events).containsExactly("show:0", "progress:1/3");
        assertThat(view.canGoPrevious).isFalse();
        assertThat(view.nextLabel).isEqualTo("Next");
    }

    @Test
    void freshWizardSnapshotHasNoProgress() {
        var snapshot = wizard.context().toMap();

        assertThat(snapshot.get("current_step_index")).isEqualTo(0);
        assertThat(snapshot.get("completed_steps")).isEqualTo(List.of());
    }

    @Test
    void cannotOpenTwice() {
        assertThatThrownBy(() -> wizard.open()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void nextMovesAndRefreshesView() {
        assertThat(wizard.handleNext()).isTrue();

        assertThat(view.events).endsWith("show:1", "progress:2/3");
        assertThat(view.percentage).isEqualTo(50);
        assertThat(view.canGoPrevious).isTrue();
        assertThat(wizard.context().status()).isEqualTo(WizardStatus.IN_PROGRESS);
    }

    @Test
    void lastStepShowsSubmitLabel() {
        wizard.handleNext();
        wizard.handleNext();

        assertThat(view.nextLabel).isEqualTo("Finish");
    }

    @Test
    void stepValidityChangeRefreshesNavigation() {
        int before = view.navigationUpdates;

        wizard.step(0).reportValidity(false);

        assertThat(view.navigationUpdates).isEqualTo(before + 1);
        assertThat(view.nextLabel).isEqualTo("Next");
    }

    @Test
    void validationFailureIsSurfacedAsBulletText() {
        wizard.step(0).validation = () -> ValidationResult.invalid("Building required", "Unit required")
            .addWarning("No household");

        assertThat(wizard.handleNext()).isFalse();

        assertThat(wizard.navigator().getCurrentIndex()).isZero();
        assertThat(view.warnings).containsExactly("• Building required\n• Unit required\n• No household");
    }

    @Test
    void onNextFailureKeepsStepActiveAndIsSurfaced() {
        wizard.step(0).onNextAction = () -> {
            throw new StepActionException("claim service unavailable");
        };

        assertThat(wizard.handleNext()).isFalse();

        assertThat(wizard.navigator().getCurrentIndex()).isZero();
        assertThat(view.warnings).containsExactly("• claim service unavailable");
        assertThat(wizard.isOpen()).isTrue();
    }

    @Test
    void previousNeverValidates() {
        wizard.handleNext();
        wizard.step(1).failingWith("broken");

        assertThat(wizard.handlePrevious()).isTrue();
        assertThat(wizard.step(1).validateCount).isZero();
    }

    @Test
    void nextOnLastStepSubmits() {
        wizard.handleNext();
        wizard.handleNext();

        assertThat(wizard.handleNext()).isTrue();

        assertThat(wizard.submitCount).isEqualTo(1);
        assertThat(wizard.isClosed()).isTrue();
        assertThat(view.closed).isTrue();
        assertThat(wizard.context().status()).isEqualTo(WizardStatus.COMPLETED);
        assertThat(wizard.context().completedSteps()).containsExactly(0, 1, 2);
        assertThat(events).hasSize(1);
        var completed = (WizardEvent.Completed) events.get(0);
        assertThat(completed.snapshot().get("reference_number")).isEqualTo(wizard.context().referenceNumber());
        assertThat(completed.snapshot().get("status")).isEqualTo("completed");
    }

    @Test
    void submitRevalidatesLastStep() {
        wizard.navigator().gotoStep(2, true);
        wizard.step(2).failingWith("review incomplete");

        assertThat(wizard.handleSubmit()).isFalse();

        assertThat(wizard.submitCount).isZero();
        assertThat(wizard.isOpen()).isTrue();
        assertThat(view.warnings).containsExactly("• review incomplete");
    }

    @Test
    void submitIsRefusedBeforeLastStep() {
        assertThat(wizard.handleSubmit()).isFalse();
        wizard.handleNext();
        assertThat(wizard.handleSubmit()).isFalse();

        assertThat(wizard.submitCount).isZero();
        assertThat(wizard.isOpen()).isTrue();
        assertThat(events).isEmpty();
        assertThat(wizard.context().status()).isNotEqualTo(WizardStatus.COMPLETED);
        assertThat(wizard.context().completedSteps()).containsExactly(0);
    }

    @Test
    void rejectedSubmitKeepsWizardOpen() {
        wizard.navigator().gotoStep(2, true);
        wizard.submitResult = false;

        assertThat(wizard.handleSubmit()).isFalse();

        assertThat(wizard.isOpen()).isTrue();
        assertThat(events).isEmpty();
        assertThat(wizard.context().status()).isNotEqualTo(WizardStatus.COMPLETED);
    }

    @Test
    void throwingSubmitIsCaughtAndSurfaced() {
        wizard.navigator().gotoStep(2, true);
        wizard.submitFailure = new IllegalStateException("database locked");

        assertThat(wizard.handleSubmit()).isFalse();

        assertThat(wizard.isOpen()).isTrue();
        assertThat(view.errors).containsExactly("Submission failed: database locked");
    }

    @Test
    void cancelProceedsOnlyWhenHookAgrees() {
        wizard.cancelResult = false;
        assertThat(wizard.handleCancel()).isFalse();
        assertThat(wizard.isOpen()).isTrue();

        wizard.cancelResult = true;
        assertThat(wizard.handleCancel()).isTrue();

        assertThat(wizard.isClosed()).isTrue();
        assertThat(wizard.context().status()).isEqualTo(WizardStatus.CANCELLED);
        assertThat(events).containsExactly(new WizardEvent.Cancelled());
    }

    @Test
    void saveDraftPublishesDraftId() {
        wizard.draftId = "WIZ-1";

        assertThat(wizard.handleSaveDraft()).contains("WIZ-1");
        assertThat(events).containsExactly(new WizardEvent.DraftSaved("WIZ-1"));
        assertThat(wizard.isOpen()).isTrue();
    }

    @Test
    void saveDraftWithoutIdPublishesNothing() {
        assertThat(wizard.handleSaveDraft()).isEqualTo(Optional.empty());
        assertThat(events).isEmpty();
    }

    @Test
    void controlsAreIgnoredAfterClose() {
        wizard.close();

        assertThat(wizard.handleNext()).isFalse();
        assertThat(wizard.handlePrevious()).isFalse();
        assertThat(wizard.handleCancel()).isFalse();
        assertThat(wizard.handleSaveDraft()).isEmpty();
        assertThat(wizard.navigator().getCurrentIndex()).isZero();
    }

    @Test
    void resumeRebindsStepsAndMovesToStoredStep() {
        var saved = new TestContext();
        saved.updateData("building", "B-9");
        saved.markStepCompleted(0);
        saved.markStepCompleted(1);
        saved.setCurrentStepIndex(2);
        var snapshot = saved.toMap();

        TestWizard resumed = BaseWizard.resumeFromDraft(() -> new TestWizard(3), TestContext::fromMap, snapshot);

        assertThat(resumed.navigator().getCurrentIndex()).isEqualTo(2);
        assertThat(resumed.context().referenceNumber()).isEqualTo(saved.referenceNumber());
        assertThat(resumed.context().completedSteps()).containsExactly(0, 1);
        assertThat(resumed.steps()).allMatch(step -> step.context() == resumed.context());
        assertThat(resumed.navigator().context()).isSameAs(resumed.context());
        assertThat(resumed.step(2).contextSeenOnShow).isSameAs(resumed.context());
        assertThat(resumed.step(0).validateCount).isZero();
    }

    @Test
    void resumeAtFirstStepRepopulatesFromRestoredContext() {
        var saved = new TestContext();
        var snapshot = saved.toMap();

        TestWizard resumed = BaseWizard.resumeFromDraft(() -> new TestWizard(3), TestContext::fromMap, snapshot);

        assertThat(resumed.navigator().getCurrentIndex()).isZero();
        assertThat(resumed.step(0).contextSeenOnShow).isSameAs(resumed.context());
    }

    @Test
    void resumeWithOutOfRangeStepStartsOver() {
        var saved = new TestContext();
        saved.setCurrentStepIndex(9);

        TestWizard resumed = BaseWizard.resumeFromDraft(() -> new TestWizard(3), TestContext::fromMap, saved.toMap());

        assertThat(resumed.navigator().getCurrentIndex()).isZero();
        assertThat(resumed.context().currentStepIndex()).isZero();
    }
}
