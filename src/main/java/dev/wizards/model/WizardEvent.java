package dev.wizards.model;

import java.util.Map;

/**
 * Completion events published by a wizard once it finishes, is cancelled or saves a draft.
 */
public sealed interface WizardEvent {

    /** Submission succeeded. Carries the serialized context. */
    record Completed(Map<String, Object> snapshot) implements WizardEvent {}

    record Cancelled() implements WizardEvent {}

    record DraftSaved(String draftId) implements WizardEvent {}
}
