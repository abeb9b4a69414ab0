package dev.wizards.model;

/**
 * Events published by a step navigator. After every successful move the navigator publishes
 * {@link StepChanged}, then {@link CanGoNextChanged}, then {@link CanGoPreviousChanged}.
 */
public sealed interface NavigationEvent {

    /** The active step moved from one index to another. */
    record StepChanged(int oldIndex, int newIndex) implements NavigationEvent {}

    record CanGoNextChanged(boolean canGoNext) implements NavigationEvent {}

    record CanGoPreviousChanged(boolean canGoPrevious) implements NavigationEvent {}

    /** A forward move was refused; the active step is unchanged. */
    record ValidationFailed(ValidationResult result) implements NavigationEvent {}
}
