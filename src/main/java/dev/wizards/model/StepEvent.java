package dev.wizards.model;

/**
 * Events published by a single step while it is being edited.
 */
public sealed interface StepEvent {

    /** The step's own view of whether its data is currently valid. */
    record ValidationChanged(boolean valid) implements StepEvent {}

    /** A value the step wrote to the shared context. */
    record DataChanged(String key, Object value) implements StepEvent {}
}
