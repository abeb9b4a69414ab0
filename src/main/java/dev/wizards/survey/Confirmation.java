package dev.wizards.survey;

/**
 * Yes/no question put to the user, e.g. before discarding a survey.
 */
@FunctionalInterface
public interface Confirmation {

    Confirmation ALWAYS = question -> true;

    boolean confirm(String question);
}
