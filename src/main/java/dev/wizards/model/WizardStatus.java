package dev.wizards.model;

/**
 * Lifecycle status of a wizard run. Only the owning wizard changes it.
 */
public enum WizardStatus {
    DRAFT("draft"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    private final String wireValue;

    WizardStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() { return wireValue; }

    /**
     * Parse a stored status. Unknown or missing values fall back to {@link #DRAFT}.
     */
    public static WizardStatus fromWireValue(String value) {
        if (value != null) {
            for (WizardStatus status : values()) {
                if (status.wireValue.equals(value)) {
                    return status;
                }
            }
        }
        return DRAFT;
    }
}
