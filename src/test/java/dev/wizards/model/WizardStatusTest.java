package dev.wizards.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WizardStatusTest {

    @Test
    void parsesWireValues() {
        assertThat(WizardStatus.fromWireValue("in_progress")).isEqualTo(WizardStatus.IN_PROGRESS);
        assertThat(WizardStatus.fromWireValue("cancelled")).isEqualTo(WizardStatus.CANCELLED);
        assertThat(WizardStatus.COMPLETED.wireValue()).isEqualTo("completed");
    }

    @Test
    void unknownOrMissingValuesAreDraft() {
        assertThat(WizardStatus.fromWireValue("archived")).isEqualTo(WizardStatus.DRAFT);
        assertThat(WizardStatus.fromWireValue(null)).isEqualTo(WizardStatus.DRAFT);
    }
}
