package dev.wizards.engine;

import dev.wizards.model.WizardStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WizardContextTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2026-01-18T15:30:45Z"), ZoneOffset.UTC);

    @Test
    void initializesCorrectly() {
        var context = new TestContext();

        assertThat(context.wizardId()).isNotBlank();
        assertThat(context.status()).isEqualTo(WizardStatus.DRAFT);
        assertThat(context.currentStepIndex()).isZero();
        assertThat(context.completedSteps()).isEmpty();
        assertThat(context.data()).isEmpty();
        assertThat(context.userId()).isNull();
    }

    @Test
    void referenceNumberUsesPrefixTimestampAndShortId() {
        var context = new TestContext(FIXED);

        String shortId = context.wizardId().substring(0, 4).toUpperCase();
        assertThat(context.referenceNumber()).isEqualTo("WIZ-20260118153045-" + shortId);
    }

    @Test
    void prefixHookChangesOnlyThePrefix() {
        var context = new TestContext(FIXED) {
            @Override
            protected String referencePrefix() {
                return "SRV";
            }
        };

        assertThat(context.referenceNumber()).matches("SRV-20260118153045-[0-9A-F]{4}");
    }

    @Test
    void dataBagIsLastWriteWins() {
        var context = new TestContext();

        context.updateData("building", "B-1");
        context.updateData("building", "B-2");

        assertThat(context.getData("building")).isEqualTo("B-2");
        assertThat(context.getData("missing", String.class, "fallback")).isEqualTo("fallback");
        assertThat(context.getData("missing", Object.class, null)).isNull();
    }

    @Test
    void storedNullIsReturnedInsteadOfDefault() {
        var context = new TestContext();

        context.updateData("survey_id", null);

        assertThat(context.getData("survey_id", String.class, "fallback")).isNull();
    }

    @Test
    void typedReadRejectsMismatchedValue() {
        var context = new TestContext();
        context.updateData("persons_count", 3);

        assertThat(context.getData("persons_count", Integer.class, 0)).isEqualTo(3);
        assertThatThrownBy(() -> context.getData("persons_count", String.class, ""))
            .isInstanceOf(ClassCastException.class);
    }

    @Test
    void mutationsTouchUpdatedAt() {
        var clock = new MutableClock(Instant.parse("2026-01-18T10:00:00Z"));
        var context = new TestContext(clock);

        clock.now = Instant.parse("2026-01-18T10:05:00Z");
        context.markStepCompleted(0);

        assertThat(context.updatedAt()).isAfter(context.createdAt());
    }

    @Test
    void markStepCompletedIsIdempotent() {
        var context = new TestContext();

        context.markStepCompleted(2);
        context.markStepCompleted(0);
        context.markStepCompleted(2);

        assertThat(context.completedSteps()).containsExactly(0, 2);
        assertThat(context.isStepCompleted(2)).isTrue();
        assertThat(context.isStepCompleted(1)).isFalse();
    }

    @Test
    void freshContextSnapshotStartsAtFirstStep() {
        var snapshot = new TestContext().toMap();

        assertThat(snapshot).containsKeys("wizard_id", "reference_number", "status", "created_at",
            "updated_at", "current_step_index", "user_id", "completed_steps", "data");
        assertThat(snapshot.get("current_step_index")).isEqualTo(0);
        assertThat(snapshot.get("completed_steps")).isEqualTo(List.of());
        assertThat(snapshot.get("status")).isEqualTo("draft");
    }

    @Test
    void completedStepsAreSerializedSorted() {
        var context = new TestContext();
        context.markStepCompleted(3);
        context.markStepCompleted(1);

        assertThat(context.toMap().get("completed_steps")).isEqualTo(List.of(1, 3));
    }

    @Test
    void roundTripPreservesNavigationState() {
        var context = new TestContext(FIXED);
        context.setStatus(WizardStatus.IN_PROGRESS);
        context.setUserId("clerk-7");
        context.setCurrentStepIndex(2);
        context.markStepCompleted(0);
        context.markStepCompleted(1);
        context.updateData("persons_count", 3);

        var restored = TestContext.fromMap(context.toMap());

        assertThat(restored.wizardId()).isEqualTo(context.wizardId());
        assertThat(restored.referenceNumber()).isEqualTo(context.referenceNumber());
        assertThat(restored.status()).isEqualTo(WizardStatus.IN_PROGRESS);
        assertThat(restored.currentStepIndex()).isEqualTo(2);
        assertThat(restored.completedSteps()).containsExactly(0, 1);
        assertThat(restored.data()).isEqualTo(context.data());
        assertThat(restored.userId()).isEqualTo("clerk-7");
        assertThat(restored.createdAt()).isEqualTo(context.createdAt());
        assertThat(restored.updatedAt()).isEqualTo(context.updatedAt());
    }

    @Test
    void referenceNumberIsStableAcrossMutationsAndRoundTrips() {
        var context = new TestContext();
        String reference = context.referenceNumber();

        for (int i = 0; i < 10; i++) {
            context.updateData("k" + i, i);
            context.markStepCompleted(i);
        }
        var restored = TestContext.fromMap(TestContext.fromMap(context.toMap()).toMap());

        assertThat(context.referenceNumber()).isEqualTo(reference);
        assertThat(restored.referenceNumber()).isEqualTo(reference);
    }

    @Test
    void restoreAcceptsJsonNumberTypes() {
        Map<String, Object> snapshot = new HashMap<>();
        snapshot.put("current_step_index", 4L);
        snapshot.put("completed_steps", List.of(0L, 1.0, 2));
        snapshot.put("status", "completed");

        var restored = TestContext.fromMap(snapshot);

        assertThat(restored.currentStepIndex()).isEqualTo(4);
        assertThat(restored.completedSteps()).containsExactly(0, 1, 2);
        assertThat(restored.status()).isEqualTo(WizardStatus.COMPLETED);
    }

    @Test
    void restoreKeepsOnlyStringKeyedDataEntries() {
        Map<Object, Object> bag = new HashMap<>();
        bag.put("building", "B-1");
        bag.put(7, "dropped");
        Map<String, Object> snapshot = new HashMap<>();
        snapshot.put("data", bag);

        var restored = TestContext.fromMap(snapshot);

        assertThat(restored.data()).containsOnly(Map.entry("building", "B-1"));
    }

    @Test
    void restoreFallsBackToDefaultsForMissingKeys() {
        var restored = TestContext.fromMap(Map.of());

        assertThat(restored.wizardId()).isNotBlank();
        assertThat(restored.referenceNumber()).startsWith("WIZ-");
        assertThat(restored.status()).isEqualTo(WizardStatus.DRAFT);
        assertThat(restored.currentStepIndex()).isZero();
        assertThat(restored.completedSteps()).isEmpty();
        assertThat(restored.data()).isEmpty();
        assertThat(restored.userId()).isNull();
    }

    private static final class MutableClock extends Clock {
        Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
