package dev.wizards.engine;

import dev.wizards.model.WizardStatus;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Mutable state shared by all steps of one wizard run: identity, status, navigation position,
 * completed steps and an open data bag.
 *
 * <p>Concrete contexts add typed fields, extend {@link #toMap()}, and provide a static
 * {@code fromMap} factory that calls {@link #restoreBaseFields}.
 */
public abstract class WizardContext {

    private static final DateTimeFormatter REFERENCE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final Clock clock;
    private String wizardId;
    private String referenceNumber;
    private WizardStatus status;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private int currentStepIndex;
    private String userId;
    private SortedSet<Integer> completedSteps;
    private Map<String, Object> data;

    protected WizardContext() {
        this(Clock.systemDefaultZone());
    }

    protected WizardContext(Clock clock) {
        this.clock = clock;
        this.wizardId = UUID.randomUUID().toString();
        this.status = WizardStatus.DRAFT;
        this.createdAt = LocalDateTime.now(clock);
        this.updatedAt = createdAt;
        this.currentStepIndex = 0;
        this.completedSteps = new TreeSet<>();
        this.data = new LinkedHashMap<>();
        this.referenceNumber = generateReferenceNumber();
    }

    /**
     * Format: {@code {PREFIX}-{yyyyMMddHHmmss}-{first 4 chars of wizardId, uppercased}},
     * e.g. {@code WIZ-20260118153045-A3F2}. Draft lists key off this value.
     */
    private String generateReferenceNumber() {
        String timestamp = LocalDateTime.now(clock).format(REFERENCE_TIMESTAMP);
        String shortId = wizardId.substring(0, 4).toUpperCase(Locale.ROOT);
        return "%s-%s-%s".formatted(referencePrefix(), timestamp, shortId);
    }

    /** Prefix of the reference number. Called once, from the constructor. */
    protected String referencePrefix() {
        return "WIZ";
    }

    public String wizardId() { return wizardId; }
    public String referenceNumber() { return referenceNumber; }
    public WizardStatus status() { return status; }
    public LocalDateTime createdAt() { return createdAt; }
    public LocalDateTime updatedAt() { return updatedAt; }
    public int currentStepIndex() { return currentStepIndex; }
    public String userId() { return userId; }

    public void setStatus(WizardStatus status) {
        this.status = status;
        touch();
    }

    public void setUserId(String userId) {
        this.userId = userId;
        touch();
    }

    void setCurrentStepIndex(int index) {
        this.currentStepIndex = index;
        touch();
    }

    public void markStepCompleted(int stepIndex) {
        completedSteps.add(stepIndex);
        touch();
    }

    public boolean isStepCompleted(int stepIndex) {
        return completedSteps.contains(stepIndex);
    }

    public SortedSet<Integer> completedSteps() {
        return Collections.unmodifiableSortedSet(completedSteps);
    }

    public void updateData(String key, Object value) {
        data.put(key, value);
        touch();
    }

    public Object getData(String key) {
        return data.get(key);
    }

    /**
     * Typed read of the data bag. A stored {@code null} is returned as is; the default applies
     * only to absent keys.
     *
     * @throws ClassCastException if the stored value is not a {@code type}
     */
    public <T> T getData(String key, Class<T> type, T defaultValue) {
        if (!data.containsKey(key)) {
            return defaultValue;
        }
        return type.cast(data.get(key));
    }

    public Map<String, Object> data() {
        return Collections.unmodifiableMap(data);
    }

    protected void touch() {
        this.updatedAt = LocalDateTime.now(clock);
    }

    /**
     * Serialize the navigation state and data bag. Subclasses call {@code super.toMap()} and add
     * their own keys.
     */
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("wizard_id", wizardId);
        map.put("reference_number", referenceNumber);
        map.put("status", status.wireValue());
        map.put("created_at", createdAt.toString());
        map.put("updated_at", updatedAt.toString());
        map.put("current_step_index", currentStepIndex);
        map.put("user_id", userId);
        map.put("completed_steps", new ArrayList<>(completedSteps));
        map.put("data", new LinkedHashMap<>(data));
        return map;
    }

    /**
     * Restore the base fields of {@code context} from a snapshot. Missing keys keep the freshly
     * constructed defaults; numbers may be any {@link Number} so JSON round-trips are accepted.
     */
    protected static void restoreBaseFields(WizardContext context, Map<String, ?> snapshot) {
        Object wizardId = snapshot.get("wizard_id");
        if (wizardId != null) {
            context.wizardId = wizardId.toString();
        }
        Object reference = snapshot.get("reference_number");
        if (reference != null) {
            context.referenceNumber = reference.toString();
        }
        Object status = snapshot.get("status");
        context.status = WizardStatus.fromWireValue(status == null ? null : status.toString());
        context.currentStepIndex = snapshot.get("current_step_index") instanceof Number index ? index.intValue() : 0;
        Object userId = snapshot.get("user_id");
        context.userId = userId == null ? null : userId.toString();

        var completed = new TreeSet<Integer>();
        if (snapshot.get("completed_steps") instanceof Collection<?> steps) {
            for (Object step : steps) {
                if (step instanceof Number n) {
                    completed.add(n.intValue());
                }
            }
        }
        context.completedSteps = completed;

        Map<String, Object> bag = copyStringKeyed(snapshot.get("data"));
        context.data = bag != null ? bag : new LinkedHashMap<>();

        if (snapshot.get("created_at") instanceof String created) {
            context.createdAt = LocalDateTime.parse(created);
        }
        if (snapshot.get("updated_at") instanceof String updated) {
            context.updatedAt = LocalDateTime.parse(updated);
        }
    }

    /**
     * Copy a deserialized map, keeping only entries with string keys.
     *
     * @return the copy, or {@code null} if {@code value} is not a map
     */
    protected static Map<String, Object> copyStringKeyed(Object value) {
        if (!(value instanceof Map<?, ?> source)) {
            return null;
        }
        var copy = new LinkedHashMap<String, Object>();
        source.forEach((key, entry) -> {
            if (key instanceof String name) {
                copy.put(name, entry);
            }
        });
        return copy;
    }
}
