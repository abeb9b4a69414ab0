package dev.wizards.survey;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.wizards.engine.WizardContext;
import dev.wizards.survey.model.*;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Context of the office survey wizard: the selected building and unit, households, persons,
 * tenure relations and the resulting claim.
 */
public final class SurveyContext extends WizardContext {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private Building building;
    private PropertyUnit unit;
    private boolean newUnit;
    private Map<String, Object> newUnitData;
    private final List<Household> households = new ArrayList<>();
    private final List<Person> persons = new ArrayList<>();
    private final List<Relation> relations = new ArrayList<>();
    private ClaimData claimData;
    private String clerkId;
    private String surveyId;

    public SurveyContext() {
        super();
    }

    public SurveyContext(Clock clock) {
        super(clock);
    }

    @Override
    protected String referencePrefix() {
        return "SRV";
    }

    public Building building() { return building; }
    public PropertyUnit unit() { return unit; }
    public boolean isNewUnit() { return newUnit; }
    public Map<String, Object> newUnitData() { return newUnitData; }
    public List<Household> households() { return Collections.unmodifiableList(households); }
    public List<Person> persons() { return Collections.unmodifiableList(persons); }
    public List<Relation> relations() { return Collections.unmodifiableList(relations); }
    public ClaimData claimData() { return claimData; }
    public String clerkId() { return clerkId; }
    public String surveyId() { return surveyId; }

    public void setBuilding(Building building) {
        this.building = building;
        updateData("building_selected", building != null);
    }

    public void setUnit(PropertyUnit unit) {
        this.unit = unit;
        this.newUnit = false;
        this.newUnitData = null;
        updateData("unit_selected", unit != null);
    }

    /** Record a unit that does not exist yet and will be created on submission. */
    public void setNewUnit(Map<String, Object> unitData) {
        this.unit = null;
        this.newUnit = true;
        this.newUnitData = new LinkedHashMap<>(unitData);
        updateData("unit_selected", true);
    }

    public void addHousehold(Household household) {
        households.add(household);
        updateData("households_count", households.size());
    }

    public void addPerson(Person person) {
        persons.add(person);
        updateData("persons_count", persons.size());
    }

    public void addRelation(Relation relation) {
        relations.add(relation);
        updateData("relations_count", relations.size());
    }

    public void setClaimData(ClaimData claimData) {
        this.claimData = claimData;
        updateData("claim_created", claimData != null);
    }

    public void setClerkId(String clerkId) {
        this.clerkId = clerkId;
        touch();
    }

    public void setSurveyId(String surveyId) {
        this.surveyId = surveyId;
        touch();
    }

    /** Summary shown on the review step. */
    public Map<String, Object> getSummary() {
        var summary = new LinkedHashMap<String, Object>();
        summary.put("reference_number", referenceNumber());
        summary.put("building_id", building != null ? building.buildingId() : null);
        summary.put("building_address", building != null ? building.address() : null);
        summary.put("unit_id", unit != null ? unit.unitId() : null);
        summary.put("unit_type", unit != null ? unit.unitType() : null);
        summary.put("is_new_unit", newUnit);
        summary.put("households_count", households.size());
        summary.put("persons_count", persons.size());
        summary.put("relations_count", relations.size());
        summary.put("has_claim", claimData != null);
        summary.put("status", status().wireValue());
        summary.put("created_at", createdAt().toString());
        return summary;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = super.toMap();
        map.put("building", toPlainMap(building));
        map.put("unit", toPlainMap(unit));
        map.put("is_new_unit", newUnit);
        map.put("new_unit_data", newUnitData == null ? null : new LinkedHashMap<>(newUnitData));
        map.put("households", households.stream().map(SurveyContext::toPlainMap).toList());
        map.put("persons", persons.stream().map(SurveyContext::toPlainMap).toList());
        map.put("relations", relations.stream().map(SurveyContext::toPlainMap).toList());
        map.put("claim_data", toPlainMap(claimData));
        map.put("clerk_id", clerkId);
        map.put("survey_id", surveyId);
        return map;
    }

    /**
     * Rebuild a survey context from a {@link #toMap()} snapshot. Missing keys leave the defaults
     * of a fresh context.
     *
     * @throws IllegalArgumentException if a stored record does not match its type
     */
    public static SurveyContext fromMap(Map<String, ?> snapshot) {
        var ctx = new SurveyContext();
        restoreBaseFields(ctx, snapshot);

        ctx.building = fromPlainMap(snapshot.get("building"), Building.class);
        ctx.unit = fromPlainMap(snapshot.get("unit"), PropertyUnit.class);
        ctx.newUnit = Boolean.TRUE.equals(snapshot.get("is_new_unit"));
        ctx.newUnitData = copyStringKeyed(snapshot.get("new_unit_data"));
        if (ctx.newUnit && ctx.newUnitData == null) {
            ctx.newUnitData = new LinkedHashMap<>();
        }
        ctx.households.addAll(listOf(snapshot.get("households"), Household.class));
        ctx.persons.addAll(listOf(snapshot.get("persons"), Person.class));
        ctx.relations.addAll(listOf(snapshot.get("relations"), Relation.class));
        ctx.claimData = fromPlainMap(snapshot.get("claim_data"), ClaimData.class);
        ctx.clerkId = snapshot.get("clerk_id") instanceof String clerk ? clerk : null;
        ctx.surveyId = snapshot.get("survey_id") instanceof String survey ? survey : null;
        return ctx;
    }

    private static Map<String, Object> toPlainMap(Object record) {
        return record == null ? null : MAPPER.convertValue(record, MAP_TYPE);
    }

    private static <T> T fromPlainMap(Object value, Class<T> type) {
        return value == null ? null : MAPPER.convertValue(value, type);
    }

    private static <T> List<T> listOf(Object value, Class<T> type) {
        if (!(value instanceof List<?> items)) {
            return List.of();
        }
        return items.stream().map(item -> MAPPER.convertValue(item, type)).toList();
    }
}
