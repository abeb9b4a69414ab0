package dev.wizards.survey;

import dev.wizards.survey.model.PropertyUnit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class UnitSelectionStep extends SurveyStep {

    public UnitSelectionStep(SurveyContext context) {
        super(context, SurveyStepRules.STEP_UNIT);
    }

    @Override
    protected List<String> fieldLabels() {
        return List.of("Unit", "Type", "New unit");
    }

    @Override
    protected Map<String, String> currentValues() {
        PropertyUnit unit = context().unit();
        var values = new LinkedHashMap<String, String>();
        if (unit != null) {
            values.put("Unit", orEmpty(unit.unitId()));
            values.put("Type", orEmpty(unit.unitType()));
        } else if (context().isNewUnit() && context().newUnitData() != null) {
            values.put("Type", orEmpty(context().newUnitData().get("unit_type")));
        }
        values.put("New unit", context().isNewUnit() ? "yes" : "no");
        return values;
    }

    @Override
    public Map<String, Object> collectData() {
        var data = new LinkedHashMap<String, Object>();
        PropertyUnit unit = context().unit();
        data.put("unit_id", unit == null ? null : unit.unitId());
        data.put("is_new_unit", context().isNewUnit());
        data.put("new_unit_data", context().newUnitData());
        return data;
    }

    @Override
    public String getStepDescription() {
        return "Select an existing unit of the building or describe a new one";
    }
}
