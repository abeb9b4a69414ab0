package dev.wizards.survey;

import dev.wizards.survey.model.Building;

import java.util.List;
import java.util.Map;

public class BuildingSelectionStep extends SurveyStep {

    public BuildingSelectionStep(SurveyContext context) {
        super(context, SurveyStepRules.STEP_BUILDING);
    }

    @Override
    protected List<String> fieldLabels() {
        return List.of("Building code", "Address");
    }

    @Override
    protected Map<String, String> currentValues() {
        Building building = context().building();
        if (building == null) {
            return Map.of();
        }
        return Map.of("Building code", orEmpty(building.buildingId()), "Address", orEmpty(building.address()));
    }

    @Override
    public Map<String, Object> collectData() {
        Building building = context().building();
        return Map.of("building_id", building == null ? "" : building.buildingId());
    }

    @Override
    public String getStepDescription() {
        return "Search and select the surveyed building";
    }
}
