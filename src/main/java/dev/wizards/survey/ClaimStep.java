package dev.wizards.survey;

import dev.wizards.engine.StepActionException;
import dev.wizards.survey.model.ClaimData;
import dev.wizards.survey.model.Relation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates the claim through the gateway when the user leaves the step. A unit without an
 * ownership relation gets no claim.
 */
public class ClaimStep extends SurveyStep {

    private static final Logger logger = LoggerFactory.getLogger(ClaimStep.class);

    private final SurveyGateway gateway;

    public ClaimStep(SurveyContext context, SurveyGateway gateway) {
        super(context, SurveyStepRules.STEP_CLAIM);
        this.gateway = gateway;
    }

    @Override
    protected List<String> fieldLabels() {
        return List.of("Claim", "Case status");
    }

    @Override
    protected Map<String, String> currentValues() {
        ClaimData claim = context().claimData();
        if (claim == null) {
            return Map.of();
        }
        return Map.of("Claim", orEmpty(claim.claimId()), "Case status", orEmpty(claim.caseStatus()));
    }

    @Override
    public void onNext() {
        // Only once per survey, re-visits must not create duplicates
        if (context().claimData() != null) {
            logger.info("Claim {} already created, skipping", context().claimData().claimId());
            return;
        }
        boolean hasOwner = context().relations().stream().anyMatch(Relation::isOwnership);
        if (!hasOwner) {
            logger.info("No ownership relation for {}, no claim created", context().referenceNumber());
            saveToContext("claim_not_created_reason", "No ownership relation found");
            return;
        }
        try {
            ClaimData claim = gateway.createClaim(context());
            context().setClaimData(claim);
            logger.info("Created claim {} for {}", claim.claimId(), context().referenceNumber());
        } catch (SurveyGatewayException e) {
            throw new StepActionException("Could not create the claim: " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Object> collectData() {
        var data = new LinkedHashMap<String, Object>();
        ClaimData claim = context().claimData();
        data.put("claim_id", claim == null ? null : claim.claimId());
        data.put("claim_not_created_reason", getFromContext("claim_not_created_reason", String.class, null));
        return data;
    }
}
