package dev.wizards.survey;

import dev.wizards.survey.model.ClaimData;

import java.util.Map;

/**
 * Back end that records surveys and the claims they produce.
 */
public interface SurveyGateway {

    /**
     * Create the claim for the surveyed unit.
     *
     * @throws SurveyGatewayException if the back end rejects the request or cannot be reached
     */
    ClaimData createClaim(SurveyContext context);

    /**
     * Store a finished survey.
     *
     * @param snapshot the serialized survey context
     * @return the id assigned to the survey
     * @throws SurveyGatewayException if the survey cannot be stored
     */
    String submitSurvey(Map<String, Object> snapshot);
}
