package dev.wizards.survey;

import dev.wizards.survey.model.ClaimData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Gateway keeping claims and surveys in memory. Used by the console host and in tests.
 */
public class InMemorySurveyGateway implements SurveyGateway {

    private final AtomicInteger claimSequence = new AtomicInteger();
    private final AtomicInteger surveySequence = new AtomicInteger();
    private final List<ClaimData> claims = new ArrayList<>();
    private final Map<String, Map<String, Object>> surveys = new LinkedHashMap<>();

    @Override
    public ClaimData createClaim(SurveyContext context) {
        int evidence = context.relations().stream().mapToInt(r -> r.evidenceCount()).sum();
        String caseStatus = evidence > 0 ? "submitted" : "draft";
        var claim = new ClaimData("CLM-%05d".formatted(claimSequence.incrementAndGet()), "ownership", caseStatus);
        claims.add(claim);
        return claim;
    }

    @Override
    public String submitSurvey(Map<String, Object> snapshot) {
        String surveyId = "SUR-%05d".formatted(surveySequence.incrementAndGet());
        surveys.put(surveyId, snapshot);
        return surveyId;
    }

    public List<ClaimData> claims() {
        return Collections.unmodifiableList(claims);
    }

    public Map<String, Map<String, Object>> surveys() {
        return Collections.unmodifiableMap(surveys);
    }
}
