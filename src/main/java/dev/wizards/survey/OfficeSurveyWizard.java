package dev.wizards.survey;

import dev.wizards.engine.BaseStep;
import dev.wizards.engine.BaseWizard;
import dev.wizards.model.WizardStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Guides an office clerk through a property survey: building, unit, household, persons,
 * relations, claim and a final review.
 */
public class OfficeSurveyWizard extends BaseWizard<SurveyContext> {

    private static final Logger logger = LoggerFactory.getLogger(OfficeSurveyWizard.class);

    private final SurveyGateway gateway;
    private final DraftRepository drafts;
    private final Confirmation confirmation;
    private final String clerkId;

    public OfficeSurveyWizard(SurveyGateway gateway, DraftRepository drafts, Confirmation confirmation, String clerkId) {
        this.gateway = gateway;
        this.drafts = drafts;
        this.confirmation = confirmation;
        this.clerkId = clerkId;
    }

    @Override
    protected SurveyContext createContext() {
        var context = new SurveyContext();
        if (clerkId != null) {
            context.setUserId(clerkId);
            context.setClerkId(clerkId);
        }
        return context;
    }

    @Override
    protected List<BaseStep<SurveyContext>> createSteps(SurveyContext context) {
        return List.of(
            new BuildingSelectionStep(context),
            new UnitSelectionStep(context),
            new HouseholdStep(context),
            new PersonStep(context),
            new RelationStep(context),
            new ClaimStep(context, gateway),
            new ReviewStep(context));
    }

    @Override
    public String getWizardTitle() {
        return "Office Survey";
    }

    @Override
    public String getSubmitButtonText() {
        return "Finish survey";
    }

    @Override
    protected boolean onSubmit() {
        try {
            String surveyId = gateway.submitSurvey(context().toMap());
            context().setSurveyId(surveyId);
            logger.info("Survey completed successfully: {}", surveyId);
            view().showSuccess("Survey saved\nReference: %s\nSurvey ID: %s"
                .formatted(context().referenceNumber(), surveyId));
            return true;
        } catch (SurveyGatewayException e) {
            logger.error("Error submitting survey {}", context().referenceNumber(), e);
            view().showError("The survey could not be saved:\n" + e.getMessage());
            return false;
        }
    }

    @Override
    protected boolean onCancel() {
        boolean confirmed = confirmation.confirm(
            "Cancel the survey? All entered data will be lost.");
        if (confirmed) {
            logger.info("Survey cancelled: {}", context().referenceNumber());
        }
        return confirmed;
    }

    @Override
    protected Optional<String> onSaveDraft() {
        context().setStatus(WizardStatus.DRAFT);
        try {
            String draftId = drafts.save(context().toMap());
            logger.info("Draft saved: {}", draftId);
            return Optional.of(draftId);
        } catch (IOException e) {
            logger.error("Error saving draft {}", context().referenceNumber(), e);
            view().showError("The draft could not be saved:\n" + e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Open a wizard built by {@code factory} and resume it from a stored draft.
     *
     * @throws IllegalArgumentException if no draft has that id
     */
    public static OfficeSurveyWizard loadFromDraft(DraftRepository drafts, String draftId,
                                                   Supplier<OfficeSurveyWizard> factory) throws IOException {
        Map<String, Object> snapshot = drafts.load(draftId)
            .orElseThrow(() -> new IllegalArgumentException("Draft not found: " + draftId));
        OfficeSurveyWizard wizard = resumeFromDraft(factory, SurveyContext::fromMap, snapshot);
        logger.info("Draft loaded: {}", draftId);
        return wizard;
    }
}
