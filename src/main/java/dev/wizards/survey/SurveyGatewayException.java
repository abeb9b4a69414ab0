package dev.wizards.survey;

public class SurveyGatewayException extends RuntimeException {

    public SurveyGatewayException(String message) {
        super(message);
    }

    public SurveyGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
