package com.portfolio.analytics.pulse.exception;

/**
 * Raised when scenario text matches none of the supported patterns.
 */
public class ScenarioParseException extends RuntimeException {

    private final String input;

    public ScenarioParseException(String message, String input) {
        super(message);
        this.input = input;
    }

    public ScenarioParseException(String message, String input, Throwable cause) {
        super(message, cause);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
