package com.github.stormino.transcoder.exception;

/**
 * Exception thrown when a request parameter holds a value the service does not accept.
 */
public class InvalidRequestException extends TranscodeException {

    private final String parameter;
    private final String value;

    public InvalidRequestException(String message, Throwable cause, String parameter, String value) {
        super(message, cause);
        this.parameter = parameter;
        this.value = value;
    }

    public String getParameter() {
        return parameter;
    }

    public String getValue() {
        return value;
    }
}
