package com.github.stormino.transcoder.exception;

/**
 * Base exception for all transcoding-related errors.
 */
public class TranscodeException extends RuntimeException {

    public TranscodeException(String message) {
        super(message);
    }

    public TranscodeException(String message, Throwable cause) {
        super(message, cause);
    }

    public TranscodeException(Throwable cause) {
        super(cause);
    }
}
