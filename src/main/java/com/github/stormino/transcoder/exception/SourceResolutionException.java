package com.github.stormino.transcoder.exception;

/**
 * Exception thrown when the source of a requested episode cannot be resolved.
 * Resolution failures are reported to the caller and never cached.
 */
public class SourceResolutionException extends TranscodeException {

    private final String sourceUrl;

    public SourceResolutionException(String message, String sourceUrl) {
        super(message);
        this.sourceUrl = sourceUrl;
    }

    public SourceResolutionException(String message, Throwable cause, String sourceUrl) {
        super(message, cause);
        this.sourceUrl = sourceUrl;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }
}
