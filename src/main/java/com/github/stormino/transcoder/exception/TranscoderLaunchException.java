package com.github.stormino.transcoder.exception;

/**
 * Exception thrown when the external transcoder cannot be started.
 */
public class TranscoderLaunchException extends TranscodeException {

    private final String variantUrl;
    private final String outputFile;

    public TranscoderLaunchException(String message, String variantUrl, String outputFile) {
        super(message);
        this.variantUrl = variantUrl;
        this.outputFile = outputFile;
    }

    public TranscoderLaunchException(String message, Throwable cause, String variantUrl, String outputFile) {
        super(message, cause);
        this.variantUrl = variantUrl;
        this.outputFile = outputFile;
    }

    public String getVariantUrl() {
        return variantUrl;
    }

    public String getOutputFile() {
        return outputFile;
    }
}
