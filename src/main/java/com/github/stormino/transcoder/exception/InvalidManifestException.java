package com.github.stormino.transcoder.exception;

/**
 * Exception thrown when a fetched document is not the expected HLS playlist,
 * or offers no usable variant.
 */
public class InvalidManifestException extends SourceResolutionException {

    public InvalidManifestException(String message, String playlistUrl) {
        super(message, playlistUrl);
    }

    public InvalidManifestException(String message, Throwable cause, String playlistUrl) {
        super(message, cause, playlistUrl);
    }
}
