package com.github.stormino.transcoder.exception;

/**
 * Exception thrown when the catalogue has no source for the requested
 * content, episode and language combination.
 */
public class SourceNotAvailableException extends SourceResolutionException {

    private final Integer contentId;
    private final Integer episode;
    private final String language;

    public SourceNotAvailableException(String message, int contentId, int episode, String language) {
        super(message, null);
        this.contentId = contentId;
        this.episode = episode;
        this.language = language;
    }

    public SourceNotAvailableException(String message, Throwable cause, String sourceUrl) {
        super(message, cause, sourceUrl);
        this.contentId = null;
        this.episode = null;
        this.language = null;
    }

    public Integer getContentId() {
        return contentId;
    }

    public Integer getEpisode() {
        return episode;
    }

    public String getLanguage() {
        return language;
    }
}
