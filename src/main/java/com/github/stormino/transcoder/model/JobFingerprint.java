package com.github.stormino.transcoder.model;

import lombok.NonNull;
import lombok.Value;

/**
 * The request attributes that identify "the same requested artifact".
 * Two requests with equal fingerprints share one job while it is cached.
 */
@Value
public class JobFingerprint {
    int contentId;
    int episode;
    @NonNull
    String lang;
    @NonNull
    Quality quality;

    public String getDisplayName() {
        return String.format("%d E%02d [%s, %s]", contentId, episode, lang, quality.getValue());
    }
}
