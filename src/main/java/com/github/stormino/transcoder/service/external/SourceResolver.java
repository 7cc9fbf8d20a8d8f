package com.github.stormino.transcoder.service.external;

import com.github.stormino.transcoder.exception.SourceResolutionException;
import com.github.stormino.transcoder.model.SourceInfo;

/**
 * Resolves a human-facing episode identifier to a playable master playlist.
 */
public interface SourceResolver {

    /**
     * @param contentId Catalogue id of the show
     * @param episode Episode number
     * @param lang Language code, e.g. "vostfr"
     * @return Master playlist URL and thumbnail
     * @throws com.github.stormino.transcoder.exception.SourceNotAvailableException if the
     *         catalogue has no source for this language and episode
     * @throws SourceResolutionException if the catalogue could not be queried
     */
    SourceInfo resolve(int contentId, int episode, String lang);
}
