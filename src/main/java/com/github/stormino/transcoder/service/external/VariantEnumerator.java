package com.github.stormino.transcoder.service.external;

import com.github.stormino.transcoder.model.Variant;

import java.util.List;

/**
 * Lists the quality variants of a master playlist.
 */
public interface VariantEnumerator {

    /**
     * @param sourceUrl Master playlist URL
     * @return Variants in playlist order
     * @throws com.github.stormino.transcoder.exception.InvalidManifestException if the
     *         document is not an HLS playlist
     */
    List<Variant> listVariants(String sourceUrl);
}
