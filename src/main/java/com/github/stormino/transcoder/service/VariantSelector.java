package com.github.stormino.transcoder.service;

import com.github.stormino.transcoder.exception.InvalidManifestException;
import com.github.stormino.transcoder.model.Quality;
import com.github.stormino.transcoder.model.Variant;
import lombok.NonNull;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maps a quality tier onto one of the variants of a playlist.
 * Variants are ordered by resolution, ascending; equal resolutions keep their playlist order.
 */
@Component
public class VariantSelector {

    private static final Comparator<Variant> BY_RESOLUTION =
            Comparator.comparingInt(Variant::getHeight).thenComparingInt(Variant::getWidth);

    /**
     * @param variants Variants in playlist order
     * @param quality Requested tier: HIGH the best, LOW the worst, MEDIUM the middle element
     * @param sourceUrl Playlist the variants come from, for error reporting
     * @return The chosen variant
     * @throws InvalidManifestException if there is no variant to choose from
     */
    public Variant select(@NonNull List<Variant> variants, @NonNull Quality quality, String sourceUrl) {
        if (variants.isEmpty()) {
            throw new InvalidManifestException("Playlist offers no variant", sourceUrl);
        }

        List<Variant> sorted = new ArrayList<>(variants);
        sorted.sort(BY_RESOLUTION);

        switch (quality) {
            case HIGH:
                return sorted.get(sorted.size() - 1);
            case LOW:
                return sorted.get(0);
            case MEDIUM:
            default:
                return sorted.get(sorted.size() / 2);
        }
    }
}
