package com.github.stormino.transcoder.service;

import com.github.stormino.transcoder.exception.InvalidManifestException;
import com.github.stormino.transcoder.model.Variant;
import com.github.stormino.transcoder.service.external.VariantEnumerator;
import com.github.stormino.transcoder.util.UrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lists the video variants of an HLS master playlist.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HlsVariantEnumerator implements VariantEnumerator {

    private static final String PLAYLIST_HEADER = "#EXTM3U";
    private static final Pattern STREAM_PATTERN =
            Pattern.compile("#EXT-X-STREAM-INF:.*?RESOLUTION=(\\d+)x(\\d+)");

    private final HlsPlaylistClient playlistClient;

    @Override
    public List<Variant> listVariants(String sourceUrl) {
        String content = playlistClient.fetch(sourceUrl);
        if (!content.startsWith(PLAYLIST_HEADER)) {
            throw new InvalidManifestException("Not a m3u8 file", sourceUrl);
        }

        String baseUrl = UrlUtils.extractBaseUrl(sourceUrl);
        String[] lines = content.split("\\r?\\n");
        List<Variant> variants = new ArrayList<>();

        for (int i = 1; i < lines.length; i++) {
            Matcher streamMatcher = STREAM_PATTERN.matcher(lines[i]);
            if (!streamMatcher.find()) {
                continue;
            }

            // Next non-blank line contains the URL
            int urlLine = i + 1;
            while (urlLine < lines.length && lines[urlLine].isBlank()) {
                urlLine++;
            }
            if (urlLine >= lines.length || lines[urlLine].startsWith("#")) {
                log.warn("Stream entry without URL at line {} of {}", i + 1, sourceUrl);
                continue;
            }

            int width;
            int height;
            try {
                width = Integer.parseInt(streamMatcher.group(1));
                height = Integer.parseInt(streamMatcher.group(2));
            } catch (NumberFormatException e) {
                throw new InvalidManifestException("Invalid resolution at line " + (i + 1), e, sourceUrl);
            }

            variants.add(Variant.builder()
                    .url(UrlUtils.resolveUrl(baseUrl, lines[urlLine].trim()))
                    .width(width)
                    .height(height)
                    .build());
            i = urlLine;
        }

        log.debug("Parsed master playlist {}: {} variants", sourceUrl, variants.size());
        return variants;
    }
}
