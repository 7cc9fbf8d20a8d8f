package com.github.stormino.transcoder.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Resolution of the relative references found in HLS playlists.
 */
@Slf4j
@UtilityClass
public class UrlUtils {

    /**
     * Directory part of a URL, with a trailing slash and without query.
     *
     * @param url Playlist URL
     * @return Base URL against which relative references resolve
     */
    public static String extractBaseUrl(String url) {
        try {
            URI uri = new URI(url);
            String path = uri.getPath() != null ? uri.getPath() : "";
            int lastSlash = path.lastIndexOf('/');
            String basePath = lastSlash >= 0 ? path.substring(0, lastSlash + 1) : "/";

            return uri.getScheme() + "://" + uri.getHost() +
                   (uri.getPort() != -1 ? ":" + uri.getPort() : "") + basePath;
        } catch (URISyntaxException e) {
            log.warn("Failed to parse URL: {}", e.getMessage());
            return url.substring(0, url.lastIndexOf('/') + 1);
        }
    }

    /**
     * Resolve a playlist reference against the playlist's base URL.
     *
     * @param baseUrl Base URL from {@link #extractBaseUrl(String)}
     * @param url Absolute URL, host-relative path or relative path
     * @return Absolute URL
     */
    public static String resolveUrl(String baseUrl, String url) {
        if (url.startsWith("http://") || url.startsWith("https://")) {
            return url;
        }

        if (url.startsWith("/")) {
            try {
                URI baseUri = new URI(baseUrl);
                return baseUri.getScheme() + "://" + baseUri.getHost() +
                       (baseUri.getPort() != -1 ? ":" + baseUri.getPort() : "") + url;
            } catch (URISyntaxException e) {
                log.warn("Failed to resolve absolute URL: {}", e.getMessage());
            }
        }

        return baseUrl + url;
    }
}
