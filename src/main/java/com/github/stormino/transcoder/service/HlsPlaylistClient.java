package com.github.stormino.transcoder.service;

import com.github.stormino.transcoder.exception.SourceResolutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Fetches HLS playlists as text.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HlsPlaylistClient {

    private final OkHttpClient httpClient;

    /**
     * @param playlistUrl Absolute playlist URL
     * @return Playlist body
     * @throws SourceResolutionException on network errors and non-2xx responses
     */
    public String fetch(String playlistUrl) {
        Request request = new Request.Builder()
                .url(playlistUrl)
                .addHeader("Accept", "*/*")
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                log.error("Failed to fetch playlist: HTTP {}", response.code());
                throw new SourceResolutionException(
                        "Failed to fetch playlist: HTTP " + response.code(), playlistUrl);
            }
            return body.string();
        } catch (IOException e) {
            log.error("Failed to fetch playlist content: {}", e.getMessage());
            throw new SourceResolutionException("Failed to fetch playlist: " + e.getMessage(), e, playlistUrl);
        }
    }
}
