package com.github.stormino.transcoder.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.stormino.transcoder.config.TranscoderProperties;
import com.github.stormino.transcoder.exception.SourceNotAvailableException;
import com.github.stormino.transcoder.exception.SourceResolutionException;
import com.github.stormino.transcoder.model.SourceInfo;
import com.github.stormino.transcoder.service.external.SourceResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Looks episodes up in the catalogue API.
 * <p>
 * The answer to {@code GET /anime/animes/{contentId}/{episode}} is
 * {@code {"success": bool, "message": str, "data": {"<lang>": {"videoUri": ..., "url_image": ...}}}}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogueSourceResolver implements SourceResolver {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TranscoderProperties properties;

    @Override
    public SourceInfo resolve(int contentId, int episode, String lang) {
        String url = buildEpisodeUrl(contentId, episode);
        log.info("Resolving {} episode {} ({}) from {}", contentId, episode, lang, url);

        JsonNode root = fetchJson(url);

        if (!root.path("success").asBoolean(false)) {
            String message = root.path("message").asText("Episode not found");
            throw new SourceNotAvailableException(message, contentId, episode, lang);
        }

        JsonNode source = root.path("data").path(lang);
        if (source.isMissingNode() || source.isNull()) {
            throw new SourceNotAvailableException(
                    String.format("Language %s is not available for anime %d and episode %d", lang, contentId, episode),
                    contentId, episode, lang);
        }

        String videoUri = source.path("videoUri").asText(null);
        if (videoUri == null || videoUri.isBlank()) {
            throw new SourceResolutionException("Catalogue entry has no video URI", url);
        }

        return SourceInfo.builder()
                .sourceUrl(videoUri)
                .imageUrl(source.path("url_image").asText(null))
                .build();
    }

    private String buildEpisodeUrl(int contentId, int episode) {
        HttpUrl base = HttpUrl.parse(properties.getCatalogue().getBaseUrl());
        if (base == null) {
            throw new SourceResolutionException("Invalid catalogue base URL", properties.getCatalogue().getBaseUrl());
        }
        return base.newBuilder()
                .addPathSegment("anime")
                .addPathSegment("animes")
                .addPathSegment(String.valueOf(contentId))
                .addPathSegment(String.valueOf(episode))
                .build()
                .toString();
    }

    private JsonNode fetchJson(String url) {
        Request request = new Request.Builder()
                .url(url)
                .header("Accept", "application/json")
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (body == null) {
                throw new SourceResolutionException("Empty response body", url);
            }
            // the catalogue answers unknown episodes with an error status and a JSON body
            String content = body.string();
            if (!response.isSuccessful() && !looksLikeJson(content)) {
                throw new SourceResolutionException("Catalogue returned HTTP " + response.code(), url);
            }
            return objectMapper.readTree(content);
        } catch (IOException e) {
            log.error("Error querying catalogue: {}", e.getMessage());
            throw new SourceResolutionException("Catalogue request failed: " + e.getMessage(), e, url);
        }
    }

    private static boolean looksLikeJson(String content) {
        return content.stripLeading().startsWith("{");
    }
}
