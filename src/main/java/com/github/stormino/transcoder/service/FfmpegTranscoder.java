package com.github.stormino.transcoder.service;

import com.github.stormino.transcoder.exception.InvalidManifestException;
import com.github.stormino.transcoder.exception.TranscoderLaunchException;
import com.github.stormino.transcoder.model.JobFiles;
import com.github.stormino.transcoder.service.command.FfmpegCommandBuilder;
import com.github.stormino.transcoder.service.external.LocalTranscoderProcess;
import com.github.stormino.transcoder.service.external.TranscodeHandle;
import com.github.stormino.transcoder.service.external.Transcoder;
import com.github.stormino.transcoder.util.UrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs ffmpeg on a local copy of the variant's media playlist.
 * <p>
 * The copy is what ffmpeg reads, so its relative references are made absolute
 * against the remote playlist first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FfmpegTranscoder implements Transcoder {

    private static final String PLAYLIST_HEADER = "#EXTM3U";
    private static final Pattern EXTINF_PATTERN = Pattern.compile("#EXTINF:([\\d.]+)");
    private static final Pattern URI_ATTRIBUTE_PATTERN = Pattern.compile("URI=\"([^\"]+)\"");

    private final HlsPlaylistClient playlistClient;
    private final FfmpegCommandBuilder commandBuilder;

    @Override
    public TranscodeHandle start(String variantUrl, JobFiles files) {
        String playlist = playlistClient.fetch(variantUrl);
        if (!playlist.startsWith(PLAYLIST_HEADER)) {
            throw new InvalidManifestException("Not a m3u8 file", variantUrl);
        }
        double totalDuration = totalDuration(playlist, variantUrl);

        try {
            Files.writeString(files.getManifest(), localize(playlist, variantUrl), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TranscoderLaunchException("Cannot write manifest: " + e.getMessage(), e,
                    variantUrl, files.getOutput().toString());
        }

        List<String> command = commandBuilder.buildRemuxCommand(files);
        try {
            Process process = new ProcessBuilder(command)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
            LocalTranscoderProcess handle = new LocalTranscoderProcess(process);
            log.info("Started ffmpeg (pid {}) for {}, {} s of media", handle.pid(), files.getOutput(), totalDuration);
            return new TranscodeHandle(handle, totalDuration);
        } catch (IOException e) {
            log.error("Command was: {}", String.join(" ", command));
            throw new TranscoderLaunchException("Cannot start ffmpeg: " + e.getMessage(), e,
                    variantUrl, files.getOutput().toString());
        }
    }

    /**
     * Sum of the segment durations of a media playlist, in seconds.
     *
     * @throws InvalidManifestException if a segment duration is not a number
     */
    static double totalDuration(String playlist, String playlistUrl) {
        double total = 0;
        Matcher matcher = EXTINF_PATTERN.matcher(playlist);
        while (matcher.find()) {
            try {
                total += Double.parseDouble(matcher.group(1));
            } catch (NumberFormatException e) {
                throw new InvalidManifestException("Invalid segment duration: " + matcher.group(1), e, playlistUrl);
            }
        }
        return total;
    }

    /**
     * Rewrite segment and key references of a media playlist to absolute URLs.
     */
    static String localize(String playlist, String playlistUrl) {
        String baseUrl = UrlUtils.extractBaseUrl(playlistUrl);
        StringBuilder localized = new StringBuilder(playlist.length());

        for (String line : playlist.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                localized.append(line);
            } else if (!trimmed.startsWith("#")) {
                localized.append(UrlUtils.resolveUrl(baseUrl, trimmed));
            } else {
                Matcher uri = URI_ATTRIBUTE_PATTERN.matcher(line);
                StringBuilder rewritten = new StringBuilder();
                while (uri.find()) {
                    String absolute = UrlUtils.resolveUrl(baseUrl, uri.group(1));
                    uri.appendReplacement(rewritten, Matcher.quoteReplacement("URI=\"" + absolute + "\""));
                }
                uri.appendTail(rewritten);
                localized.append(rewritten);
            }
            localized.append('\n');
        }
        return localized.toString();
    }
}
