package com.github.stormino.transcoder.service.parser;

import com.github.stormino.transcoder.model.ProgressSample;
import com.github.stormino.transcoder.util.DownloadConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Parser for the key=value lines FFmpeg writes with {@code -progress}.
 * Only two keys matter: the processed media time and the end-of-stream marker.
 */
@Slf4j
@Component
public class FfmpegProgressParser implements ProgressParser {

    /**
     * Same unit as {@code out_time_ms}, written by newer FFmpeg releases.
     */
    private static final String OUT_TIME_US_KEY = "out_time_us";

    private static final double MICROS_PER_SECOND = 1_000_000.0;

    @Override
    public ProgressSample parseLine(String line) {
        if (line == null || line.isBlank()) {
            return null;
        }

        int separator = line.indexOf('=');
        if (separator <= 0) {
            return null;
        }

        String key = line.substring(0, separator).trim();
        String value = line.substring(separator + 1).trim();

        if (DownloadConstants.PROGRESS_STATE_KEY.equals(key)) {
            return DownloadConstants.PROGRESS_STATE_END.equals(value) ? ProgressSample.end() : null;
        }

        if (DownloadConstants.PROGRESS_OUT_TIME_KEY.equals(key) || OUT_TIME_US_KEY.equals(key)) {
            return parseOutTime(value);
        }

        return null;
    }

    /**
     * FFmpeg writes N/A before the first packet and a negative sentinel on some inputs.
     */
    private ProgressSample parseOutTime(String value) {
        if ("N/A".equalsIgnoreCase(value)) {
            return null;
        }
        try {
            long micros = Long.parseLong(value);
            if (micros < 0) {
                return null;
            }
            return ProgressSample.elapsed(micros / MICROS_PER_SECOND);
        } catch (NumberFormatException e) {
            log.trace("Ignoring unparseable out_time value '{}'", value);
            return null;
        }
    }
}
