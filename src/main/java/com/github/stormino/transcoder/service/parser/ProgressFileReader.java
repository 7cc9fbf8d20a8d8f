package com.github.stormino.transcoder.service.parser;

import com.github.stormino.transcoder.model.ProgressSample;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

/**
 * Reads the most recent sample of a progress file by scanning it backwards
 * from the end, so the cost of a poll does not grow with the file.
 * <p>
 * A trailing line without terminator is still being written and is ignored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProgressFileReader {

    private static final int BLOCK_SIZE = 4096;

    /**
     * Longer lines cannot be progress samples and are skipped.
     */
    private static final int MAX_LINE_BYTES = 1024;

    private final ProgressParser parser;

    /**
     * @param progressFile File the transcoder appends samples to
     * @return The latest sample, or empty if the file is missing or has none yet
     */
    public Optional<ProgressSample> readLatest(Path progressFile) {
        if (!Files.exists(progressFile)) {
            return Optional.empty();
        }

        try (RandomAccessFile file = new RandomAccessFile(progressFile.toFile(), "r")) {
            return scanBackwards(file);
        } catch (IOException e) {
            log.debug("Could not read progress file {}: {}", progressFile, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ProgressSample> scanBackwards(RandomAccessFile file) throws IOException {
        long position = file.length();
        byte[] pending = new byte[0];
        boolean seenTerminator = false;
        boolean skipOversized = false;

        while (position > 0) {
            int size = (int) Math.min(BLOCK_SIZE, position);
            position -= size;

            byte[] data = new byte[size + pending.length];
            file.seek(position);
            file.readFully(data, 0, size);
            System.arraycopy(pending, 0, data, size, pending.length);

            int lineEnd = data.length;
            for (int i = data.length - 1; i >= 0; i--) {
                if (data[i] != '\n') {
                    continue;
                }
                if (!seenTerminator) {
                    // everything after the last terminator is incomplete
                    seenTerminator = true;
                } else if (skipOversized) {
                    skipOversized = false;
                } else {
                    ProgressSample sample = parse(data, i + 1, lineEnd);
                    if (sample != null) {
                        return Optional.of(sample);
                    }
                }
                lineEnd = i;
            }

            if (!seenTerminator) {
                pending = new byte[0];
            } else if (lineEnd > MAX_LINE_BYTES) {
                skipOversized = true;
                pending = new byte[0];
            } else {
                pending = Arrays.copyOfRange(data, 0, lineEnd);
            }
        }

        // first line of the file
        if (seenTerminator && !skipOversized && pending.length > 0) {
            return Optional.ofNullable(parse(pending, 0, pending.length));
        }
        return Optional.empty();
    }

    private ProgressSample parse(byte[] data, int from, int to) {
        if (to <= from) {
            return null;
        }
        return parser.parseLine(new String(data, from, to - from, StandardCharsets.UTF_8).trim());
    }
}
