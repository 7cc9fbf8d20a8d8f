package com.github.stormino.transcoder.service;

import com.github.stormino.transcoder.config.TranscoderProperties;
import com.github.stormino.transcoder.exception.JobNotReadyException;
import com.github.stormino.transcoder.exception.RangeNotSatisfiableException;
import com.github.stormino.transcoder.model.ByteRange;
import com.github.stormino.transcoder.model.DownloadJob;
import com.github.stormino.transcoder.model.JobStatus;
import com.github.stormino.transcoder.util.DownloadConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serves the artifact of a completed job, honoring a single {@code bytes=start-end} range.
 * The body is streamed in fixed-size chunks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RangeContentServer {

    private static final String BYTES_UNIT = "bytes=";

    private final TranscoderProperties properties;

    /**
     * @param job Job whose artifact to serve
     * @param rangeHeader Value of the Range header, or null
     * @return 200 with the whole file, or 206 with the requested range
     * @throws JobNotReadyException if the job is not DONE
     * @throws RangeNotSatisfiableException if the range is malformed or out of bounds
     */
    public ResponseEntity<StreamingResponseBody> serve(DownloadJob job, String rangeHeader) {
        JobStatus status = job.getStatus();
        if (status != JobStatus.DONE) {
            throw new JobNotReadyException(job.getId(), status);
        }

        Path file = job.getFiles().getOutput();
        long fileSize = sizeOf(file);

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.CONTENT_TYPE, DownloadConstants.VIDEO_CONTENT_TYPE);
        headers.set(HttpHeaders.ACCEPT_RANGES, "bytes");
        headers.set(HttpHeaders.CONTENT_ENCODING, "identity");
        headers.set(HttpHeaders.ACCESS_CONTROL_EXPOSE_HEADERS, DownloadConstants.EXPOSED_VIDEO_HEADERS);

        ByteRange range;
        HttpStatus httpStatus;
        if (rangeHeader == null) {
            range = new ByteRange(0, fileSize - 1);
            httpStatus = HttpStatus.OK;
        } else {
            range = parseRange(rangeHeader, fileSize);
            headers.set(HttpHeaders.CONTENT_RANGE,
                    String.format("bytes %d-%d/%d", range.getStart(), range.getEnd(), fileSize));
            httpStatus = HttpStatus.PARTIAL_CONTENT;
        }
        headers.setContentLength(Math.max(0, range.length()));

        log.debug("Serving {} of job {}: bytes {}-{}/{}", httpStatus.value(), job.getId(),
                range.getStart(), range.getEnd(), fileSize);

        int chunkSize = properties.getStreaming().getChunkSize();
        StreamingResponseBody body = out -> copyRange(file, range, chunkSize, out);
        return new ResponseEntity<>(body, headers, httpStatus);
    }

    /**
     * Parse a Range header of the form {@code bytes=start-end}. A missing start
     * means 0 and a missing end means the last byte of the file.
     *
     * @throws RangeNotSatisfiableException if the header is malformed, if
     *         {@code start > end}, {@code start < 0} or {@code end >= fileSize}
     */
    public ByteRange parseRange(String rangeHeader, long fileSize) {
        String value = rangeHeader.trim();
        if (!value.startsWith(BYTES_UNIT)) {
            throw new RangeNotSatisfiableException(rangeHeader, fileSize);
        }

        String[] bounds = value.substring(BYTES_UNIT.length()).split("-", -1);
        if (bounds.length != 2) {
            throw new RangeNotSatisfiableException(rangeHeader, fileSize);
        }

        long start;
        long end;
        try {
            start = bounds[0].isBlank() ? 0 : Long.parseLong(bounds[0].trim());
            end = bounds[1].isBlank() ? fileSize - 1 : Long.parseLong(bounds[1].trim());
        } catch (NumberFormatException e) {
            throw new RangeNotSatisfiableException(rangeHeader, fileSize);
        }

        if (start > end || start < 0 || end > fileSize - 1) {
            throw new RangeNotSatisfiableException(rangeHeader, fileSize);
        }
        return new ByteRange(start, end);
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read size of " + file, e);
        }
    }

    private static void copyRange(Path file, ByteRange range, int chunkSize, OutputStream out) throws IOException {
        try (RandomAccessFile input = new RandomAccessFile(file.toFile(), "r")) {
            input.seek(range.getStart());
            byte[] buffer = new byte[chunkSize];
            long remaining = range.length();
            while (remaining > 0) {
                int read = input.read(buffer, 0, (int) Math.min(buffer.length, remaining));
                if (read < 0) {
                    break;
                }
                out.write(buffer, 0, read);
                remaining -= read;
            }
            out.flush();
        }
    }
}
