package com.github.stormino.transcoder.controller;

import com.github.stormino.transcoder.exception.InvalidManifestException;
import com.github.stormino.transcoder.exception.InvalidRequestException;
import com.github.stormino.transcoder.exception.JobNotFoundException;
import com.github.stormino.transcoder.exception.JobNotReadyException;
import com.github.stormino.transcoder.exception.RangeNotSatisfiableException;
import com.github.stormino.transcoder.exception.SourceNotAvailableException;
import com.github.stormino.transcoder.exception.SourceResolutionException;
import com.github.stormino.transcoder.exception.TranscodeException;
import com.github.stormino.transcoder.model.JobStatusResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps the exception hierarchy onto status codes, with a JSON error body.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(SourceNotAvailableException.class)
    public ResponseEntity<JobStatusResponse> handleNotAvailable(SourceNotAvailableException e) {
        log.info("Source not available: {}", e.getMessage());
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(InvalidManifestException.class)
    public ResponseEntity<JobStatusResponse> handleInvalidManifest(InvalidManifestException e) {
        log.warn("Invalid manifest at {}: {}", e.getSourceUrl(), e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(SourceResolutionException.class)
    public ResponseEntity<JobStatusResponse> handleResolution(SourceResolutionException e) {
        log.warn("Source resolution failed for {}: {}", e.getSourceUrl(), e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<JobStatusResponse> handleNotFound(JobNotFoundException e) {
        log.debug("Unknown job {}", e.getJobId());
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(JobNotReadyException.class)
    public ResponseEntity<JobStatusResponse> handleNotReady(JobNotReadyException e) {
        log.debug("Job {} not ready ({})", e.getJobId(), e.getStatus());
        return error(HttpStatus.TOO_EARLY, e.getMessage());
    }

    @ExceptionHandler(RangeNotSatisfiableException.class)
    public ResponseEntity<JobStatusResponse> handleRange(RangeNotSatisfiableException e) {
        log.debug("Unsatisfiable range '{}' for a {} byte file", e.getRangeHeader(), e.getFileSize());
        return ResponseEntity.status(HttpStatus.REQUESTED_RANGE_NOT_SATISFIABLE)
                .header(HttpHeaders.CONTENT_RANGE, "bytes */" + e.getFileSize())
                .contentType(MediaType.APPLICATION_JSON)
                .body(JobStatusResponse.error(e.getMessage()));
    }

    @ExceptionHandler({InvalidRequestException.class, MethodArgumentTypeMismatchException.class,
            ConstraintViolationException.class})
    public ResponseEntity<JobStatusResponse> handleBadRequest(Exception e) {
        log.debug("Bad request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(TranscodeException.class)
    public ResponseEntity<JobStatusResponse> handleTranscode(TranscodeException e) {
        log.error("Request failed: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private static ResponseEntity<JobStatusResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(JobStatusResponse.error(message));
    }
}
