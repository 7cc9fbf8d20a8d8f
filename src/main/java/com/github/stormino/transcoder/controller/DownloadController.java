package com.github.stormino.transcoder.controller;

import com.github.stormino.transcoder.exception.InvalidRequestException;
import com.github.stormino.transcoder.model.JobStatus;
import com.github.stormino.transcoder.model.JobStatusResponse;
import com.github.stormino.transcoder.model.Quality;
import com.github.stormino.transcoder.service.DownloadOrchestrator;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@Validated
@RestController
@RequiredArgsConstructor
public class DownloadController {

    private final DownloadOrchestrator orchestrator;

    /**
     * Start or poll the conversion of an episode
     */
    @GetMapping("/download/{contentId}/{episode}/{lang}")
    public ResponseEntity<JobStatusResponse> download(
            @PathVariable @PositiveOrZero int contentId,
            @PathVariable @PositiveOrZero int episode,
            @PathVariable @NotBlank String lang,
            @RequestParam(defaultValue = "high") String quality) {

        log.debug("Download request: {} E{} [{}, {}]", contentId, episode, lang, quality);

        JobStatusResponse response = orchestrator.requestDownload(contentId, episode, lang, parseQuality(quality));

        if (response.getStatus() == JobStatus.ERROR) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
        return ResponseEntity.ok(response);
    }

    private static Quality parseQuality(String quality) {
        try {
            return Quality.fromValue(quality);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage(), e, "quality", quality);
        }
    }

    /**
     * Get all cached jobs
     */
    @GetMapping("/downloads")
    public ResponseEntity<List<JobStatusResponse>> getAllDownloads() {
        return ResponseEntity.ok(orchestrator.listJobs());
    }
}
