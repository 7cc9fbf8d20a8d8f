package com.github.stormino.transcoder.model;

import com.github.stormino.transcoder.service.external.TranscoderProcess;
import com.github.stormino.transcoder.util.ProgressCalculator;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Future;

/**
 * One conversion attempt. Mutable fields are written by the job's progress
 * task and read concurrently by request threads; compound updates synchronize
 * on the job itself.
 */
@Slf4j
@Getter
public class DownloadJob {

    private final String id;
    private final JobFingerprint fingerprint;
    private final JobFiles files;
    private final Instant createdAt;
    private final double totalSeconds;
    private final String imageUrl;

    /**
     * Null for jobs that failed before the transcoder was launched.
     */
    private final TranscoderProcess process;

    @Setter
    private volatile JobStatus status;

    @Setter
    private volatile Instant lastAccess;

    @Setter
    private volatile double secondsProcessed;

    @Setter
    private volatile Double remainingSeconds;

    @Setter
    private volatile String errorMessage;

    @Getter(AccessLevel.NONE)
    private Future<?> progressTask;

    @Getter(AccessLevel.NONE)
    private boolean progressTaskCancelled;

    @Builder
    private DownloadJob(@NonNull String id,
                        @NonNull JobFingerprint fingerprint,
                        @NonNull JobFiles files,
                        TranscoderProcess process,
                        double totalSeconds,
                        String imageUrl,
                        JobStatus status,
                        String errorMessage,
                        Instant createdAt) {
        this.id = id;
        this.fingerprint = fingerprint;
        this.files = files;
        this.process = process;
        this.totalSeconds = totalSeconds;
        this.imageUrl = imageUrl;
        this.status = status != null ? status : JobStatus.STARTED;
        this.errorMessage = errorMessage;
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.lastAccess = this.createdAt;
    }

    /**
     * Create a job that failed before its transcoder could run.
     */
    public static DownloadJob failed(String id, JobFingerprint fingerprint, JobFiles files, String errorMessage) {
        return DownloadJob.builder()
                .id(id)
                .fingerprint(fingerprint)
                .files(files)
                .status(JobStatus.ERROR)
                .errorMessage(errorMessage)
                .build();
    }

    /**
     * Fraction of the media processed, or null when unknown. Torn or
     * inconsistent reads are reported as unknown.
     */
    public Double getProgress() {
        return ProgressCalculator.calculateFraction(secondsProcessed, totalSeconds);
    }

    /**
     * Size of the output artifact on disk, read fresh since it grows while transcoding.
     */
    public long getSizeBytes() {
        Path output = files.getOutput();
        try {
            return Files.exists(output) ? Files.size(output) : 0L;
        } catch (IOException e) {
            log.debug("Could not read size of {}: {}", output, e.getMessage());
            return 0L;
        }
    }

    public Instant expiresAt(Duration expireAfterAccess) {
        return lastAccess.plus(expireAfterAccess);
    }

    public boolean isExpired(Instant now, Duration expireAfterAccess) {
        return expiresAt(expireAfterAccess).isBefore(now);
    }

    public boolean isDone() {
        return status == JobStatus.DONE;
    }

    public boolean isFailed() {
        return status == JobStatus.ERROR;
    }

    /**
     * Attach the polling task. A task attached after the job's polling was
     * cancelled is cancelled right away.
     */
    public synchronized void attachProgressTask(Future<?> task) {
        if (progressTaskCancelled) {
            task.cancel(false);
            return;
        }
        this.progressTask = task;
    }

    /**
     * Cancel the polling task. Idempotent, and a no-op for a task that already finished.
     */
    public synchronized void cancelProgressTask() {
        progressTaskCancelled = true;
        if (progressTask != null) {
            progressTask.cancel(false);
            progressTask = null;
        }
    }

    public synchronized boolean isProgressTaskActive() {
        return progressTask != null && !progressTask.isDone();
    }

    /**
     * Request termination of the transcoder if it is still running. Does not wait for exit.
     */
    public void terminateProcess() {
        if (process != null && process.isAlive()) {
            log.debug("Terminating transcoder of job {}", id);
            process.terminate();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DownloadJob)) {
            return false;
        }
        return id.equals(((DownloadJob) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "DownloadJob[" + id + ", " + fingerprint.getDisplayName() + ", " + status + "]";
    }
}
