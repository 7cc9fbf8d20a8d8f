package com.github.stormino.transcoder.service.progress;

import com.github.stormino.transcoder.config.TranscoderProperties;
import com.github.stormino.transcoder.model.DownloadJob;
import com.github.stormino.transcoder.model.JobStatus;
import com.github.stormino.transcoder.model.ProgressSample;
import com.github.stormino.transcoder.service.parser.ProgressFileReader;
import com.github.stormino.transcoder.service.state.JobStateMachine;
import com.github.stormino.transcoder.util.ProgressCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Follows a running job: polls its progress file at a fixed rate and settles
 * its final state when the transcoder exits.
 * <p>
 * Only the exit code decides between DONE and ERROR. The end marker of the
 * progress stream just stops polling, and read failures are retried at the
 * next tick.
 */
@Slf4j
@Service
public class JobProgressTracker {

    private final TaskScheduler scheduler;
    private final ProgressFileReader progressReader;
    private final JobStateMachine stateMachine;
    private final Duration pollInterval;
    private final Clock clock;

    @Autowired
    public JobProgressTracker(@Qualifier("progressScheduler") TaskScheduler scheduler,
                              ProgressFileReader progressReader,
                              JobStateMachine stateMachine,
                              TranscoderProperties properties) {
        this(scheduler, progressReader, stateMachine, properties.getProgress().getPollInterval(), Clock.systemUTC());
    }

    JobProgressTracker(TaskScheduler scheduler,
                       ProgressFileReader progressReader,
                       JobStateMachine stateMachine,
                       Duration pollInterval,
                       Clock clock) {
        this.scheduler = scheduler;
        this.progressReader = progressReader;
        this.stateMachine = stateMachine;
        this.pollInterval = pollInterval;
        this.clock = clock;
    }

    /**
     * Start following a job whose transcoder is running.
     */
    public void track(DownloadJob job) {
        if (job.getProcess() == null) {
            throw new IllegalArgumentException("Job " + job.getId() + " has no transcoder to follow");
        }

        ScheduledFuture<?> polling = scheduler.scheduleAtFixedRate(
                () -> pollSafely(job), clock.instant().plus(pollInterval), pollInterval);
        job.attachProgressTask(polling);

        job.getProcess().onExit().whenComplete((exitCode, error) -> complete(job, exitCode, error));
        log.debug("Tracking job {} every {}", job.getId(), pollInterval);
    }

    /**
     * One poll of the job's progress file.
     */
    void poll(DownloadJob job) {
        if (job.getStatus().isTerminal()) {
            job.cancelProgressTask();
            return;
        }

        Optional<ProgressSample> latest = progressReader.readLatest(job.getFiles().getProgress());
        if (latest.isEmpty()) {
            return;
        }

        ProgressSample sample = latest.get();
        if (sample.isEnd()) {
            log.debug("Job {} progress stream ended, waiting for transcoder exit", job.getId());
            job.cancelProgressTask();
            return;
        }

        synchronized (job) {
            if (job.getStatus().isTerminal()) {
                return;
            }
            double processed = sample.getSecondsProcessed();
            double elapsed = Duration.between(job.getCreatedAt(), clock.instant()).toMillis() / 1000.0;

            job.setSecondsProcessed(processed);
            job.setRemainingSeconds(
                    ProgressCalculator.estimateRemainingSeconds(elapsed, job.getTotalSeconds(), processed));
            job.setStatus(stateMachine.transition(job.getId(), job.getStatus(), JobStatus.IN_PROGRESS));
        }
    }

    /**
     * Settle the job once its transcoder exited.
     */
    void complete(DownloadJob job, Integer exitCode, Throwable error) {
        job.cancelProgressTask();

        synchronized (job) {
            if (job.getStatus().isTerminal()) {
                return;
            }
            if (error == null && exitCode != null && exitCode == 0) {
                job.setStatus(stateMachine.transition(job.getId(), job.getStatus(), JobStatus.DONE));
                job.setRemainingSeconds(null);
                log.info("Job {} ({}) done", job.getId(), job.getFingerprint().getDisplayName());
                return;
            }

            String message = error != null
                    ? "Transcoder failed: " + error.getMessage()
                    : "Transcoder exited with code " + exitCode;
            job.setErrorMessage(message);
            job.setStatus(stateMachine.transition(job.getId(), job.getStatus(), JobStatus.ERROR));
            log.error("Job {} ({}) failed: {}", job.getId(), job.getFingerprint().getDisplayName(), message);
        }
    }

    private void pollSafely(DownloadJob job) {
        try {
            poll(job);
        } catch (RuntimeException e) {
            // a throwing task would silently stop its fixed-rate schedule
            log.warn("Progress poll of job {} failed, retrying next tick: {}", job.getId(), e.getMessage());
        }
    }
}
