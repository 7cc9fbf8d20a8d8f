package com.github.stormino.transcoder.service;

import com.github.stormino.transcoder.exception.JobNotFoundException;
import com.github.stormino.transcoder.exception.JobNotReadyException;
import com.github.stormino.transcoder.exception.TranscoderLaunchException;
import com.github.stormino.transcoder.model.DownloadJob;
import com.github.stormino.transcoder.model.JobFiles;
import com.github.stormino.transcoder.model.JobFingerprint;
import com.github.stormino.transcoder.model.JobStatus;
import com.github.stormino.transcoder.model.JobStatusResponse;
import com.github.stormino.transcoder.model.Quality;
import com.github.stormino.transcoder.model.SourceInfo;
import com.github.stormino.transcoder.model.Variant;
import com.github.stormino.transcoder.service.cache.JobCache;
import com.github.stormino.transcoder.service.external.SourceResolver;
import com.github.stormino.transcoder.service.external.TranscodeHandle;
import com.github.stormino.transcoder.service.external.Transcoder;
import com.github.stormino.transcoder.service.external.VariantEnumerator;
import com.github.stormino.transcoder.service.progress.JobProgressTracker;
import com.github.stormino.transcoder.util.DownloadConstants;
import com.github.stormino.transcoder.util.ProgressCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Entry point of download requests: finds or creates the job of a request
 * and renders its status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadOrchestrator {

    private final JobCache jobCache;
    private final JobWorkspace workspace;
    private final SourceResolver sourceResolver;
    private final VariantEnumerator variantEnumerator;
    private final VariantSelector variantSelector;
    private final Transcoder transcoder;
    private final JobProgressTracker progressTracker;

    /**
     * Creations in progress, so that concurrent identical requests share one job.
     */
    private final ConcurrentMap<JobFingerprint, CompletableFuture<DownloadJob>> inFlight = new ConcurrentHashMap<>();

    /**
     * Find or start the conversion of an episode and render its status.
     * A job found in ERROR is removed once its status has been rendered.
     */
    public JobStatusResponse requestDownload(int contentId, int episode, String lang, Quality quality) {
        DownloadJob job = obtainJob(new JobFingerprint(contentId, episode, lang, quality));
        return render(job);
    }

    /**
     * The cached job of a fingerprint, or a new one.
     *
     * @throws com.github.stormino.transcoder.exception.SourceResolutionException if the
     *         source could not be resolved; nothing is cached then
     */
    public DownloadJob obtainJob(JobFingerprint fingerprint) {
        Optional<DownloadJob> cached = jobCache.retrieve(fingerprint);
        if (cached.isPresent()) {
            return cached.get();
        }

        CompletableFuture<DownloadJob> creation = new CompletableFuture<>();
        CompletableFuture<DownloadJob> running = inFlight.putIfAbsent(fingerprint, creation);
        if (running != null) {
            log.debug("Waiting for the job being created for {}", fingerprint.getDisplayName());
            return await(running);
        }

        try {
            // another request may have finished creating it since the first lookup
            DownloadJob job = jobCache.retrieve(fingerprint).orElseGet(() -> createJob(fingerprint));
            creation.complete(job);
            return job;
        } catch (RuntimeException e) {
            creation.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(fingerprint, creation);
        }
    }

    /**
     * Render a job's status. Rendering a job in ERROR removes it afterwards,
     * so the next identical request starts over.
     */
    public JobStatusResponse render(DownloadJob job) {
        JobStatusResponse response = describe(job);
        if (response.getStatus() == JobStatus.ERROR) {
            jobCache.remove(job);
        }
        return response;
    }

    /**
     * Look a job up by id, marking it as recently used.
     */
    public Optional<DownloadJob> findJob(String id) {
        return jobCache.get(id);
    }

    /**
     * @throws JobNotFoundException if no job has this id
     * @throws JobNotReadyException if the job is not DONE
     */
    public DownloadJob requireCompleted(String id) {
        DownloadJob job = findJob(id).orElseThrow(() -> new JobNotFoundException(id));
        JobStatus status = job.getStatus();
        if (status != JobStatus.DONE) {
            throw new JobNotReadyException(id, status);
        }
        return job;
    }

    /**
     * Status of every cached job, least recently used first. Removes nothing.
     */
    public List<JobStatusResponse> listJobs() {
        return jobCache.snapshot().stream()
                .map(this::describe)
                .collect(Collectors.toList());
    }

    private DownloadJob createJob(JobFingerprint fingerprint) {
        SourceInfo source = sourceResolver.resolve(
                fingerprint.getContentId(), fingerprint.getEpisode(), fingerprint.getLang());

        List<Variant> variants = variantEnumerator.listVariants(source.getSourceUrl());
        Variant variant = variantSelector.select(variants, fingerprint.getQuality(), source.getSourceUrl());
        log.info("Selected {} variant {} of {} for {}", fingerprint.getQuality().getValue(),
                variant.getResolution(), variants.size(), fingerprint.getDisplayName());

        String id = UUID.randomUUID().toString();
        JobFiles files = workspace.filesFor(id);

        TranscodeHandle handle;
        try {
            handle = transcoder.start(variant.getUrl(), files);
        } catch (TranscoderLaunchException e) {
            log.error("Failed to launch transcoder for {}: {}", fingerprint.getDisplayName(), e.getMessage());
            return DownloadJob.failed(id, fingerprint, files, e.getMessage());
        }

        DownloadJob job = DownloadJob.builder()
                .id(id)
                .fingerprint(fingerprint)
                .files(files)
                .process(handle.getProcess())
                .totalSeconds(handle.getTotalDurationSeconds())
                .imageUrl(source.getImageUrl())
                .status(JobStatus.STARTED)
                .build();

        DownloadJob cached = jobCache.add(job);
        if (cached != job) {
            jobCache.remove(job);
            return cached;
        }

        progressTracker.track(job);
        log.info("Started job {} for {}", id, fingerprint.getDisplayName());
        return job;
    }

    private JobStatusResponse describe(DownloadJob job) {
        JobStatus status = job.getStatus();
        JobStatusResponse.JobStatusResponseBuilder response = JobStatusResponse.builder()
                .status(status)
                .id(job.getId());

        switch (status) {
            case DONE:
                response.result(DownloadConstants.RESULT_PATH + job.getId());
                break;
            case ERROR:
                response.message(String.valueOf(job.getErrorMessage()));
                break;
            case IN_PROGRESS:
                response.progress(ProgressCalculator.toPercentage(job.getProgress()))
                        .estimatedRemainingTime(ProgressCalculator.roundNonNegative(job.getRemainingSeconds()));
                break;
            default:
                break;
        }
        return response.build();
    }

    private static DownloadJob await(CompletableFuture<DownloadJob> creation) {
        try {
            return creation.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}
