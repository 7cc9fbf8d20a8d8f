package com.github.stormino.transcoder.service.cache;

import com.github.stormino.transcoder.config.TranscoderProperties;
import com.github.stormino.transcoder.model.DownloadJob;
import com.github.stormino.transcoder.model.JobFingerprint;
import com.github.stormino.transcoder.service.JobWorkspace;
import com.github.stormino.transcoder.util.FormatUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, recency-ordered collection of jobs.
 * <p>
 * Any successful lookup or insertion makes a job the most recent one, and
 * eviction always takes the least recent. Three limits apply: the number of
 * jobs, the aggregate size of their artifacts, and an idle-expiration window.
 * The first two are enforced on insertion and by the reclaimer; idle expiration
 * only by the reclaimer ({@link #runReclaimer()}), which sleeps until the
 * soonest expiration instead of polling.
 * <p>
 * All mutations hold one lock. The cleanup of evicted jobs (stop polling,
 * terminate the transcoder, delete files) runs after the lock is released.
 */
@Slf4j
public class JobCache {

    private static final Duration MIN_WAIT = Duration.ofMillis(1);

    private final JobWorkspace workspace;
    private final TranscoderProperties.Cache limits;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition modified = lock.newCondition();

    /**
     * Access-ordered: iteration starts at the least recently used job.
     */
    private final LinkedHashMap<String, DownloadJob> jobs = new LinkedHashMap<>(16, 0.75f, true);
    private final Map<JobFingerprint, DownloadJob> byFingerprint = new HashMap<>();
    private long modificationCount;

    public JobCache(@NonNull JobWorkspace workspace,
                    @NonNull TranscoderProperties.Cache limits,
                    @NonNull Clock clock) {
        this.workspace = workspace;
        this.limits = limits;
        this.clock = clock;
    }

    /**
     * Look up a job by id and mark it most recent.
     */
    public Optional<DownloadJob> get(String id) {
        lock.lock();
        try {
            DownloadJob job = jobs.get(id);
            if (job != null) {
                job.setLastAccess(clock.instant());
            }
            return Optional.ofNullable(job);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Look up the job of a request fingerprint and mark it most recent.
     */
    public Optional<DownloadJob> retrieve(JobFingerprint fingerprint) {
        lock.lock();
        try {
            DownloadJob job = byFingerprint.get(fingerprint);
            if (job != null) {
                touch(job);
            }
            return Optional.ofNullable(job);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Insert a job as the most recent one, then enforce the count and size limits.
     * <p>
     * If a job with the same fingerprint is already cached, nothing is inserted
     * and the cached job is returned instead; the caller owns the rejected job.
     *
     * @return The job now cached for the fingerprint
     */
    public DownloadJob add(@NonNull DownloadJob job) {
        List<DownloadJob> evicted;
        DownloadJob cached;
        lock.lock();
        try {
            DownloadJob existing = byFingerprint.get(job.getFingerprint());
            if (existing != null && !existing.equals(job)) {
                touch(existing);
                log.debug("Job {} already cached for {}, keeping it over {}",
                        existing.getId(), job.getFingerprint().getDisplayName(), job.getId());
                return existing;
            }

            job.setLastAccess(clock.instant());
            jobs.put(job.getId(), job);
            byFingerprint.put(job.getFingerprint(), job);
            cached = job;

            evicted = new ArrayList<>();
            evictOverflow(evicted);
            evictOversized(evicted);
            modificationCount++;
            modified.signalAll();
        } finally {
            lock.unlock();
        }
        cleanup(evicted);
        return cached;
    }

    /**
     * Remove a job and clean up after it. The cleanup also runs for a job
     * that is not cached, such as one that failed before being added.
     *
     * @return true if the job was cached
     */
    public boolean remove(@NonNull DownloadJob job) {
        boolean removed;
        lock.lock();
        try {
            removed = jobs.get(job.getId()) == job;
            if (removed) {
                unlink(job);
                modificationCount++;
                modified.signalAll();
            }
        } finally {
            lock.unlock();
        }
        log.debug("Removing job {} ({})", job.getId(), removed ? "cached" : "not cached");
        cleanup(job);
        return removed;
    }

    /**
     * One reclaimer pass: evict idle jobs from the least recent end, then
     * enforce the size limit.
     *
     * @return How long to wait before the next pass
     */
    public Duration reclaim() {
        List<DownloadJob> evicted = new ArrayList<>();
        Duration wait;
        lock.lock();
        try {
            wait = reclaimLocked(evicted);
        } finally {
            lock.unlock();
        }
        cleanup(evicted);
        return wait;
    }

    /**
     * Run reclaimer passes until the calling thread is interrupted. Between
     * passes the thread sleeps until the soonest expiration, capped by the
     * reclaim interval, or until the cache is modified.
     */
    public void runReclaimer() {
        log.info("Job reclaimer started");
        while (!Thread.currentThread().isInterrupted()) {
            List<DownloadJob> evicted = new ArrayList<>();
            lock.lock();
            try {
                Duration wait = reclaimLocked(evicted);
                long seen = modificationCount;
                if (evicted.isEmpty()) {
                    long remaining = wait.toNanos();
                    while (remaining > 0 && seen == modificationCount) {
                        remaining = modified.awaitNanos(remaining);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                lock.unlock();
            }
            cleanup(evicted);
        }
        log.info("Job reclaimer stopped");
    }

    /**
     * Jobs in recency order, least recent first. Does not mark anything as accessed.
     */
    public List<DownloadJob> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(jobs.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }

    public long totalSizeBytes() {
        lock.lock();
        try {
            return sizeOf(jobs.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Evict every job, as on shutdown.
     */
    public void clear() {
        List<DownloadJob> evicted;
        lock.lock();
        try {
            evicted = new ArrayList<>(jobs.values());
            jobs.clear();
            byFingerprint.clear();
            modificationCount++;
            modified.signalAll();
        } finally {
            lock.unlock();
        }
        if (!evicted.isEmpty()) {
            log.info("Clearing {} cached jobs", evicted.size());
        }
        cleanup(evicted);
    }

    private Duration reclaimLocked(List<DownloadJob> evicted) {
        Instant now = clock.instant();
        Duration window = limits.getExpireAfterAccess();

        Iterator<DownloadJob> eldestFirst = jobs.values().iterator();
        while (eldestFirst.hasNext()) {
            DownloadJob eldest = eldestFirst.next();
            if (!eldest.isExpired(now, window)) {
                break;
            }
            eldestFirst.remove();
            byFingerprint.remove(eldest.getFingerprint());
            evicted.add(eldest);
            log.info("Evicting idle job {} ({}), unused for {}", eldest.getId(),
                    eldest.getFingerprint().getDisplayName(),
                    FormatUtils.formatDuration(Duration.between(eldest.getLastAccess(), now)));
        }

        evictOversized(evicted);
        if (!evicted.isEmpty()) {
            modificationCount++;
        }
        return nextWait(now);
    }

    /**
     * Idle eviction only ever takes the least recent job, so that job's expiration
     * decides the next pass even if a clock step left a newer job expiring sooner.
     */
    private Duration nextWait(Instant now) {
        Duration interval = limits.getReclaimInterval();
        if (jobs.isEmpty()) {
            return interval;
        }
        Instant expiresAt = jobs.values().iterator().next().expiresAt(limits.getExpireAfterAccess());
        // wake just after the expiration, since an entry is expired only strictly past it
        Duration untilExpiration = Duration.between(now, expiresAt).plusMillis(1);
        if (untilExpiration.compareTo(MIN_WAIT) < 0) {
            return MIN_WAIT;
        }
        return untilExpiration.compareTo(interval) < 0 ? untilExpiration : interval;
    }

    private void evictOverflow(List<DownloadJob> evicted) {
        while (jobs.size() > limits.getMaxElements()) {
            DownloadJob eldest = popEldest();
            evicted.add(eldest);
            log.info("Evicting job {} ({}): more than {} jobs cached", eldest.getId(),
                    eldest.getFingerprint().getDisplayName(), limits.getMaxElements());
        }
    }

    /**
     * A single large artifact can outweigh several small ones, so this may evict more than once.
     */
    private void evictOversized(List<DownloadJob> evicted) {
        long maxBytes = limits.getMaxSizeBytes();
        long total = sizeOf(jobs.values());
        while (total > maxBytes && !jobs.isEmpty()) {
            DownloadJob eldest = popEldest();
            long size = eldest.getSizeBytes();
            total -= size;
            evicted.add(eldest);
            log.info("Evicting job {} ({}, {}): cached artifacts exceed {}", eldest.getId(),
                    eldest.getFingerprint().getDisplayName(), FormatUtils.formatSize(size),
                    FormatUtils.formatSize(maxBytes));
        }
    }

    private DownloadJob popEldest() {
        DownloadJob eldest = jobs.values().iterator().next();
        unlink(eldest);
        return eldest;
    }

    private void unlink(DownloadJob job) {
        jobs.remove(job.getId());
        byFingerprint.remove(job.getFingerprint(), job);
    }

    private void touch(DownloadJob job) {
        // access-ordered map: get moves the entry to the most recent end
        jobs.get(job.getId());
        job.setLastAccess(clock.instant());
    }

    private static long sizeOf(Iterable<DownloadJob> jobs) {
        long total = 0;
        for (DownloadJob job : jobs) {
            total += job.getSizeBytes();
        }
        return total;
    }

    private void cleanup(List<DownloadJob> evicted) {
        for (DownloadJob job : evicted) {
            cleanup(job);
        }
    }

    private void cleanup(DownloadJob job) {
        job.cancelProgressTask();
        job.terminateProcess();
        if (!workspace.deleteJobFiles(job.getFiles())) {
            log.warn("Some files of job {} could not be deleted", job.getId());
        }
    }
}
