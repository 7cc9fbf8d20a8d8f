package com.github.stormino.transcoder.service;

import com.github.stormino.transcoder.service.cache.JobCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Owns the thread running the cache reclaimer for the lifetime of the application.
 * On shutdown the thread is stopped and every cached job is evicted, so no
 * transcoder outlives the service.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobReclaimer implements SmartLifecycle {

    private static final long JOIN_TIMEOUT_MS = 5000;

    private final JobCache jobCache;

    private volatile Thread thread;

    @Override
    public synchronized void start() {
        if (thread != null) {
            return;
        }
        thread = new Thread(jobCache::runReclaimer, "job-reclaimer");
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    public synchronized void stop() {
        Thread running = thread;
        if (running == null) {
            return;
        }
        thread = null;
        running.interrupt();
        try {
            running.join(JOIN_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the job reclaimer to stop");
        }
        jobCache.clear();
    }

    @Override
    public boolean isRunning() {
        Thread running = thread;
        return running != null && running.isAlive();
    }
}
