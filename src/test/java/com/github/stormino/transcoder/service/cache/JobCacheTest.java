package com.github.stormino.transcoder.service.cache;

import com.github.stormino.transcoder.config.TranscoderProperties;
import com.github.stormino.transcoder.model.DownloadJob;
import com.github.stormino.transcoder.model.JobFiles;
import com.github.stormino.transcoder.model.JobFingerprint;
import com.github.stormino.transcoder.model.Quality;
import com.github.stormino.transcoder.service.JobWorkspace;
import com.github.stormino.transcoder.support.FakeTranscoderProcess;
import com.github.stormino.transcoder.support.MutableClock;
import com.github.stormino.transcoder.util.DownloadConstants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JobCache")
class JobCacheTest {

    private static final long MIB = DownloadConstants.BYTES_PER_MIB;

    @TempDir
    Path tempDir;

    private JobWorkspace workspace;
    private TranscoderProperties.Cache limits;
    private MutableClock clock;
    private JobCache cache;

    @BeforeEach
    void setUp() {
        workspace = new JobWorkspace(tempDir);
        workspace.initialize();

        limits = new TranscoderProperties.Cache();
        limits.setMaxElements(3);
        limits.setMaxSizeGib(1);
        limits.setExpireAfterAccess(Duration.ofHours(12));
        limits.setReclaimInterval(Duration.ofSeconds(10));

        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        cache = new JobCache(workspace, limits, clock);
    }

    private DownloadJob job(String id, int episode) throws IOException {
        return job(id, episode, 0);
    }

    /**
     * A running job whose three files exist, the output being sparse of the given size.
     */
    private DownloadJob job(String id, int episode, long outputBytes) throws IOException {
        JobFiles files = workspace.filesFor(id);
        try (RandomAccessFile output = new RandomAccessFile(files.getOutput().toFile(), "rw")) {
            output.setLength(outputBytes);
        }
        Files.writeString(files.getProgress(), "progress=continue\n");
        Files.writeString(files.getManifest(), "#EXTM3U\n");

        return DownloadJob.builder()
                .id(id)
                .fingerprint(new JobFingerprint(1, episode, "vostfr", Quality.HIGH))
                .files(files)
                .process(new FakeTranscoderProcess())
                .totalSeconds(1440)
                .createdAt(clock.instant())
                .build();
    }

    private static void assertEvicted(DownloadJob job) {
        assertTrue(((FakeTranscoderProcess) job.getProcess()).isTerminated(), "process terminated");
        for (Path file : job.getFiles().all()) {
            assertFalse(Files.exists(file), file + " deleted");
        }
    }

    private static void assertKept(DownloadJob job) {
        assertFalse(((FakeTranscoderProcess) job.getProcess()).isTerminated(), "process running");
        assertTrue(Files.exists(job.getFiles().getOutput()), "output kept");
    }

    @Nested
    @DisplayName("lookups")
    class LookupTests {

        @Test
        @DisplayName("should find an added job by id and by fingerprint")
        void shouldFindAddedJob() throws IOException {
            DownloadJob job = job("a", 1);
            cache.add(job);

            assertSame(job, cache.get("a").orElseThrow());
            assertSame(job, cache.retrieve(job.getFingerprint()).orElseThrow());
        }

        @Test
        @DisplayName("should return empty for unknown keys")
        void shouldReturnEmptyForUnknownKeys() {
            assertTrue(cache.get("missing").isEmpty());
            assertTrue(cache.retrieve(new JobFingerprint(9, 9, "vf", Quality.LOW)).isEmpty());
        }

        @Test
        @DisplayName("should refresh the last access time on lookup")
        void shouldRefreshLastAccess() throws IOException {
            DownloadJob job = job("a", 1);
            cache.add(job);
            clock.advance(Duration.ofMinutes(5));

            cache.get("a");

            assertEquals(clock.instant(), job.getLastAccess());
        }

        @Test
        @DisplayName("snapshot should not change recency")
        void snapshotShouldNotChangeRecency() throws IOException {
            DownloadJob a = job("a", 1);
            DownloadJob b = job("b", 2);
            cache.add(a);
            cache.add(b);

            assertEquals(List.of(a, b), cache.snapshot());
            assertEquals(List.of(a, b), cache.snapshot());
        }
    }

    @Nested
    @DisplayName("add")
    class AddTests {

        @Test
        @DisplayName("should keep the cached job when the fingerprint is already present")
        void shouldKeepExistingJobOnFingerprintClash() throws IOException {
            DownloadJob first = job("a", 1);
            DownloadJob second = job("b", 1);

            assertSame(first, cache.add(first));
            assertSame(first, cache.add(second));

            assertEquals(1, cache.size());
            assertTrue(cache.get("b").isEmpty());
        }

        @Test
        @DisplayName("should evict the least recent job beyond the count limit")
        void shouldEvictBeyondCountLimit() throws IOException {
            DownloadJob a = job("a", 1);
            DownloadJob b = job("b", 2);
            DownloadJob c = job("c", 3);
            DownloadJob d = job("d", 4);
            cache.add(a);
            cache.add(b);
            cache.add(c);
            cache.add(d);

            assertEquals(3, cache.size());
            assertTrue(cache.get("a").isEmpty());
            assertTrue(cache.retrieve(a.getFingerprint()).isEmpty());
            assertEvicted(a);
            assertKept(b);
        }

        @Test
        @DisplayName("lookups should protect a job from count eviction")
        void lookupsShouldUpdateRecency() throws IOException {
            DownloadJob a = job("a", 1);
            DownloadJob b = job("b", 2);
            DownloadJob c = job("c", 3);
            cache.add(a);
            cache.add(b);
            cache.add(c);

            cache.retrieve(a.getFingerprint());
            cache.add(job("d", 4));

            assertTrue(cache.get("a").isPresent());
            assertTrue(cache.get("b").isEmpty());
        }

        @Test
        @DisplayName("should evict least recent jobs while artifacts exceed the size limit")
        void shouldEvictBeyondSizeLimit() throws IOException {
            DownloadJob a = job("a", 1, 300 * MIB);
            DownloadJob b = job("b", 2, 300 * MIB);
            cache.add(a);
            cache.add(b);
            assertEquals(2, cache.size());

            DownloadJob c = job("c", 3, 900 * MIB);
            cache.add(c);

            assertEquals(List.of(c), cache.snapshot());
            assertEvicted(a);
            assertEvicted(b);
            assertTrue(cache.totalSizeBytes() <= limits.getMaxSizeBytes());
        }

        @Test
        @DisplayName("should cancel the progress task of an evicted job")
        void shouldCancelProgressTaskOnEviction() throws IOException {
            limits.setMaxElements(1);
            DownloadJob a = job("a", 1);
            CompletableFuture<Void> polling = new CompletableFuture<>();
            a.attachProgressTask(polling);
            cache.add(a);

            cache.add(job("b", 2));

            assertTrue(polling.isCancelled());
            assertFalse(a.isProgressTaskActive());
        }

        @Test
        @DisplayName("concurrent adds of one fingerprint should cache a single job")
        void concurrentAddsShouldCacheSingleJob() throws Exception {
            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            Set<DownloadJob> winners = ConcurrentHashMap.newKeySet();
            try {
                for (int i = 0; i < threads; i++) {
                    DownloadJob candidate = job("job-" + i, 7);
                    executor.submit(() -> {
                        start.await();
                        winners.add(cache.add(candidate));
                        return null;
                    });
                }
                start.countDown();
            } finally {
                executor.shutdown();
                assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
            }

            assertEquals(1, winners.size());
            assertEquals(1, cache.size());
        }
    }

    @Nested
    @DisplayName("remove")
    class RemoveTests {

        @Test
        @DisplayName("should remove and clean up a cached job")
        void shouldRemoveCachedJob() throws IOException {
            DownloadJob job = job("a", 1);
            cache.add(job);

            assertTrue(cache.remove(job));

            assertEquals(0, cache.size());
            assertTrue(cache.retrieve(job.getFingerprint()).isEmpty());
            assertEvicted(job);
        }

        @Test
        @DisplayName("should clean up a job that was never cached")
        void shouldCleanUpUncachedJob() throws IOException {
            DownloadJob job = job("a", 1);

            assertFalse(cache.remove(job));

            assertEvicted(job);
        }

        @Test
        @DisplayName("should be idempotent")
        void shouldBeIdempotent() throws IOException {
            DownloadJob job = job("a", 1);
            cache.add(job);

            assertTrue(cache.remove(job));
            assertFalse(cache.remove(job));
        }

        @Test
        @DisplayName("should not remove a newer job sharing the fingerprint")
        void shouldNotRemoveNewerJob() throws IOException {
            DownloadJob old = job("old", 1);
            cache.add(old);
            cache.remove(old);
            DownloadJob fresh = job("fresh", 1);
            cache.add(fresh);

            assertFalse(cache.remove(old));

            assertSame(fresh, cache.retrieve(fresh.getFingerprint()).orElseThrow());
        }
    }

    @Nested
    @DisplayName("reclaim")
    class ReclaimTests {

        @Test
        @DisplayName("should evict jobs idle past the expiration window")
        void shouldEvictIdleJobs() throws IOException {
            limits.setExpireAfterAccess(Duration.ofHours(1));
            DownloadJob idle = job("idle", 1);
            cache.add(idle);
            clock.advance(Duration.ofMinutes(50));
            DownloadJob recent = job("recent", 2);
            cache.add(recent);

            clock.advance(Duration.ofMinutes(20));
            cache.reclaim();

            assertTrue(cache.get("idle").isEmpty());
            assertTrue(cache.get("recent").isPresent());
            assertEvicted(idle);
        }

        @Test
        @DisplayName("should keep jobs whose window has not elapsed")
        void shouldKeepFreshJobs() throws IOException {
            limits.setExpireAfterAccess(Duration.ofHours(1));
            cache.add(job("a", 1));

            clock.advance(Duration.ofMinutes(59));
            cache.reclaim();

            assertEquals(1, cache.size());
        }

        @Test
        @DisplayName("should enforce the size limit on artifacts that grew after insertion")
        void shouldEnforceSizeLimitOnGrowth() throws IOException {
            DownloadJob a = job("a", 1, 100 * MIB);
            DownloadJob b = job("b", 2, 100 * MIB);
            cache.add(a);
            cache.add(b);

            try (RandomAccessFile output = new RandomAccessFile(a.getFiles().getOutput().toFile(), "rw")) {
                output.setLength(1000 * MIB);
            }
            cache.reclaim();

            assertEquals(List.of(b), cache.snapshot());
        }

        @Test
        @DisplayName("should sleep for the fallback interval when empty")
        void shouldSleepFallbackIntervalWhenEmpty() {
            assertEquals(Duration.ofSeconds(10), cache.reclaim());
        }

        @Test
        @DisplayName("should wake up right after the soonest expiration")
        void shouldWakeAtSoonestExpiration() throws IOException {
            limits.setExpireAfterAccess(Duration.ofSeconds(4));
            cache.add(job("a", 1));
            clock.advance(Duration.ofSeconds(1));
            cache.add(job("b", 2));

            Duration wait = cache.reclaim();

            assertEquals(Duration.ofSeconds(3).plusMillis(1), wait);
        }

        @Test
        @DisplayName("should wait for the least recent job after the clock stepped back")
        void shouldWaitForLeastRecentJobAfterClockStep() throws IOException {
            limits.setExpireAfterAccess(Duration.ofSeconds(60));
            limits.setReclaimInterval(Duration.ofMinutes(5));
            DownloadJob eldest = job("a", 1);
            cache.add(eldest);
            clock.advance(Duration.ofSeconds(-30));
            DownloadJob newest = job("b", 2);
            cache.add(newest);
            // newest expired at +30s, eldest only expires at +60s
            clock.advance(Duration.ofSeconds(75));

            Duration wait = cache.reclaim();

            assertEquals(Duration.ofSeconds(15).plusMillis(1), wait);
            assertEquals(2, cache.size());
            assertKept(eldest);
            assertKept(newest);
        }

        @Test
        @DisplayName("should cap the sleep at the reclaim interval")
        void shouldCapSleepAtInterval() throws IOException {
            cache.add(job("a", 1));

            assertEquals(Duration.ofSeconds(10), cache.reclaim());
        }
    }

    @Nested
    @DisplayName("runReclaimer")
    class RunReclaimerTests {

        @Test
        @DisplayName("should evict an idle job without any request traffic")
        void shouldEvictWithoutTraffic() throws Exception {
            limits.setExpireAfterAccess(Duration.ofMillis(100));
            limits.setReclaimInterval(Duration.ofMillis(50));
            JobCache realTimeCache = new JobCache(workspace, limits, Clock.systemUTC());
            DownloadJob job = DownloadJob.builder()
                    .id("idle")
                    .fingerprint(new JobFingerprint(1, 1, "vostfr", Quality.HIGH))
                    .files(workspace.filesFor("idle"))
                    .process(new FakeTranscoderProcess())
                    .build();
            realTimeCache.add(job);

            Thread reclaimer = new Thread(realTimeCache::runReclaimer, "test-reclaimer");
            reclaimer.start();
            try {
                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
                while (realTimeCache.size() > 0 && System.nanoTime() < deadline) {
                    Thread.sleep(20);
                }
                assertEquals(0, realTimeCache.size());
                assertTrue(((FakeTranscoderProcess) job.getProcess()).isTerminated());
            } finally {
                reclaimer.interrupt();
                reclaimer.join(5000);
            }
            assertFalse(reclaimer.isAlive());
        }
    }

    @Nested
    @DisplayName("clear")
    class ClearTests {

        @Test
        @DisplayName("should evict every job")
        void shouldEvictEverything() throws IOException {
            DownloadJob a = job("a", 1);
            DownloadJob b = job("b", 2);
            cache.add(a);
            cache.add(b);

            cache.clear();

            assertEquals(0, cache.size());
            assertEvicted(a);
            assertEvicted(b);
        }
    }
}
