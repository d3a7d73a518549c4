package io.resolvequeue.storage;

import io.resolvequeue.config.QueueConfig;
import io.resolvequeue.model.AttemptOutcome;
import io.resolvequeue.model.GetJobOptions;
import io.resolvequeue.model.JobState;
import io.resolvequeue.model.NewResolutionJob;
import io.resolvequeue.model.ResolutionJob;
import io.resolvequeue.retry.BackoffFunction;
import io.resolvequeue.retry.RetryPolicy;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class JobStoreReclaimTest {
    private static final long NOW = 1_000_000L;
    private static final long TIMEOUT = 30_000L;

    @Test
    void stalledJobReturnsToQueueWithResetCounted() throws Exception {
        Path root = Files.createTempDirectory("resolvequeue-test-reclaim-basic-");
        try {
            JobStore store = newStore(root);
            RetryPolicy policy = new RetryPolicy(3, 3, BackoffFunction.EXPONENTIAL, 1_000L, 60_000L);
            long id = store.create(List.of(NewResolutionJob.queued(1L)), NOW).get(0).id();
            store.dequeue("worker-dead", NOW, 0).orElseThrow();

            long later = NOW + TIMEOUT - 1L;
            JobStore.ReclaimSummary early = store.resetStalled(later, later - TIMEOUT, policy);
            Assertions.assertEquals(0, early.total());

            long now = NOW + TIMEOUT + 1L;
            JobStore.ReclaimSummary summary = store.resetStalled(now, now - TIMEOUT, policy);
            Assertions.assertEquals(List.of(id), summary.requeuedIds());
            Assertions.assertEquals(0, summary.errored());

            ResolutionJob job = store.get(GetJobOptions.byId(id)).orElseThrow();
            Assertions.assertEquals(JobState.QUEUED, job.state());
            Assertions.assertEquals(1, job.numResets());
            Assertions.assertEquals(0, job.numFailures());
            Assertions.assertEquals("", job.workerHostname());
            Assertions.assertNull(job.processAfterMs());
            Assertions.assertEquals(1, job.executionLogs().size());
            Assertions.assertEquals(AttemptOutcome.RESET, job.executionLogs().get(0).outcome());
            Assertions.assertEquals("worker-dead", job.executionLogs().get(0).workerHostname());

            JobStore.ReclaimSummary second = store.resetStalled(now, now - TIMEOUT, policy);
            Assertions.assertEquals(0, second.total());
            Assertions.assertEquals(1, store.get(GetJobOptions.byId(id)).orElseThrow().numResets());

            ResolutionJob again = store.dequeue("worker-alive", now, 0).orElseThrow();
            Assertions.assertEquals(id, again.id());
            // The dead worker can no longer report for the job.
            Assertions.assertEquals(JobStore.ReportOutcome.STALE,
                    store.markComplete(id, "worker-dead", null, now + 1L).outcome());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void heartbeatKeepsJobOwned() throws Exception {
        Path root = Files.createTempDirectory("resolvequeue-test-reclaim-heartbeat-");
        try {
            JobStore store = newStore(root);
            RetryPolicy policy = new RetryPolicy(3, 3, BackoffFunction.EXPONENTIAL, 1_000L, 60_000L);
            long id = store.create(List.of(NewResolutionJob.queued(1L)), NOW).get(0).id();
            store.dequeue("worker-a", NOW, 0).orElseThrow();
            Assertions.assertTrue(store.heartbeat(id, "worker-a", NOW + TIMEOUT));

            long now = NOW + TIMEOUT + 10L;
            Assertions.assertEquals(0, store.resetStalled(now, now - TIMEOUT, policy).total());
            Assertions.assertEquals(JobState.PROCESSING, store.get(GetJobOptions.byId(id)).orElseThrow().state());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void exhaustedResetsErrorTheJob() throws Exception {
        Path root = Files.createTempDirectory("resolvequeue-test-reclaim-exhausted-");
        try {
            JobStore store = newStore(root);
            RetryPolicy policy = new RetryPolicy(3, 1, BackoffFunction.EXPONENTIAL, 1_000L, 60_000L);
            long id = store.create(List.of(NewResolutionJob.queued(1L)), NOW).get(0).id();

            long t = NOW;
            store.dequeue("worker-a", t, 0).orElseThrow();
            t += TIMEOUT + 1L;
            Assertions.assertEquals(1, store.resetStalled(t, t - TIMEOUT, policy).requeued());

            store.dequeue("worker-b", t, 0).orElseThrow();
            t += TIMEOUT + 1L;
            JobStore.ReclaimSummary summary = store.resetStalled(t, t - TIMEOUT, policy);
            Assertions.assertEquals(List.of(id), summary.erroredIds());
            Assertions.assertEquals(0, summary.requeued());

            ResolutionJob job = store.get(GetJobOptions.byId(id)).orElseThrow();
            Assertions.assertEquals(JobState.ERRORED, job.state());
            Assertions.assertEquals(2, job.numResets());
            Assertions.assertEquals(t, job.finishedAtMs());
            Assertions.assertTrue(job.failureMessage().contains("num_resets=2"));
            Assertions.assertEquals(AttemptOutcome.ERRORED, job.executionLogs().get(1).outcome());
            Assertions.assertTrue(store.dequeue("worker-c", t, 0).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentSweepsReclaimEachJobOnce() throws Exception {
        Path root = Files.createTempDirectory("resolvequeue-test-reclaim-concurrent-");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            Database db = new Database(QueueConfig.fromRoot(root.toString()), 30_000L);
            db.init();
            JobStore store = new JobStore(db);
            RetryPolicy policy = new RetryPolicy(3, 3, BackoffFunction.EXPONENTIAL, 1_000L, 60_000L);
            List<NewResolutionJob> jobs = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                jobs.add(NewResolutionJob.queued(i));
            }
            store.create(jobs, NOW);
            for (int i = 0; i < 20; i++) {
                store.dequeue("worker-" + (i % 3), NOW, 0).orElseThrow();
            }

            long now = NOW + TIMEOUT + 1L;
            CountDownLatch start = new CountDownLatch(1);
            List<Future<JobStore.ReclaimSummary>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return store.resetStalled(now, now - TIMEOUT, policy);
                }));
            }
            start.countDown();
            int requeued = 0;
            for (Future<JobStore.ReclaimSummary> f : futures) {
                requeued += f.get(60, TimeUnit.SECONDS).requeued();
            }
            Assertions.assertEquals(20, requeued);
            for (ResolutionJob job : store.list(null)) {
                Assertions.assertEquals(JobState.QUEUED, job.state());
                Assertions.assertEquals(1, job.numResets());
                Assertions.assertEquals(1, job.executionLogs().size());
            }
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    private static JobStore newStore(Path root) {
        Database db = new Database(QueueConfig.fromRoot(root.toString()));
        db.init();
        return new JobStore(db);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
