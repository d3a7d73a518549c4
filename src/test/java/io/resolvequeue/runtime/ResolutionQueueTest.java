package io.resolvequeue.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.resolvequeue.config.QueueConfig;
import io.resolvequeue.config.QueueSettings;
import io.resolvequeue.model.JobState;
import io.resolvequeue.model.ListJobsOptions;
import io.resolvequeue.model.NewResolutionJob;
import io.resolvequeue.model.ResolutionJob;
import io.resolvequeue.retry.BackoffFunction;
import io.resolvequeue.storage.JobStore;
import io.resolvequeue.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class ResolutionQueueTest {
    private static final long START = 1_700_000_000_000L;

    @Test
    void claimAndCompleteLifecycle() throws Exception {
        Path root = Files.createTempDirectory("resolvequeue-test-queue-lifecycle-");
        try {
            MutableClock clock = new MutableClock(START);
            ResolutionQueue queue = newQueue(root, settings(3, 3, 30_000L), clock);

            List<ResolutionJob> submitted = queue.submit(NewResolutionJob.queued(41L), NewResolutionJob.queued(42L));
            Assertions.assertEquals(2, submitted.size());
            Assertions.assertTrue(submitted.get(0).id() < submitted.get(1).id());
            Assertions.assertEquals(START, submitted.get(0).createdAtMs());

            clock.advance(Duration.ofMillis(5));
            ResolutionJob claimed = queue.claim("worker-a").orElseThrow();
            Assertions.assertEquals(41L, claimed.batchSpecId());
            Assertions.assertEquals(START + 5L, claimed.startedAtMs());

            clock.advance(Duration.ofSeconds(1));
            Assertions.assertTrue(queue.heartbeat(claimed.id(), "worker-a"));
            Assertions.assertFalse(queue.heartbeat(claimed.id(), "worker-b"));

            JobStore.ReportResult done = queue.reportSuccess(claimed.id(), "worker-a");
            Assertions.assertEquals(JobStore.ReportOutcome.COMPLETED, done.outcome());
            Assertions.assertEquals(JobState.COMPLETED, queue.get(claimed.id()).orElseThrow().state());
            Assertions.assertEquals(claimed.id(), queue.getByBatchSpec(41L).orElseThrow().id());

            ResolutionQueue.StatsOutcome stats = queue.stats();
            Assertions.assertEquals(2, stats.total());
            Assertions.assertEquals(1, stats.byState().get("queued"));
            Assertions.assertEquals(1, stats.byState().get("completed"));
            Assertions.assertEquals(0, stats.byState().get("errored"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedJobWaitsOutBackoffThenErrorsAtLimit() throws Exception {
        Path root = Files.createTempDirectory("resolvequeue-test-queue-backoff-");
        try {
            MutableClock clock = new MutableClock(START);
            ResolutionQueue queue = newQueue(root, settings(2, 3, 30_000L), clock);
            long id = queue.submit(NewResolutionJob.queued(1L)).get(0).id();

            queue.claim("worker-a").orElseThrow();
            JobStore.ReportResult first = queue.reportFailure(id, "worker-a", "code host unreachable");
            Assertions.assertEquals(JobStore.ReportOutcome.RETRY_SCHEDULED, first.outcome());
            Assertions.assertEquals(START + 1_000L, first.processAfterMs());

            clock.advance(Duration.ofMillis(999));
            Assertions.assertTrue(queue.claim("worker-b").isEmpty());
            clock.advance(Duration.ofMillis(1));
            Assertions.assertEquals(id, queue.claim("worker-b").orElseThrow().id());

            JobStore.ReportResult second = queue.reportFailure(id, "worker-b", "still unreachable");
            Assertions.assertEquals(JobStore.ReportOutcome.ERRORED, second.outcome());
            ResolutionJob errored = queue.get(id).orElseThrow();
            Assertions.assertEquals(JobState.ERRORED, errored.state());
            Assertions.assertEquals("still unreachable", errored.failureMessage());
            Assertions.assertEquals(2, errored.executionLogs().size());

            clock.advance(Duration.ofHours(1));
            Assertions.assertTrue(queue.claim("worker-c").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reclaimStaleUsesHeartbeatTimeout() throws Exception {
        Path root = Files.createTempDirectory("resolvequeue-test-queue-reclaim-");
        try {
            MutableClock clock = new MutableClock(START);
            ResolutionQueue queue = newQueue(root, settings(3, 3, 10_000L), clock);
            queue.submit(NewResolutionJob.queued(1L), NewResolutionJob.queued(2L));
            ResolutionJob dead = queue.claim("worker-dead").orElseThrow();
            ResolutionJob alive = queue.claim("worker-alive").orElseThrow();

            clock.advance(Duration.ofMillis(9_000));
            Assertions.assertTrue(queue.heartbeat(alive.id(), "worker-alive"));
            Assertions.assertEquals(0, queue.reclaimStale().total());

            clock.advance(Duration.ofMillis(1_000));
            Assertions.assertEquals(0, queue.reclaimStale().total(), "a heartbeat exactly at the cutoff is still live");

            clock.advance(Duration.ofMillis(1));
            JobStore.ReclaimSummary summary = queue.reclaimStale();
            Assertions.assertEquals(List.of(dead.id()), summary.requeuedIds());

            List<ResolutionJob> processing = queue.list(ListJobsOptions.inState(JobState.PROCESSING));
            Assertions.assertEquals(List.of(alive.id()), processing.stream().map(ResolutionJob::id).toList());
            Assertions.assertEquals(dead.id(), queue.claim("worker-new").orElseThrow().id());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void permanentFailureAndDelayedRequeue() throws Exception {
        Path root = Files.createTempDirectory("resolvequeue-test-queue-permanent-");
        try {
            MutableClock clock = new MutableClock(START);
            ResolutionQueue queue = newQueue(root, settings(3, 3, 30_000L), clock);
            long first = queue.submit(NewResolutionJob.queued(1L)).get(0).id();
            long second = queue.submit(NewResolutionJob.queued(2L)).get(0).id();

            queue.claim("worker-a").orElseThrow();
            Assertions.assertEquals(JobStore.ReportOutcome.FAILED,
                    queue.reportPermanentFailure(first, "worker-a", "batch spec deleted").outcome());

            queue.claim("worker-a").orElseThrow();
            JobStore.ReportResult requeued = queue.requeue(second, "worker-a", Duration.ofSeconds(30));
            Assertions.assertEquals(JobStore.ReportOutcome.REQUEUED, requeued.outcome());
            Assertions.assertEquals(START + 30_000L, requeued.processAfterMs());
            Assertions.assertTrue(queue.claim("worker-a").isEmpty());
            clock.advance(Duration.ofSeconds(30));
            Assertions.assertEquals(second, queue.claim("worker-b").orElseThrow().id());
            Assertions.assertEquals(JobState.FAILED, queue.get(first).orElseThrow().state());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void lifecycleEventsAreAudited() throws Exception {
        Path root = Files.createTempDirectory("resolvequeue-test-queue-audit-");
        try {
            MutableClock clock = new MutableClock(START);
            ResolutionQueue queue = newQueue(root, settings(3, 3, 30_000L), clock);
            long id = queue.submit(NewResolutionJob.queued(9L)).get(0).id();
            queue.claim("worker-a").orElseThrow();
            queue.reportSuccess(id, "worker-a", "done");

            List<JsonNode> rows = new ArrayList<>();
            for (String line : Files.readAllLines(queue.config().auditFile(), StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    rows.add(Jsons.mapper().readTree(line));
                }
            }
            List<String> actions = rows.stream().map(r -> r.path("action").asText()).toList();
            Assertions.assertEquals(List.of("queue.init", "job.submit", "job.claim", "job.complete"), actions);
            JsonNode complete = rows.get(3);
            Assertions.assertEquals("worker-a", complete.path("actor").asText());
            Assertions.assertEquals(id, complete.path("job_id").asLong());
            Assertions.assertEquals("completed", complete.path("result").asText());
            Assertions.assertEquals("default", complete.path("namespace").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void auditWriteFailureDoesNotHideCommittedChanges() throws Exception {
        Path root = Files.createTempDirectory("resolvequeue-test-queue-audit-broken-");
        try {
            MutableClock clock = new MutableClock(START);
            ResolutionQueue queue = newQueue(root, settings(3, 3, 30_000L), clock);
            Path auditFile = queue.config().auditFile();
            Files.delete(auditFile);
            Files.createDirectories(auditFile);

            long id = queue.submit(NewResolutionJob.queued(5L)).get(0).id();
            ResolutionJob claimed = queue.claim("worker-a").orElseThrow();
            Assertions.assertEquals(id, claimed.id());
            Assertions.assertEquals(JobStore.ReportOutcome.COMPLETED, queue.reportSuccess(id, "worker-a").outcome());
            Assertions.assertEquals(JobState.COMPLETED, queue.get(id).orElseThrow().state());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void settingsFileIsLoadedAndReloaded() throws Exception {
        Path root = Files.createTempDirectory("resolvequeue-test-queue-settings-");
        try {
            QueueConfig config = QueueConfig.fromRoot(root.toString(), "ops");
            Files.createDirectories(config.rootDir());
            Files.writeString(config.settingsFile(), "{\"maxFailures\":7}", StandardCharsets.UTF_8);

            ResolutionQueue queue = new ResolutionQueue(config, new MutableClock(START));
            queue.init();
            Assertions.assertEquals(7, queue.settings().maxFailures());
            Assertions.assertEquals(7, queue.retryPolicy().maxFailures());

            Files.writeString(config.settingsFile(), "{\"maxFailures\":2,\"backoffFunction\":\"constant\"}",
                    StandardCharsets.UTF_8);
            ResolutionQueue.SettingsReloadOutcome reload = queue.reloadSettings();
            Assertions.assertTrue(reload.changed());
            Assertions.assertTrue(reload.fileExists());
            Assertions.assertEquals(List.of("maxFailures", "backoffFunction"), reload.changedFields());
            Assertions.assertEquals(BackoffFunction.CONSTANT, queue.retryPolicy().backoffFunction());

            Assertions.assertFalse(queue.reloadSettings().changed());
        } finally {
            deleteRecursively(root);
        }
    }

    static QueueSettings settings(int maxFailures, int maxResets, long heartbeatTimeoutMs) {
        return new QueueSettings(
                maxResets,
                maxFailures,
                heartbeatTimeoutMs,
                BackoffFunction.EXPONENTIAL,
                1_000L,
                60_000L,
                1_000L,
                5_000L,
                30_000L
        );
    }

    private static ResolutionQueue newQueue(Path root, QueueSettings settings, MutableClock clock) {
        ResolutionQueue queue = new ResolutionQueue(QueueConfig.fromRoot(root.toString()), settings, clock);
        queue.init();
        return queue;
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
