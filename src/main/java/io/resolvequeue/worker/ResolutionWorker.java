package io.resolvequeue.worker;

import io.resolvequeue.model.ResolutionJob;
import io.resolvequeue.runtime.ResolutionQueue;
import io.resolvequeue.storage.JobStore;
import io.resolvequeue.storage.JobStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Claim, heartbeat while the handler runs, report. One job at a time; run several workers
 * (threads or processes) for parallelism.
 */
public final class ResolutionWorker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResolutionWorker.class);
    private static final long MIN_HEARTBEAT_INTERVAL_MS = 50L;

    private final ResolutionQueue queue;
    private final String workerId;
    private final JobHandler handler;
    private final Duration pollInterval;
    private final Duration heartbeatInterval;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ScheduledExecutorService heartbeats;

    public ResolutionWorker(ResolutionQueue queue, String workerId, JobHandler handler) {
        this(
                queue,
                workerId,
                handler,
                Duration.ofSeconds(1),
                Duration.ofMillis(Math.max(MIN_HEARTBEAT_INTERVAL_MS, queue.settings().heartbeatTimeoutMs() / 3L))
        );
    }

    public ResolutionWorker(ResolutionQueue queue, String workerId, JobHandler handler,
                            Duration pollInterval, Duration heartbeatInterval) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.handler = Objects.requireNonNull(handler, "handler");
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("worker id must not be blank");
        }
        this.workerId = workerId.trim();
        this.pollInterval = pollInterval == null || pollInterval.isNegative() ? Duration.ofSeconds(1) : pollInterval;
        long beatMs = heartbeatInterval == null ? 0L : heartbeatInterval.toMillis();
        this.heartbeatInterval = Duration.ofMillis(Math.max(MIN_HEARTBEAT_INTERVAL_MS, beatMs));
        this.heartbeats = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("resolvequeue.heartbeat." + this.workerId);
            t.setDaemon(true);
            return t;
        });
    }

    /** Host name plus process id, unique enough to tell workers apart in job rows. */
    public static String defaultWorkerId() {
        String host = "localhost";
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (Exception ignored) {
            // Fall back to a fixed host name; the pid still separates local workers.
        }
        return host + "-" + ProcessHandle.current().pid();
    }

    public String workerId() {
        return workerId;
    }

    /**
     * Claims and processes at most one job.
     */
    public WorkerOutcome runOnce() {
        Optional<ResolutionJob> claimed = queue.claim(workerId);
        if (claimed.isEmpty()) {
            return WorkerOutcome.idle();
        }
        ResolutionJob job = claimed.get();
        log.debug("Worker claimed job worker={} id={} batchSpecId={}", workerId, job.id(), job.batchSpecId());

        AtomicBoolean leaseLost = new AtomicBoolean(false);
        long beatMs = heartbeatInterval.toMillis();
        ScheduledFuture<?> beat = heartbeats.scheduleAtFixedRate(
                () -> sendHeartbeat(job.id(), leaseLost), beatMs, beatMs, TimeUnit.MILLISECONDS);
        JobResult result;
        try {
            result = handler.handle(job);
            if (result == null) {
                result = JobResult.fail("handler returned no result");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = JobResult.fail("handler interrupted");
        } catch (Exception e) {
            log.warn("job handler threw worker={} id={} msg={}", workerId, job.id(), e.getMessage(), e);
            result = JobResult.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            beat.cancel(false);
        }

        JobStore.ReportResult report = switch (result.kind()) {
            case SUCCESS -> queue.reportSuccess(job.id(), workerId, result.output());
            case RETRYABLE_FAILURE -> queue.reportFailure(job.id(), workerId, result.error());
            case PERMANENT_FAILURE -> queue.reportPermanentFailure(job.id(), workerId, result.error());
        };
        if (!report.applied()) {
            log.warn("Worker lost job before reporting worker={} id={} currentState={} leaseLost={}",
                    workerId, job.id(), report.state(), leaseLost.get());
        } else {
            log.info("Worker reported job worker={} id={} outcome={} numFailures={}",
                    workerId, job.id(), report.outcome(), report.numFailures());
        }
        return new WorkerOutcome(true, job.id(), report.outcome(), result.success() ? result.output() : result.error());
    }

    /**
     * Processes jobs until none is eligible or {@code maxJobs} have been handled.
     */
    public int drain(int maxJobs) {
        int processed = 0;
        int limit = Math.max(1, maxJobs);
        while (processed < limit) {
            if (!runOnce().processed()) {
                break;
            }
            processed++;
        }
        return processed;
    }

    /**
     * Polls until {@link #stop()} is called or the thread is interrupted. Failed iterations
     * are logged and the loop keeps polling.
     */
    public void runLoop() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("worker already running: " + workerId);
        }
        log.info("Worker starting worker={} namespace={} pollInterval={} heartbeatInterval={}",
                workerId, queue.config().namespace(), pollInterval, heartbeatInterval);
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                boolean processed;
                try {
                    processed = runOnce().processed();
                } catch (JobStoreException e) {
                    log.error("worker poll failed worker={} msg={}", workerId, e.getMessage(), e);
                    processed = false;
                } catch (RuntimeException e) {
                    log.error("worker iteration failed worker={} msg={}", workerId, e.getMessage(), e);
                    processed = false;
                }
                if (!processed && !pause()) {
                    break;
                }
            }
        } finally {
            running.set(false);
            log.info("Worker stopped worker={}", workerId);
        }
    }

    public void stop() {
        running.set(false);
    }

    public boolean running() {
        return running.get();
    }

    @Override
    public void close() {
        stop();
        heartbeats.shutdownNow();
    }

    private void sendHeartbeat(long jobId, AtomicBoolean leaseLost) {
        try {
            if (!queue.heartbeat(jobId, workerId) && leaseLost.compareAndSet(false, true)) {
                log.warn("Heartbeat rejected, job no longer owned worker={} id={}", workerId, jobId);
            }
        } catch (RuntimeException e) {
            log.warn("heartbeat failed worker={} id={} msg={}", workerId, jobId, e.getMessage());
        }
    }

    private boolean pause() {
        try {
            Thread.sleep(pollInterval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public record WorkerOutcome(boolean processed, Long jobId, JobStore.ReportOutcome outcome, String message) {
        public static WorkerOutcome idle() {
            return new WorkerOutcome(false, null, null, "no eligible job");
        }
    }
}
