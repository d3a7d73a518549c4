package io.resolvequeue.monitor;

import io.resolvequeue.runtime.ResolutionQueue;
import io.resolvequeue.storage.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically returns jobs abandoned by dead or stuck workers to the queue. Runs
 * independently of any worker; several reclaimers may sweep the same table.
 */
public final class StalledJobReclaimer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StalledJobReclaimer.class);

    private final ResolutionQueue queue;
    private final Duration interval;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong sweeps = new AtomicLong();
    private final AtomicLong failedSweeps = new AtomicLong();
    private final AtomicLong requeuedTotal = new AtomicLong();
    private final AtomicLong erroredTotal = new AtomicLong();
    private ScheduledExecutorService scheduler;

    public StalledJobReclaimer(ResolutionQueue queue) {
        this(queue, Duration.ofMillis(queue.settings().reclaimIntervalMs()));
    }

    public StalledJobReclaimer(ResolutionQueue queue, Duration interval) {
        this.queue = Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("reclaim interval must be a positive duration");
        }
        this.interval = interval;
    }

    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Reclaimer starting namespace={} interval={} heartbeatTimeoutMs={} maxResets={}",
                queue.config().namespace(),
                interval,
                queue.settings().heartbeatTimeoutMs(),
                queue.settings().maxResets());
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("resolvequeue.reclaimer");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::sweepQuietly, 0L, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Runs one sweep on the calling thread. Store failures propagate. */
    public JobStore.ReclaimSummary runOnce() {
        JobStore.ReclaimSummary summary = queue.reclaimStale();
        sweeps.incrementAndGet();
        requeuedTotal.addAndGet(summary.requeued());
        erroredTotal.addAndGet(summary.errored());
        if (summary.total() > 0) {
            log.info("Reclaimed stalled jobs requeued={} errored={} requeuedIds={} erroredIds={}",
                    summary.requeued(), summary.errored(), summary.requeuedIds(), summary.erroredIds());
        } else {
            log.debug("Reclaim sweep found no stalled jobs");
        }
        return summary;
    }

    public boolean running() {
        return started.get();
    }

    public Stats stats() {
        return new Stats(sweeps.get(), failedSweeps.get(), requeuedTotal.get(), erroredTotal.get());
    }

    @Override
    public synchronized void close() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Reclaimer stopping...");
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(interval.toMillis() + 1_000L, TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        } finally {
            scheduler = null;
        }
        log.info("Reclaimer stopped sweeps={} requeued={} errored={}",
                sweeps.get(), requeuedTotal.get(), erroredTotal.get());
    }

    // An exception escaping a scheduled task cancels every later run.
    private void sweepQuietly() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            failedSweeps.incrementAndGet();
            log.error("reclaim sweep failed msg={}", e.getMessage(), e);
        }
    }

    public record Stats(long sweeps, long failedSweeps, long requeued, long errored) {
    }
}
