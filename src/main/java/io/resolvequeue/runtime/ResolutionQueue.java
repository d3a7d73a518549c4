package io.resolvequeue.runtime;

import io.resolvequeue.config.QueueConfig;
import io.resolvequeue.config.QueueSettings;
import io.resolvequeue.model.GetJobOptions;
import io.resolvequeue.model.JobState;
import io.resolvequeue.model.ListJobsOptions;
import io.resolvequeue.model.NewResolutionJob;
import io.resolvequeue.model.ResolutionJob;
import io.resolvequeue.observability.AuditLogger;
import io.resolvequeue.retry.RetryPolicy;
import io.resolvequeue.storage.Database;
import io.resolvequeue.storage.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Submission, worker and operator entry points over one namespace of the job table.
 * Reads the clock once per operation and hands the instant down to the store.
 */
public final class ResolutionQueue {
    private final QueueConfig config;
    private final Clock clock;
    private final Database database;
    private final JobStore jobStore;
    private static final Logger LOG = LoggerFactory.getLogger(ResolutionQueue.class);

    private final AuditLogger auditLogger;
    private volatile QueueSettings settings;
    private volatile RetryPolicy retryPolicy;

    public ResolutionQueue(QueueConfig config) {
        this(config, Clock.systemUTC());
    }

    public ResolutionQueue(QueueConfig config, Clock clock) {
        this(config, QueueSettings.load(config.settingsFile()), clock);
    }

    public ResolutionQueue(QueueConfig config, QueueSettings settings, Clock clock) {
        this.config = config;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.settings = settings == null ? QueueSettings.defaults() : settings;
        this.retryPolicy = RetryPolicy.from(this.settings);
        this.database = new Database(config, this.settings.busyTimeoutMs());
        this.jobStore = new JobStore(database);
        this.auditLogger = new AuditLogger(config.auditFile(), config.namespace(), this.clock);
    }

    public void init() {
        database.init();
        auditLogger.log(AuditLogger.AuditEvent.of(
                "queue.init",
                "system",
                "namespace/" + config.namespace(),
                "ok",
                null,
                Map.of("db", config.dbFile().toString())
        ));
    }

    public QueueConfig config() {
        return config;
    }

    public QueueSettings settings() {
        return settings;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public Clock clock() {
        return clock;
    }

    /**
     * Re-reads the settings file. The busy timeout is fixed for the lifetime of this queue;
     * every other knob takes effect on the next operation.
     */
    public SettingsReloadOutcome reloadSettings() {
        QueueSettings previous = settings;
        QueueSettings loaded = QueueSettings.load(config.settingsFile());
        List<String> changed = previous.diff(loaded);
        settings = loaded;
        retryPolicy = RetryPolicy.from(loaded);
        if (!changed.isEmpty()) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "queue.settings.load",
                    "system",
                    "namespace/" + config.namespace(),
                    "reloaded",
                    null,
                    Map.of("config", config.settingsFile().toString(), "changed_fields", changed)
            ));
        }
        return new SettingsReloadOutcome(!changed.isEmpty(), Files.exists(config.settingsFile()), changed, loaded);
    }

    public List<ResolutionJob> submit(NewResolutionJob... jobs) {
        return submit(jobs == null ? List.of() : Arrays.asList(jobs));
    }

    public List<ResolutionJob> submit(List<NewResolutionJob> jobs) {
        List<ResolutionJob> created = jobStore.create(jobs, nowMs());
        if (!created.isEmpty()) {
            auditCommitted(AuditLogger.AuditEvent.of(
                    "job.submit",
                    "submitter",
                    "namespace/" + config.namespace(),
                    "ok",
                    created.size() == 1 ? created.get(0).id() : null,
                    Map.of("ids", created.stream().map(ResolutionJob::id).toList())
            ));
        }
        return created;
    }

    public Optional<ResolutionJob> claim(String workerId) {
        return claimWithin(workerId, settings.claimTimeoutSeconds());
    }

    public Optional<ResolutionJob> claim(String workerId, Duration timeout) {
        int timeoutSeconds = timeout == null || timeout.isZero() || timeout.isNegative()
                ? 0
                : QueueSettings.toTimeoutSeconds(timeout.toMillis());
        return claimWithin(workerId, timeoutSeconds);
    }

    private Optional<ResolutionJob> claimWithin(String workerId, int timeoutSeconds) {
        Optional<ResolutionJob> claimed = jobStore.dequeue(workerId, nowMs(), timeoutSeconds);
        claimed.ifPresent(job -> auditCommitted(AuditLogger.AuditEvent.of(
                "job.claim",
                workerId,
                "job/" + job.id(),
                "processing",
                job.id(),
                Map.of("batch_spec_id", job.batchSpecId(), "attempt", job.executionLogs().size() + 1)
        )));
        return claimed;
    }

    public boolean heartbeat(long jobId) {
        return heartbeat(jobId, null);
    }

    public boolean heartbeat(long jobId, String workerId) {
        return jobStore.heartbeat(jobId, workerId, nowMs());
    }

    public boolean heartbeat(long jobId, String workerId, String progress) {
        return jobStore.heartbeat(jobId, workerId, progress, nowMs());
    }

    public JobStore.ReportResult reportSuccess(long jobId) {
        return reportSuccess(jobId, null, null);
    }

    public JobStore.ReportResult reportSuccess(long jobId, String workerId) {
        return reportSuccess(jobId, workerId, null);
    }

    public JobStore.ReportResult reportSuccess(long jobId, String workerId, String detail) {
        JobStore.ReportResult result = jobStore.markComplete(jobId, workerId, detail, nowMs());
        audit("job.complete", workerId, jobId, result, null);
        return result;
    }

    public JobStore.ReportResult reportFailure(long jobId, String message) {
        return reportFailure(jobId, null, message);
    }

    public JobStore.ReportResult reportFailure(long jobId, String workerId, String message) {
        JobStore.ReportResult result = jobStore.markFailure(jobId, workerId, message, true, nowMs(), retryPolicy);
        audit("job.fail", workerId, jobId, result, message);
        return result;
    }

    /** Fails the job without retry. */
    public JobStore.ReportResult reportPermanentFailure(long jobId, String workerId, String message) {
        JobStore.ReportResult result = jobStore.markFailure(jobId, workerId, message, false, nowMs(), retryPolicy);
        audit("job.fail", workerId, jobId, result, message);
        return result;
    }

    public JobStore.ReportResult requeue(long jobId, String workerId, Duration delay) {
        long nowMs = nowMs();
        long processAfterMs = delay == null || delay.isNegative() ? nowMs : nowMs + delay.toMillis();
        JobStore.ReportResult result = jobStore.requeue(jobId, workerId, processAfterMs, nowMs, retryPolicy);
        audit("job.requeue", workerId, jobId, result, null);
        return result;
    }

    public Optional<ResolutionJob> get(long jobId) {
        return jobStore.get(GetJobOptions.byId(jobId));
    }

    public Optional<ResolutionJob> getByBatchSpec(long batchSpecId) {
        return jobStore.get(GetJobOptions.byBatchSpec(batchSpecId));
    }

    public Optional<ResolutionJob> get(GetJobOptions options) {
        return jobStore.get(options);
    }

    public List<ResolutionJob> list(ListJobsOptions options) {
        return jobStore.list(options);
    }

    /** Resets processing jobs whose last heartbeat is older than the heartbeat timeout. */
    public JobStore.ReclaimSummary reclaimStale() {
        long nowMs = nowMs();
        long cutoffMs = nowMs - settings.heartbeatTimeoutMs();
        JobStore.ReclaimSummary summary = jobStore.resetStalled(nowMs, cutoffMs, retryPolicy);
        if (summary.total() > 0) {
            auditCommitted(AuditLogger.AuditEvent.of(
                    "job.reclaim",
                    "monitor",
                    "namespace/" + config.namespace(),
                    "ok",
                    null,
                    Map.of(
                            "cutoff_ms", cutoffMs,
                            "requeued_ids", summary.requeuedIds(),
                            "errored_ids", summary.erroredIds()
                    )
            ));
        }
        return summary;
    }

    public StatsOutcome stats() {
        Map<JobState, Integer> counts = jobStore.countByState();
        Map<String, Integer> byState = new LinkedHashMap<>();
        int total = 0;
        for (Map.Entry<JobState, Integer> e : counts.entrySet()) {
            byState.put(e.getKey().dbValue(), e.getValue());
            total += e.getValue();
        }
        return new StatsOutcome(config.namespace(), total, byState, settings);
    }

    public List<Database.SchemaMigrationRow> schemaMigrations(int limit) {
        return database.listSchemaMigrations(limit);
    }

    private void audit(String action, String workerId, long jobId, JobStore.ReportResult result, String message) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("num_failures", result.numFailures());
        details.put("num_resets", result.numResets());
        if (result.processAfterMs() != null) {
            details.put("process_after_ms", result.processAfterMs());
        }
        if (message != null && !message.isBlank()) {
            details.put("message", message);
        }
        auditCommitted(AuditLogger.AuditEvent.of(
                action,
                workerId,
                "job/" + jobId,
                result.outcome().name().toLowerCase(),
                jobId,
                details
        ));
    }

    // The store change is already committed; the caller must still see its result.
    private void auditCommitted(AuditLogger.AuditEvent event) {
        try {
            auditLogger.log(event);
        } catch (RuntimeException e) {
            LOG.warn("audit write failed for {} on {}", event.action(), event.resource(), e);
        }
    }

    private long nowMs() {
        return clock.millis();
    }

    public record StatsOutcome(String namespace, int total, Map<String, Integer> byState, QueueSettings settings) {
    }

    public record SettingsReloadOutcome(boolean changed, boolean fileExists, List<String> changedFields,
                                        QueueSettings settings) {
    }
}
