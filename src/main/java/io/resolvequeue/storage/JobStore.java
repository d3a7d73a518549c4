package io.resolvequeue.storage;

import io.resolvequeue.model.AttemptOutcome;
import io.resolvequeue.model.ExecutionLogEntry;
import io.resolvequeue.model.GetJobOptions;
import io.resolvequeue.model.JobState;
import io.resolvequeue.model.ListJobsOptions;
import io.resolvequeue.model.NewResolutionJob;
import io.resolvequeue.model.ResolutionJob;
import io.resolvequeue.retry.RetryPolicy;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Authoritative persistence for batch spec resolution jobs.
 *
 * <p>Every mutation runs in one write transaction on one connection. Transitions of an
 * existing row go through {@link #applyTransition}, which bumps the row version and fails
 * if the version read inside the same transaction no longer matches.
 */
public final class JobStore {
    private static final String JOB_COLUMNS = """
            id,batch_spec_id,allow_unsupported,allow_ignored,state,failure_message,\
            started_at_ms,finished_at_ms,process_after_ms,num_resets,num_failures,\
            worker_hostname,progress_detail,version,created_at_ms,updated_at_ms""";
    private static final String CLAIM_SQL = """
            UPDATE batch_spec_resolution_jobs
            SET state=?,started_at_ms=?,finished_at_ms=NULL,worker_hostname=?,progress_detail=NULL,claim_token=?,
                updated_at_ms=?,version=version+1
            WHERE id=(
                SELECT id FROM batch_spec_resolution_jobs
                WHERE namespace=? AND state=? AND (process_after_ms IS NULL OR process_after_ms<=?)
                ORDER BY created_at_ms ASC, id ASC
                LIMIT 1
            ) AND state=?
            """;
    private static final int LOG_LOOKUP_CHUNK = 500;

    private final Database database;
    private final String namespace;

    public JobStore(Database database) {
        this.database = database;
        this.namespace = database.namespace();
    }

    public List<ResolutionJob> create(List<NewResolutionJob> jobs, long nowMs) {
        if (jobs == null || jobs.isEmpty()) {
            return List.of();
        }
        return inTransaction("Failed to create jobs", c -> {
            List<Long> ids = new ArrayList<>(jobs.size());
            try (PreparedStatement ins = c.prepareStatement(
                    "INSERT INTO batch_spec_resolution_jobs(namespace,batch_spec_id,allow_unsupported,allow_ignored,state,finished_at_ms,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?,?,?,?)");
                 PreparedStatement lastId = c.prepareStatement("SELECT last_insert_rowid()")) {
                for (NewResolutionJob job : jobs) {
                    JobState state = job.state() == null ? JobState.QUEUED : job.state();
                    if (state == JobState.PROCESSING) {
                        throw new IllegalArgumentException("jobs cannot be created in state processing");
                    }
                    long createdAtMs = job.createdAtMs() == null ? nowMs : job.createdAtMs();
                    ins.setString(1, namespace);
                    ins.setLong(2, job.batchSpecId());
                    ins.setInt(3, job.allowUnsupported() ? 1 : 0);
                    ins.setInt(4, job.allowIgnored() ? 1 : 0);
                    ins.setString(5, state.dbValue());
                    if (state.terminal()) {
                        ins.setLong(6, createdAtMs);
                    } else {
                        ins.setNull(6, Types.INTEGER);
                    }
                    ins.setLong(7, createdAtMs);
                    ins.setLong(8, createdAtMs);
                    ins.executeUpdate();
                    try (ResultSet rs = lastId.executeQuery()) {
                        rs.next();
                        ids.add(rs.getLong(1));
                    }
                }
            }
            return queryJobs(c, "id IN (" + placeholders(ids.size()) + ")", new ArrayList<>(ids), true);
        });
    }

    public Optional<ResolutionJob> get(GetJobOptions opts) {
        if (opts == null || opts.empty()) {
            throw new IllegalArgumentException("job lookup needs an id or a batch spec id");
        }
        List<String> preds = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        if (opts.id() != null) {
            preds.add("id=?");
            params.add(opts.id());
        }
        if (opts.batchSpecId() != null) {
            preds.add("batch_spec_id=?");
            params.add(opts.batchSpecId());
        }
        try (Connection c = database.openConnection()) {
            List<ResolutionJob> rows = queryJobs(c, String.join(" AND ", preds), params, true);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (SQLException e) {
            throw new JobStoreException("Failed to read job", e);
        }
    }

    public List<ResolutionJob> list(ListJobsOptions opts) {
        ListJobsOptions safe = opts == null ? ListJobsOptions.all() : opts;
        List<String> preds = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        if (safe.state() != null) {
            preds.add("state=?");
            params.add(safe.state().dbValue());
        }
        if (safe.workerHostname() != null && !safe.workerHostname().isBlank()) {
            preds.add("worker_hostname=?");
            params.add(safe.workerHostname().trim());
        }
        if (preds.isEmpty()) {
            preds.add("1=1");
        }
        try (Connection c = database.openConnection()) {
            return queryJobs(c, String.join(" AND ", preds), params, true);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to list jobs", e);
        }
    }

    public Map<JobState, Integer> countByState() {
        Map<JobState, Integer> out = new LinkedHashMap<>();
        for (JobState state : JobState.values()) {
            out.put(state, 0);
        }
        String sql = "SELECT state, COUNT(*) AS c FROM batch_spec_resolution_jobs WHERE namespace=? GROUP BY state";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, namespace);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(JobState.fromString(rs.getString("state")), rs.getInt("c"));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to count jobs", e);
        }
    }

    /**
     * Claims the oldest eligible queued row for {@code workerHostname}. Selection and
     * transition are one UPDATE statement guarded by {@code state='queued'}; the row is read
     * back by a claim token unique to this call.
     *
     * @param timeoutSeconds JDBC query timeout for the claim statement, 0 for none
     */
    public Optional<ResolutionJob> dequeue(String workerHostname, long nowMs, int timeoutSeconds) {
        if (workerHostname == null || workerHostname.isBlank()) {
            throw new IllegalArgumentException("worker hostname must not be blank");
        }
        String worker = workerHostname.trim();
        String claimToken = "claim_" + UUID.randomUUID();
        return inTransaction("Failed to dequeue job", c -> {
            int updated;
            try (PreparedStatement ps = c.prepareStatement(CLAIM_SQL)) {
                if (timeoutSeconds > 0) {
                    ps.setQueryTimeout(timeoutSeconds);
                }
                ps.setString(1, JobState.PROCESSING.dbValue());
                ps.setLong(2, nowMs);
                ps.setString(3, worker);
                ps.setString(4, claimToken);
                ps.setLong(5, nowMs);
                ps.setString(6, namespace);
                ps.setString(7, JobState.QUEUED.dbValue());
                ps.setLong(8, nowMs);
                ps.setString(9, JobState.QUEUED.dbValue());
                updated = ps.executeUpdate();
            }
            if (updated == 0) {
                return Optional.<ResolutionJob>empty();
            }
            List<ResolutionJob> claimed = queryJobs(c, "claim_token=?", List.of(claimToken), true);
            if (claimed.size() != 1
                    || claimed.get(0).state() != JobState.PROCESSING
                    || !worker.equals(claimed.get(0).workerHostname())) {
                throw new IllegalStateException("Claim token " + claimToken + " matched " + claimed.size()
                        + " rows in an unexpected state");
            }
            return Optional.of(claimed.get(0));
        });
    }

    /**
     * Refreshes the lease of a processing row. Returns false when the row is no longer
     * processing, or is owned by another worker when {@code workerHostname} is given.
     */
    public boolean heartbeat(long id, String workerHostname, long nowMs) {
        return heartbeat(id, workerHostname, null, nowMs);
    }

    /**
     * Same as {@link #heartbeat(long, String, long)}, also recording {@code progress} on the row.
     * A null progress keeps the last recorded value; a new claim clears it.
     */
    public boolean heartbeat(long id, String workerHostname, String progress, long nowMs) {
        boolean scoped = workerHostname != null && !workerHostname.isBlank();
        String sql = "UPDATE batch_spec_resolution_jobs SET updated_at_ms=?,progress_detail=COALESCE(?,progress_detail),"
                + "version=version+1 WHERE namespace=? AND id=? AND state=?"
                + (scoped ? " AND worker_hostname=?" : "");
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setString(2, progress);
            ps.setString(3, namespace);
            ps.setLong(4, id);
            ps.setString(5, JobState.PROCESSING.dbValue());
            if (scoped) {
                ps.setString(6, workerHostname.trim());
            }
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new JobStoreException("Failed heartbeat for job " + id, e);
        }
    }

    public ReportResult markComplete(long id, String workerHostname, String detail, long nowMs) {
        return inTransaction("Failed to mark job complete: " + id, c -> {
            LeaseCheck check = checkLease(c, id, workerHostname);
            if (check.stale()) {
                return ReportResult.stale(check.actualState());
            }
            ResolutionJob job = check.job();
            applyTransition(c, job, new Transition(
                    JobState.COMPLETED,
                    job.workerHostname(),
                    null,
                    nowMs,
                    job.processAfterMs(),
                    job.numResets(),
                    job.numFailures()
            ), nowMs);
            appendLog(c, job, nowMs, AttemptOutcome.COMPLETED, detail);
            return new ReportResult(ReportOutcome.COMPLETED, JobState.COMPLETED, job.numFailures(), job.numResets(), null);
        });
    }

    /**
     * Records a failed attempt. Retryable failures requeue the job with a backoff delay
     * until the failure bound is reached, then the job is errored; non-retryable failures
     * fail the job immediately.
     */
    public ReportResult markFailure(long id, String workerHostname, String message, boolean retryable,
                                    long nowMs, RetryPolicy policy) {
        String failureMessage = message == null || message.isBlank() ? "job failed without a message" : message;
        return inTransaction("Failed to record job failure: " + id, c -> {
            LeaseCheck check = checkLease(c, id, workerHostname);
            if (check.stale()) {
                return ReportResult.stale(check.actualState());
            }
            ResolutionJob job = check.job();
            int failures = job.numFailures() + 1;
            if (!retryable) {
                applyTransition(c, job, new Transition(
                        JobState.FAILED, job.workerHostname(), failureMessage, nowMs, job.processAfterMs(),
                        job.numResets(), failures
                ), nowMs);
                appendLog(c, job, nowMs, AttemptOutcome.FAILED, failureMessage);
                return new ReportResult(ReportOutcome.FAILED, JobState.FAILED, failures, job.numResets(), null);
            }
            if (policy.failuresExhausted(failures)) {
                applyTransition(c, job, new Transition(
                        JobState.ERRORED, job.workerHostname(), failureMessage, nowMs, job.processAfterMs(),
                        job.numResets(), failures
                ), nowMs);
                appendLog(c, job, nowMs, AttemptOutcome.ERRORED, failureMessage);
                return new ReportResult(ReportOutcome.ERRORED, JobState.ERRORED, failures, job.numResets(), null);
            }
            long processAfterMs = nowMs + Math.max(1L, policy.backoffMs(failures));
            applyTransition(c, job, new Transition(
                    JobState.QUEUED, "", null, null, processAfterMs, job.numResets(), failures
            ), nowMs);
            appendLog(c, job, nowMs, AttemptOutcome.FAILED, failureMessage);
            return new ReportResult(ReportOutcome.RETRY_SCHEDULED, JobState.QUEUED, failures, job.numResets(), processAfterMs);
        });
    }

    /**
     * Hands a processing job back to the queue without counting a failure. Counts as a
     * reset and is bounded by the reset limit.
     */
    public ReportResult requeue(long id, String workerHostname, long processAfterMs, long nowMs, RetryPolicy policy) {
        return inTransaction("Failed to requeue job: " + id, c -> {
            LeaseCheck check = checkLease(c, id, workerHostname);
            if (check.stale()) {
                return ReportResult.stale(check.actualState());
            }
            ResolutionJob job = check.job();
            int resets = job.numResets() + 1;
            if (policy.resetsExhausted(resets)) {
                String msg = "requeue limit exhausted (num_resets=" + resets + ", max_resets=" + policy.maxResets() + ")";
                applyTransition(c, job, new Transition(
                        JobState.ERRORED, job.workerHostname(), msg, nowMs, job.processAfterMs(), resets, job.numFailures()
                ), nowMs);
                appendLog(c, job, nowMs, AttemptOutcome.ERRORED, msg);
                return new ReportResult(ReportOutcome.ERRORED, JobState.ERRORED, job.numFailures(), resets, null);
            }
            Long after = processAfterMs > nowMs ? processAfterMs : null;
            applyTransition(c, job, new Transition(
                    JobState.QUEUED, "", null, null, after, resets, job.numFailures()
            ), nowMs);
            appendLog(c, job, nowMs, AttemptOutcome.REQUEUED, "requeued by worker");
            return new ReportResult(ReportOutcome.REQUEUED, JobState.QUEUED, job.numFailures(), resets, after);
        });
    }

    /**
     * Returns every processing row whose last heartbeat is before {@code cutoffMs}
     * to the queue, or errors it once its reset count goes past the bound. Rows already
     * reclaimed by a concurrent sweep no longer match and are skipped.
     */
    public ReclaimSummary resetStalled(long nowMs, long cutoffMs, RetryPolicy policy) {
        return inTransaction("Failed to reset stalled jobs", c -> {
            List<ResolutionJob> stalled = queryJobs(
                    c,
                    "state=? AND updated_at_ms<?",
                    List.of(JobState.PROCESSING.dbValue(), cutoffMs),
                    false
            );
            List<Long> requeued = new ArrayList<>();
            List<Long> errored = new ArrayList<>();
            for (ResolutionJob job : stalled) {
                int resets = job.numResets() + 1;
                String detail = "heartbeat timeout: worker " + job.workerHostname()
                        + " last reported at " + job.updatedAtMs();
                if (policy.resetsExhausted(resets)) {
                    String msg = "job abandoned too many times (num_resets=" + resets
                            + ", max_resets=" + policy.maxResets() + ")";
                    applyTransition(c, job, new Transition(
                            JobState.ERRORED, job.workerHostname(), msg, nowMs, job.processAfterMs(), resets, job.numFailures()
                    ), nowMs);
                    appendLog(c, job, nowMs, AttemptOutcome.ERRORED, detail + "; " + msg);
                    errored.add(job.id());
                } else {
                    applyTransition(c, job, new Transition(
                            JobState.QUEUED, "", null, null, null, resets, job.numFailures()
                    ), nowMs);
                    appendLog(c, job, nowMs, AttemptOutcome.RESET, detail);
                    requeued.add(job.id());
                }
            }
            return new ReclaimSummary(List.copyOf(requeued), List.copyOf(errored));
        });
    }

    private LeaseCheck checkLease(Connection c, long id, String workerHostname) throws SQLException {
        List<ResolutionJob> rows = queryJobs(c, "id=?", List.of(id), false);
        if (rows.isEmpty()) {
            return new LeaseCheck(null, null, true);
        }
        ResolutionJob job = rows.get(0);
        boolean owned = workerHostname == null || workerHostname.isBlank()
                || workerHostname.trim().equals(job.workerHostname());
        if (job.state() != JobState.PROCESSING || !owned) {
            return new LeaseCheck(job, job.state(), true);
        }
        if (job.workerHostname().isBlank() || job.startedAtMs() == null) {
            throw new IllegalStateException("Job " + id + " is processing without an owner or start time");
        }
        return new LeaseCheck(job, job.state(), false);
    }

    private void applyTransition(Connection c, ResolutionJob current, Transition t, long nowMs) throws SQLException {
        String sql = """
                UPDATE batch_spec_resolution_jobs
                SET state=?,worker_hostname=?,failure_message=?,finished_at_ms=?,process_after_ms=?,
                    num_resets=?,num_failures=?,claim_token=NULL,updated_at_ms=?,version=version+1
                WHERE namespace=? AND id=? AND version=?
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, t.state().dbValue());
            ps.setString(2, t.workerHostname() == null ? "" : t.workerHostname());
            ps.setString(3, t.failureMessage());
            setNullableLong(ps, 4, t.finishedAtMs());
            setNullableLong(ps, 5, t.processAfterMs());
            ps.setInt(6, t.numResets());
            ps.setInt(7, t.numFailures());
            ps.setLong(8, nowMs);
            ps.setString(9, namespace);
            ps.setLong(10, current.id());
            ps.setLong(11, current.version());
            if (ps.executeUpdate() != 1) {
                throw new IllegalStateException("Job " + current.id() + " changed under a write transaction (expected version "
                        + current.version() + ")");
            }
        }
    }

    private void appendLog(Connection c, ResolutionJob job, long finishedAtMs, AttemptOutcome outcome, String detail)
            throws SQLException {
        String sql = """
                INSERT INTO job_execution_logs(job_id,attempt,worker_hostname,started_at_ms,finished_at_ms,outcome,detail)
                SELECT ?,COALESCE(MAX(attempt),0)+1,?,?,?,?,? FROM job_execution_logs WHERE job_id=?
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, job.id());
            ps.setString(2, job.workerHostname());
            ps.setLong(3, job.startedAtMs() == null ? finishedAtMs : job.startedAtMs());
            ps.setLong(4, finishedAtMs);
            ps.setString(5, outcome.dbValue());
            ps.setString(6, detail);
            ps.setLong(7, job.id());
            ps.executeUpdate();
        }
    }

    private List<ResolutionJob> queryJobs(Connection c, String where, List<Object> params, boolean withLogs)
            throws SQLException {
        String sql = "SELECT " + JOB_COLUMNS + " FROM batch_spec_resolution_jobs WHERE namespace=? AND " + where
                + " ORDER BY id ASC";
        List<JobRow> rows = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, namespace);
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 2, params.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(readRow(rs));
                }
            }
        }
        Map<Long, List<ExecutionLogEntry>> logs = withLogs ? loadLogs(c, rows) : Map.of();
        List<ResolutionJob> out = new ArrayList<>(rows.size());
        for (JobRow row : rows) {
            out.add(row.toJob(logs.getOrDefault(row.id(), List.of())));
        }
        return out;
    }

    private Map<Long, List<ExecutionLogEntry>> loadLogs(Connection c, List<JobRow> rows) throws SQLException {
        Map<Long, List<ExecutionLogEntry>> out = new LinkedHashMap<>();
        for (int from = 0; from < rows.size(); from += LOG_LOOKUP_CHUNK) {
            List<JobRow> chunk = rows.subList(from, Math.min(rows.size(), from + LOG_LOOKUP_CHUNK));
            String sql = "SELECT job_id,attempt,worker_hostname,started_at_ms,finished_at_ms,outcome,detail "
                    + "FROM job_execution_logs WHERE job_id IN (" + placeholders(chunk.size()) + ") "
                    + "ORDER BY job_id ASC, attempt ASC";
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (int i = 0; i < chunk.size(); i++) {
                    ps.setLong(i + 1, chunk.get(i).id());
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.computeIfAbsent(rs.getLong("job_id"), k -> new ArrayList<>()).add(new ExecutionLogEntry(
                                rs.getInt("attempt"),
                                rs.getString("worker_hostname"),
                                rs.getLong("started_at_ms"),
                                rs.getLong("finished_at_ms"),
                                AttemptOutcome.fromDb(rs.getString("outcome")),
                                rs.getString("detail")
                        ));
                    }
                }
            }
        }
        return out;
    }

    private JobRow readRow(ResultSet rs) throws SQLException {
        return new JobRow(
                rs.getLong("id"),
                rs.getLong("batch_spec_id"),
                rs.getInt("allow_unsupported") == 1,
                rs.getInt("allow_ignored") == 1,
                JobState.fromString(rs.getString("state")),
                rs.getString("failure_message"),
                nullableLong(rs, "started_at_ms"),
                nullableLong(rs, "finished_at_ms"),
                nullableLong(rs, "process_after_ms"),
                rs.getInt("num_resets"),
                rs.getInt("num_failures"),
                rs.getString("worker_hostname"),
                rs.getString("progress_detail"),
                rs.getLong("version"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private <T> T inTransaction(String failure, TxWork<T> work) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                T result = work.run(c);
                c.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new JobStoreException(failure, e);
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    private static String placeholders(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0");
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append('?');
        }
        return sb.toString();
    }

    private interface TxWork<T> { T run(Connection c) throws SQLException; }

    private record LeaseCheck(ResolutionJob job, JobState actualState, boolean stale) {}

    private record Transition(
            JobState state,
            String workerHostname,
            String failureMessage,
            Long finishedAtMs,
            Long processAfterMs,
            int numResets,
            int numFailures
    ) {}

    private record JobRow(
            long id, long batchSpecId, boolean allowUnsupported, boolean allowIgnored, JobState state,
            String failureMessage, Long startedAtMs, Long finishedAtMs, Long processAfterMs, int numResets,
            int numFailures, String workerHostname, String progressDetail, long version, long createdAtMs,
            long updatedAtMs
    ) {
        ResolutionJob toJob(List<ExecutionLogEntry> logs) {
            return new ResolutionJob(id, batchSpecId, allowUnsupported, allowIgnored, state, failureMessage,
                    startedAtMs, finishedAtMs, processAfterMs, numResets, numFailures, logs, workerHostname,
                    progressDetail, version, createdAtMs, updatedAtMs);
        }
    }

    public enum ReportOutcome { COMPLETED, RETRY_SCHEDULED, ERRORED, FAILED, REQUEUED, STALE }

    /**
     * Result of a worker report. {@code STALE} means the row was not processing (or not owned
     * by the reporting worker) and nothing changed; {@code state} then carries the state the
     * row was found in, or null if it does not exist.
     */
    public record ReportResult(ReportOutcome outcome, JobState state, int numFailures, int numResets, Long processAfterMs) {
        public static ReportResult stale(JobState actual) {
            return new ReportResult(ReportOutcome.STALE, actual, 0, 0, null);
        }

        public boolean applied() {
            return outcome != ReportOutcome.STALE;
        }
    }

    public record ReclaimSummary(List<Long> requeuedIds, List<Long> erroredIds) {
        public int requeued() {
            return requeuedIds.size();
        }

        public int errored() {
            return erroredIds.size();
        }

        public int total() {
            return requeuedIds.size() + erroredIds.size();
        }
    }
}
