package io.resolvequeue.cli;

import io.resolvequeue.config.QueueConfig;
import io.resolvequeue.model.GetJobOptions;
import io.resolvequeue.model.JobState;
import io.resolvequeue.model.ListJobsOptions;
import io.resolvequeue.model.NewResolutionJob;
import io.resolvequeue.model.ResolutionJob;
import io.resolvequeue.monitor.StalledJobReclaimer;
import io.resolvequeue.runtime.ResolutionQueue;
import io.resolvequeue.storage.JobStore;
import io.resolvequeue.util.Jsons;
import io.resolvequeue.worker.CommandJobHandler;
import io.resolvequeue.worker.ResolutionWorker;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "resolvequeue",
        mixinStandardHelpOptions = true,
        description = "Batch spec resolution job queue CLI",
        subcommands = {
                ResolveQueueCommand.InitCommand.class,
                ResolveQueueCommand.SubmitCommand.class,
                ResolveQueueCommand.ClaimCommand.class,
                ResolveQueueCommand.CompleteCommand.class,
                ResolveQueueCommand.FailCommand.class,
                ResolveQueueCommand.RequeueCommand.class,
                ResolveQueueCommand.HeartbeatCommand.class,
                ResolveQueueCommand.JobCommand.class,
                ResolveQueueCommand.JobsCommand.class,
                ResolveQueueCommand.ReclaimCommand.class,
                ResolveQueueCommand.StatsCommand.class,
                ResolveQueueCommand.WorkerCommand.class,
                ResolveQueueCommand.MonitorCommand.class,
                ResolveQueueCommand.ReloadSettingsCommand.class,
                ResolveQueueCommand.SchemaMigrationsCommand.class
        }
)
public final class ResolveQueueCommand implements Runnable {
    @Option(names = {"--root"}, description = "Queue data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Queue namespace (tenant scope)", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | submit | claim | complete | fail | requeue | heartbeat | job | jobs | reclaim | stats | worker | monitor | reload-settings | schema-migrations");
    }

    ResolutionQueue queue() {
        QueueConfig config = QueueConfig.fromRoot(root, namespace);
        ResolutionQueue queue = new ResolutionQueue(config);
        queue.init();
        return queue;
    }

    static Map<String, Object> reportView(long jobId, JobStore.ReportResult result) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("jobId", jobId);
        out.put("outcome", result.outcome());
        out.put("state", result.state());
        out.put("numFailures", result.numFailures());
        out.put("numResets", result.numResets());
        out.put("processAfterMs", result.processAfterMs());
        return out;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        ResolveQueueCommand parent;

        @Override
        public Integer call() {
            ResolutionQueue queue = parent.queue();
            System.out.println("Initialized resolvequeue at: " + queue.config().rootDir());
            return 0;
        }
    }

    @Command(name = "submit", description = "Submit one job per batch spec id")
    static final class SubmitCommand implements Callable<Integer> {
        @ParentCommand
        ResolveQueueCommand parent;

        @Option(names = {"--batch-spec-id"}, required = true, description = "Batch spec id (repeatable)")
        List<Long> batchSpecIds;

        @Option(names = {"--allow-unsupported"}, defaultValue = "false", description = "Allow unsupported code hosts")
        boolean allowUnsupported;

        @Option(names = {"--allow-ignored"}, defaultValue = "false", description = "Allow ignored repositories")
        boolean allowIgnored;

        @Override
        public Integer call() {
            ResolutionQueue queue = parent.queue();
            List<NewResolutionJob> jobs = new ArrayList<>();
            for (Long id : batchSpecIds) {
                jobs.add(NewResolutionJob.queued(id, allowUnsupported, allowIgnored));
            }
            System.out.println(Jsons.toJson(queue.submit(jobs)));
            return 0;
        }
    }

    @Command(name = "claim", description = "Claim the oldest eligible job for a worker")
    static final class ClaimCommand implements Callable<Integer> {
        @ParentCommand
        ResolveQueueCommand parent;

        @Option(names = {"--worker-id"}, required = true, description = "Worker identity")
        String workerId;

        @Option(names = {"--timeout-ms"}, description = "Claim timeout; defaults to claimTimeoutMs setting")
        Long timeoutMs;

        @Override
        public Integer call() {
            ResolutionQueue queue = parent.queue();
            Optional<ResolutionJob> job = timeoutMs == null
                    ? queue.claim(workerId)
                    : queue.claim(workerId, Duration.ofMillis(timeoutMs));
            if (job.isEmpty()) {
                System.out.println("{\"claimed\":false}");
                return 1;
            }
            System.out.println(Jsons.toJson(job.get()));
            return 0;
        }
    }

    @Command(name = "complete", description = "Report a processing job as completed")
    static final class CompleteCommand implements Callable<Integer> {
        @ParentCommand
        ResolveQueueCommand parent;

        @Parameters(index = "0", description = "Job id")
        long jobId;

        @Option(names = {"--worker-id"}, description = "Only apply when the job is owned by this worker")
        String workerId;

        @Option(names = {"--detail"}, description = "Execution log detail")
        String detail;

        @Override
        public Integer call() {
            JobStore.ReportResult result = parent.queue().reportSuccess(jobId, workerId, detail);
            System.out.println(Jsons.toJson(reportView(jobId, result)));
            return result.applied() ? 0 : 1;
        }
    }

    @Command(name = "fail", description = "Report a processing job as failed")
    static final class FailCommand implements Callable<Integer> {
        @ParentCommand
        ResolveQueueCommand parent;

        @Parameters(index = "0", description = "Job id")
        long jobId;

        @Option(names = {"--message"}, required = true, description = "Failure message")
        String message;

        @Option(names = {"--worker-id"}, description = "Only apply when the job is owned by this worker")
        String workerId;

        @Option(names = {"--permanent"}, defaultValue = "false", description = "Fail without retry")
        boolean permanent;

        @Override
        public Integer call() {
            ResolutionQueue queue = parent.queue();
            JobStore.ReportResult result = permanent
                    ? queue.reportPermanentFailure(jobId, workerId, message)
                    : queue.reportFailure(jobId, workerId, message);
            System.out.println(Jsons.toJson(reportView(jobId, result)));
            return result.applied() ? 0 : 1;
        }
    }

    @Command(name = "requeue", description = "Return a processing job to the queue without counting a failure")
    static final class RequeueCommand implements Callable<Integer> {
        @ParentCommand
        ResolveQueueCommand parent;

        @Parameters(index = "0", description = "Job id")
        long jobId;

        @Option(names = {"--worker-id"}, description = "Only apply when the job is owned by this worker")
        String workerId;

        @Option(names = {"--delay-ms"}, defaultValue = "0", description = "Delay before the job is eligible again")
        long delayMs;

        @Override
        public Integer call() {
            JobStore.ReportResult result = parent.queue().requeue(jobId, workerId, Duration.ofMillis(delayMs));
            System.out.println(Jsons.toJson(reportView(jobId, result)));
            return result.applied() ? 0 : 1;
        }
    }

    @Command(name = "heartbeat", description = "Refresh the lease of a processing job")
    static final class HeartbeatCommand implements Callable<Integer> {
        @ParentCommand
        ResolveQueueCommand parent;

        @Parameters(index = "0", description = "Job id")
        long jobId;

        @Option(names = {"--worker-id"}, description = "Only apply when the job is owned by this worker")
        String workerId;

        @Option(names = {"--progress"}, description = "Progress text recorded on the job")
        String progress;

        @Override
        public Integer call() {
            boolean alive = parent.queue().heartbeat(jobId, workerId, progress);
            System.out.println(Jsons.toJson(Map.of("jobId", jobId, "alive", alive)));
            return alive ? 0 : 1;
        }
    }

    @Command(name = "job", description = "Show a job by id and/or batch spec id")
    static final class JobCommand implements Callable<Integer> {
        @ParentCommand
        ResolveQueueCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Job id")
        Long jobId;

        @Option(names = {"--batch-spec-id"}, description = "Batch spec id")
        Long batchSpecId;

        @Override
        public Integer call() {
            GetJobOptions options = new GetJobOptions(jobId, batchSpecId);
            if (options.empty()) {
                System.out.println("{\"error\":\"job id or --batch-spec-id required\"}");
                return 2;
            }
            Optional<ResolutionJob> job = parent.queue().get(options);
            if (job.isEmpty()) {
                System.out.println("{\"error\":\"job not found\"}");
                return 1;
            }
            System.out.println(Jsons.toJson(job.get()));
            return 0;
        }
    }

    @Command(name = "jobs", description = "List jobs with optional filters")
    static final class JobsCommand implements Callable<Integer> {
        @ParentCommand
        ResolveQueueCommand parent;

        @Option(names = {"--state"}, description = "Filter by state: queued|processing|completed|failed|errored")
        String state;

        @Option(names = {"--worker-id"}, description = "Filter by worker hostname")
        String workerId;

        @Override
        public Integer call() {
            JobState parsed = state == null || state.isBlank() ? null : JobState.fromString(state);
            List<ResolutionJob> jobs = parent.queue().list(new ListJobsOptions(parsed, workerId));
            System.out.println(Jsons.toJson(jobs));
            return 0;
        }
    }

    @Command(name = "reclaim", description = "Reset jobs whose heartbeat timed out")
    static final class ReclaimCommand implements Callable<Integer> {
        @ParentCommand
        ResolveQueueCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.queue().reclaimStale()));
            return 0;
        }
    }

    @Command(name = "stats", description = "Job counts by state and effective settings")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        ResolveQueueCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.queue().stats()));
            return 0;
        }
    }

    @Command(name = "worker", description = "Run a worker that executes a command per job (job JSON on stdin)")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        ResolveQueueCommand parent;

        @Option(names = {"--worker-id"}, description = "Worker identity; defaults to host-pid")
        String workerId;

        @Option(names = {"--once"}, defaultValue = "false", description = "Process eligible jobs, then exit")
        boolean once;

        @Option(names = {"--max-jobs"}, defaultValue = "1", description = "Job limit with --once")
        int maxJobs;

        @Option(names = {"--poll-ms"}, defaultValue = "1000", description = "Idle poll interval in ms")
        long pollMs;

        @Option(names = {"--command-timeout-ms"}, defaultValue = "300000", description = "Per-job command timeout")
        long commandTimeoutMs;

        @Option(names = {"--reclaim"}, defaultValue = "false", description = "Also run the stalled job reclaimer")
        boolean reclaim;

        @Parameters(arity = "1..*", description = "Handler command and arguments")
        List<String> command;

        @Override
        public Integer call() {
            ResolutionQueue queue = parent.queue();
            String id = workerId == null || workerId.isBlank() ? ResolutionWorker.defaultWorkerId() : workerId;
            ResolutionWorker worker = new ResolutionWorker(
                    queue,
                    id,
                    new CommandJobHandler(command, commandTimeoutMs),
                    Duration.ofMillis(pollMs),
                    Duration.ofMillis(Math.max(50L, queue.settings().heartbeatTimeoutMs() / 3L))
            );
            StalledJobReclaimer reclaimer = reclaim ? new StalledJobReclaimer(queue) : null;
            try {
                if (reclaimer != null) {
                    reclaimer.start();
                }
                if (once) {
                    int processed = worker.drain(maxJobs);
                    System.out.println(Jsons.toJson(Map.of("workerId", id, "processed", processed)));
                    return 0;
                }
                Runtime.getRuntime().addShutdownHook(new Thread(worker::stop, "resolvequeue-shutdown-hook"));
                worker.runLoop();
                return 0;
            } finally {
                if (reclaimer != null) {
                    reclaimer.close();
                }
                worker.close();
            }
        }
    }

    @Command(name = "monitor", description = "Run the stalled job reclaimer")
    static final class MonitorCommand implements Callable<Integer> {
        @ParentCommand
        ResolveQueueCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run a single sweep")
        boolean once;

        @Option(names = {"--interval-ms"}, description = "Sweep interval; defaults to reclaimIntervalMs setting")
        Long intervalMs;

        @Override
        public Integer call() throws InterruptedException {
            ResolutionQueue queue = parent.queue();
            Duration interval = Duration.ofMillis(intervalMs == null ? queue.settings().reclaimIntervalMs() : intervalMs);
            StalledJobReclaimer reclaimer = new StalledJobReclaimer(queue, interval);
            if (once) {
                System.out.println(Jsons.toJson(reclaimer.runOnce()));
                return 0;
            }
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                reclaimer.close();
                stopped.countDown();
            }, "resolvequeue-shutdown-hook"));
            reclaimer.start();
            stopped.await();
            return 0;
        }
    }

    @Command(name = "reload-settings", description = "Re-read resolvequeue-settings.json and print the effective settings")
    static final class ReloadSettingsCommand implements Callable<Integer> {
        @ParentCommand
        ResolveQueueCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.queue().reloadSettings()));
            return 0;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        ResolveQueueCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.queue().schemaMigrations(limit)));
            return 0;
        }
    }
}
