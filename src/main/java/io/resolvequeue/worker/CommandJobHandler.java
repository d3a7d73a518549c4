package io.resolvequeue.worker;

import io.resolvequeue.model.ResolutionJob;
import io.resolvequeue.util.Jsons;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command per job. The job is written to stdin as one JSON object;
 * exit code 0 completes the job, {@link #PERMANENT_FAILURE_EXIT_CODE} fails it without
 * retry, any other exit code or a timeout is a retryable failure.
 */
public final class CommandJobHandler implements JobHandler {
    public static final int PERMANENT_FAILURE_EXIT_CODE = 65;
    private static final Logger LOG = LoggerFactory.getLogger(CommandJobHandler.class);
    private static final int MAX_ERROR_CHARS = 512;
    private static final long OUTPUT_DRAIN_GRACE_MS = 5_000L;

    private final List<String> command;
    private final long timeoutMs;

    public CommandJobHandler(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("handler command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public JobResult handle(ResolutionJob job) {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return JobResult.fail("command spawn failed: " + e.getMessage());
        }

        OutputDrain drain = new OutputDrain(process);
        drain.start();
        try {
            writeStdin(process, Jsons.toCompactJson(stdinPayload(job)).getBytes(StandardCharsets.UTF_8));

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return JobResult.fail("command timeout after " + Duration.ofMillis(timeoutMs));
            }

            String combined = drain.await(OUTPUT_DRAIN_GRACE_MS);
            int exit = process.exitValue();
            if (exit == 0) {
                return JobResult.ok(combined.strip());
            }
            String error = "command exit=" + exit + " output=" + truncate(combined);
            return exit == PERMANENT_FAILURE_EXIT_CODE ? JobResult.permanentFailure(error) : JobResult.fail(error);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return JobResult.fail("command interrupted");
        } catch (Exception e) {
            process.destroyForcibly();
            return JobResult.fail("command execution failed: " + e.getMessage());
        }
    }

    // The child may exit without reading its input; its exit code still decides the result.
    private static void writeStdin(Process process, byte[] input) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(input);
            stdin.flush();
        } catch (IOException e) {
            LOG.debug("command closed stdin early: {}", e.getMessage());
        }
    }

    private static final class OutputDrain extends Thread {
        private final Process process;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private volatile IOException failure;

        OutputDrain(Process process) {
            super("resolvequeue-command-output-" + process.pid());
            this.process = process;
            setDaemon(true);
        }

        @Override
        public void run() {
            try (InputStream in = process.getInputStream()) {
                in.transferTo(buffer);
            } catch (IOException e) {
                failure = e;
            }
        }

        String await(long graceMs) throws InterruptedException, IOException {
            join(graceMs);
            if (failure != null) {
                throw failure;
            }
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }

    static Map<String, Object> stdinPayload(ResolutionJob job) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", job.id());
        payload.put("batch_spec_id", job.batchSpecId());
        payload.put("allow_unsupported", job.allowUnsupported());
        payload.put("allow_ignored", job.allowIgnored());
        payload.put("attempt", job.executionLogs().size() + 1);
        payload.put("num_failures", job.numFailures());
        payload.put("num_resets", job.numResets());
        return payload;
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
