package io.resolvequeue.worker;

public record JobResult(
        Kind kind,
        String output,
        String error
) {
    public static JobResult ok(String output) {
        return new JobResult(Kind.SUCCESS, output, null);
    }

    public static JobResult fail(String error) {
        return new JobResult(Kind.RETRYABLE_FAILURE, null, error);
    }

    public static JobResult permanentFailure(String error) {
        return new JobResult(Kind.PERMANENT_FAILURE, null, error);
    }

    public boolean success() {
        return kind == Kind.SUCCESS;
    }

    public enum Kind { SUCCESS, RETRYABLE_FAILURE, PERMANENT_FAILURE }
}
