package io.resolvequeue;

import io.resolvequeue.cli.ResolveQueueCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ResolveQueueCommand()).execute(args);
        System.exit(code);
    }
}
