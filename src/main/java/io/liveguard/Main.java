package io.liveguard;

import io.liveguard.cli.LiveGuardCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new LiveGuardCommand()).execute(args);
        System.exit(code);
    }
}
