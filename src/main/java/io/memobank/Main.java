package io.memobank;

import io.memobank.cli.MemoBankCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new MemoBankCommand()).execute(args);
        System.exit(code);
    }
}
