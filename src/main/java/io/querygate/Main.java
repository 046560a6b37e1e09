package io.querygate;

import io.querygate.cli.QueryGateCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new QueryGateCommand()).execute(args);
        System.exit(code);
    }
}
