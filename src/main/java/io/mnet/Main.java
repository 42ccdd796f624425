package io.mnet;

import io.mnet.cli.MnetCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new MnetCommand()).execute(args);
        System.exit(code);
    }
}
