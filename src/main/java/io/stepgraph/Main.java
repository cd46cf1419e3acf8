package io.stepgraph;

import io.stepgraph.cli.StepGraphCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new StepGraphCommand()).execute(args);
        System.exit(code);
    }
}
