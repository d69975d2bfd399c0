package io.meshbroker;

import io.meshbroker.cli.MeshBrokerCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new MeshBrokerCommand()).execute(args);
        System.exit(code);
    }
}
