package io.meshgraph;

import io.meshgraph.cli.MeshGraphCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = MeshGraphCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}
