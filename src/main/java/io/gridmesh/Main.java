package io.gridmesh;

import io.gridmesh.cli.GridMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new GridMeshCommand()).execute(args);
        System.exit(code);
    }
}
