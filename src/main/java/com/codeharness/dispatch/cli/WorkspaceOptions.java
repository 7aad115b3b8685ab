package com.codeharness.dispatch.cli;

import com.codeharness.core.manifest.WorkspaceManifest;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options shared by the commands that open a workspace.
 */
public class WorkspaceOptions {

    @Option(names = {"--workspace", "-w"}, description = "Workspace directory (default: current directory)",
            defaultValue = ".")
    Path workspace;

    @Option(names = {"--role", "-r"}, description = "Role source, e.g. -r generator=gen.py -r test=sol.cpp")
    Map<String, String> roles = new LinkedHashMap<>();

    @Option(names = {"--tests", "-n"}, description = "Number of tests (default: ${DEFAULT-VALUE})",
            defaultValue = "10")
    int tests;

    @Option(names = {"--threads", "-t"}, description = "Worker threads, 0 for automatic (default: ${DEFAULT-VALUE})",
            defaultValue = "0")
    int threads;

    @Option(names = "--report", description = "Write the JSON run report to this file")
    Path report;

    WorkspaceManifest.Builder manifest() {
        WorkspaceManifest.Builder builder = WorkspaceManifest.builder(workspace.toAbsolutePath().normalize())
                .testCount(tests);
        roles.forEach(builder::role);
        return builder;
    }
}
