package com.codeharness.core.process;

import java.util.List;

/**
 * One stage of a process pipeline; it reads the previous stage's stdout.
 */
public record PipelineStage(String name, List<String> command, boolean monitorMemory) {

    public PipelineStage {
        command = List.copyOf(command);
    }

    public static PipelineStage of(String name, List<String> command) {
        return new PipelineStage(name, command, false);
    }
}
