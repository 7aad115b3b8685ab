package com.codeharness.core.process;

import java.nio.file.Path;

/**
 * Result of a run whose input (and optionally output) travelled through scratch files.
 * When the files were cleaned up, the paths no longer exist but still identify what was used.
 *
 * @param result     the process outcome
 * @param inputFile  scratch file holding the input
 * @param outputFile scratch output file, or {@code null} when none was requested
 * @param output     content of the output file read back after the run, or {@code null}
 */
public record TempFileExecution(ExecutionResult result, Path inputFile, Path outputFile, String output) {
}
