package com.codeharness.core.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Reads {@code VmRSS} from {@code /proc/<pid>/status} for a process and its descendants.
 * Reports {@code 0} on platforms without procfs.
 */
public class ProcfsMemorySampler implements MemorySampler {

    private static final Logger log = LoggerFactory.getLogger(ProcfsMemorySampler.class);

    private static final Path PROC = Path.of("/proc");

    private final boolean available = Files.isDirectory(PROC.resolve("self"));

    @Override
    public double sampleMegabytes(long pid) {
        if (!available) {
            return 0.0;
        }
        long totalKb = readRssKb(pid);
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isPresent()) {
            List<ProcessHandle> descendants = handle.get().descendants().toList();
            for (ProcessHandle child : descendants) {
                totalKb += readRssKb(child.pid());
            }
        }
        return totalKb / 1024.0;
    }

    private long readRssKb(long pid) {
        Path status = PROC.resolve(Long.toString(pid)).resolve("status");
        try {
            for (String line : Files.readAllLines(status)) {
                if (line.startsWith("VmRSS:")) {
                    String[] parts = line.substring("VmRSS:".length()).trim().split("\\s+");
                    return Long.parseLong(parts[0]);
                }
            }
        } catch (IOException | NumberFormatException e) {
            // process exited between polls
            log.trace("Could not read RSS for pid {}: {}", pid, e.getMessage());
        }
        return 0L;
    }
}
