package com.codeharness.core.process;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs external processes with timeouts, optional memory sampling, stdin feeding and
 * cancellation. Every outcome, including a failure to launch, comes back as an
 * {@link ExecutionResult}; only {@link InterruptedException} escapes, after the process
 * tree has been killed. Call {@link #close()} when done to stop the stream threads.
 */
public class ProcessExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessExecutor.class);

    public static final String INPUT_FILE_PLACEHOLDER = "{input_file}";
    public static final String OUTPUT_FILE_PLACEHOLDER = "{output_file}";

    private static final Duration STREAM_GRACE = Duration.ofSeconds(1);

    private final MemorySampler memorySampler;
    private final Duration pollInterval;
    private final Path scratchDirectory;
    private final Set<Process> liveProcesses = ConcurrentHashMap.newKeySet();
    private final ExecutorService ioPool = Executors.newCachedThreadPool(new IoThreadFactory());

    public ProcessExecutor() {
        this(new ProcfsMemorySampler(), Duration.ofMillis(5), null);
    }

    public ProcessExecutor(MemorySampler memorySampler, Duration pollInterval, Path scratchDirectory) {
        this.memorySampler = memorySampler != null ? memorySampler : MemorySampler.NONE;
        this.pollInterval = pollInterval != null && !pollInterval.isZero() ? pollInterval : Duration.ofMillis(5);
        this.scratchDirectory = scratchDirectory;
    }

    public ExecutionResult run(List<String> command, String input, Duration timeout,
                               boolean monitorMemory, Path workingDirectory) throws InterruptedException {
        return run(new ExecutionRequest(command, input, timeout, monitorMemory, workingDirectory, CancellationToken.NONE));
    }

    /**
     * Launches the process and waits for it to exit, time out, or be cancelled.
     *
     * @throws InterruptedException if the calling thread is interrupted; the process tree is killed first
     */
    public ExecutionResult run(ExecutionRequest request) throws InterruptedException {
        List<String> command = request.command();
        if (ioPool.isShutdown()) {
            throw new IllegalStateException("ProcessExecutor is closed");
        }
        long start = System.nanoTime();
        log.debug("Executing: {}", String.join(" ", command));

        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            if (request.workingDirectory() != null) {
                builder.directory(request.workingDirectory().toFile());
            }
            process = builder.start();
        } catch (IOException | RuntimeException e) {
            log.debug("Failed to launch {}: {}", command.get(0), e.getMessage());
            return ExecutionResult.launchFailure(command, "Execution error: " + e.getMessage(), secondsSince(start));
        }

        liveProcesses.add(process);
        try {
            StreamCollector stdout = collect(process.getInputStream());
            StreamCollector stderr = collect(process.getErrorStream());
            feed(process, request.input());

            boolean timedOut = false;
            boolean canceled = false;
            double peakMemory = 0.0;
            long deadline = start + request.timeout().toNanos();
            try {
                while (!process.waitFor(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    if (request.monitorMemory()) {
                        peakMemory = Math.max(peakMemory, memorySampler.sampleMegabytes(process.pid()));
                    }
                    if (request.cancellation().isCancellationRequested()) {
                        canceled = true;
                        break;
                    }
                    if (System.nanoTime() >= deadline) {
                        timedOut = true;
                        break;
                    }
                }
            } catch (InterruptedException e) {
                kill(process);
                throw e;
            }
            double elapsed = secondsSince(start);
            if (timedOut || canceled) {
                log.debug("Killing {} ({})", command.get(0), timedOut ? "timeout" : "canceled");
                kill(process);
            }
            int returnCode = process.isAlive() ? -1 : process.exitValue();
            return new ExecutionResult(returnCode, stdout.await(), stderr.await(), elapsed,
                    peakMemory, timedOut, canceled, false, command);
        } finally {
            liveProcesses.remove(process);
        }
    }

    /**
     * Runs {@code template} after replacing {@value #INPUT_FILE_PLACEHOLDER} and
     * {@value #OUTPUT_FILE_PLACEHOLDER} with scratch files. The input file holds {@code input};
     * an output file is only created when {@code needsOutputFile} is set.
     */
    public TempFileExecution runWithTempFiles(List<String> template, String input, boolean needsOutputFile,
                                              Duration timeout, boolean cleanup) throws InterruptedException {
        return runWithTempFiles(template, input, needsOutputFile ? "" : null, timeout, cleanup, CancellationToken.NONE);
    }

    /**
     * Variant that pre-populates the output scratch file with {@code outputContent}
     * ({@code null} means no output file).
     */
    public TempFileExecution runWithTempFiles(List<String> template, String input, String outputContent,
                                              Duration timeout, boolean cleanup,
                                              CancellationToken cancellation) throws InterruptedException {
        Path inputFile = null;
        Path outputFile = null;
        try {
            try {
                inputFile = createScratchFile("exec_in_");
                Files.writeString(inputFile, input == null ? "" : input, StandardCharsets.UTF_8);
                if (outputContent != null) {
                    outputFile = createScratchFile("exec_out_");
                    Files.writeString(outputFile, outputContent, StandardCharsets.UTF_8);
                }
            } catch (IOException e) {
                log.warn("Could not prepare scratch files: {}", e.getMessage());
                return new TempFileExecution(
                        ExecutionResult.launchFailure(template, "Execution error: " + e.getMessage(), 0.0),
                        inputFile, outputFile, null);
            }

            List<String> command = new ArrayList<>(template.size());
            for (String arg : template) {
                String substituted = arg.replace(INPUT_FILE_PLACEHOLDER, inputFile.toString());
                if (outputFile != null) {
                    substituted = substituted.replace(OUTPUT_FILE_PLACEHOLDER, outputFile.toString());
                }
                command.add(substituted);
            }
            ExecutionResult result = run(new ExecutionRequest(command, null, timeout, false, null, cancellation));
            String output = outputFile != null ? readQuietly(outputFile) : null;
            return new TempFileExecution(result, inputFile, outputFile, output);
        } finally {
            if (cleanup) {
                deleteQuietly(inputFile);
                deleteQuietly(outputFile);
            }
        }
    }

    /**
     * Runs stages in order, piping each stage's stdout into the next stage's stdin.
     *
     * @param seedInput       stdin for the first stage, may be {@code null}
     * @param stopOnFailure   stop after the first unsuccessful stage
     * @return one result per stage that ran
     */
    public List<ExecutionResult> runPipeline(List<PipelineStage> stages, String seedInput,
                                             Duration timeoutPerStage, boolean stopOnFailure,
                                             CancellationToken cancellation) throws InterruptedException {
        List<ExecutionResult> results = new ArrayList<>(stages.size());
        String current = seedInput;
        for (PipelineStage stage : stages) {
            ExecutionResult result = run(new ExecutionRequest(stage.command(), current, timeoutPerStage,
                    stage.monitorMemory(), null, cancellation));
            results.add(result);
            if (!result.succeeded()) {
                log.debug("Pipeline stage '{}' failed with code {}", stage.name(), result.returnCode());
                if (stopOnFailure || result.canceled()) {
                    break;
                }
            }
            current = result.stdout();
        }
        return results;
    }

    /** Number of processes launched by this executor that have not yet been reaped. */
    public int liveProcessCount() {
        return liveProcesses.size();
    }

    /**
     * Kills processes still running and stops the stream threads. Safe to call more than once.
     */
    @PreDestroy
    @Override
    public void close() {
        if (ioPool.isShutdown()) {
            return;
        }
        for (Process process : List.copyOf(liveProcesses)) {
            kill(process);
        }
        ioPool.shutdown();
        try {
            if (!ioPool.awaitTermination(STREAM_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                ioPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            ioPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("Process executor closed");
    }

    public boolean isClosed() {
        return ioPool.isShutdown();
    }

    // -- internals ------------------------------------------------------------

    private Path createScratchFile(String prefix) throws IOException {
        if (scratchDirectory != null) {
            Files.createDirectories(scratchDirectory);
            return Files.createTempFile(scratchDirectory, prefix, ".txt");
        }
        return Files.createTempFile(prefix, ".txt");
    }

    private static String readQuietly(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read scratch output {}: {}", file, e.getMessage());
            return null;
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete scratch file {}: {}", file, e.getMessage());
        }
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(STREAM_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Process {} did not exit after kill", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void feed(Process process, String input) {
        OutputStream stdin = process.getOutputStream();
        if (input == null) {
            closeStdin(stdin);
            return;
        }
        ioPool.execute(() -> {
            try (stdin) {
                stdin.write(input.getBytes(StandardCharsets.UTF_8));
                stdin.flush();
            } catch (IOException e) {
                // the process exited or closed stdin before reading everything
                log.debug("Stopped writing stdin: {}", e.getMessage());
            }
        });
    }

    private static void closeStdin(OutputStream stdin) {
        try {
            stdin.close();
        } catch (IOException e) {
            log.debug("Closing stdin failed: {}", e.getMessage());
        }
    }

    private StreamCollector collect(InputStream stream) {
        StreamCollector collector = new StreamCollector(stream);
        collector.future = CompletableFuture.runAsync(collector, ioPool);
        return collector;
    }

    private static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    /**
     * Drains a process stream into memory. Reads what is available even if a grandchild keeps
     * the pipe open past the process's exit.
     */
    private static final class StreamCollector implements Runnable {

        private final InputStream stream;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private CompletableFuture<Void> future;

        private StreamCollector(InputStream stream) {
            this.stream = stream;
        }

        @Override
        public void run() {
            byte[] chunk = new byte[8192];
            try (stream) {
                int read;
                while ((read = stream.read(chunk)) != -1) {
                    synchronized (buffer) {
                        buffer.write(chunk, 0, read);
                    }
                }
            } catch (IOException e) {
                log.debug("Output stream closed early: {}", e.getMessage());
            }
        }

        String await() throws InterruptedException {
            try {
                future.get(STREAM_GRACE.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.debug("Output still open after process exit, using what was read");
            } catch (ExecutionException e) {
                log.warn("Output collection failed: {}", e.getCause().getMessage());
            }
            synchronized (buffer) {
                return buffer.toString(StandardCharsets.UTF_8);
            }
        }
    }

    private static final class IoThreadFactory implements java.util.concurrent.ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "harness-io-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
