package com.phillippitts.voicecalc.service.stt.whisper;

import com.phillippitts.voicecalc.config.stt.WhisperConfig;
import com.phillippitts.voicecalc.exception.TranscriptionException;
import com.phillippitts.voicecalc.exception.TranscriptionExceptionBuilder;
import com.phillippitts.voicecalc.util.ProcessTimeouts;
import com.phillippitts.voicecalc.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs the whisper.cpp CLI for one WAV file and returns its stdout.
 *
 * <p>stdout and stderr are drained concurrently by daemon gobbler threads with byte caps, the
 * process is killed when it outlives {@code stt.whisper.timeout-seconds}, and every failure is
 * reported as a {@link TranscriptionException} with exit code, duration and a stderr snippet.
 * {@link #close()} is idempotent and kills a process left running by an interrupted call.
 */
public class WhisperProcessManager implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(WhisperProcessManager.class);

    static final String ENGINE = "whisper";

    /** Maximum bytes captured from stderr per run. */
    static final int STDERR_MAX_BYTES = 256 * 1024;

    /** Maximum stderr characters quoted in error messages. */
    static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    private final ProcessFactory processFactory;

    private volatile Process current;
    private volatile Thread outGobbler;
    private volatile Thread errGobbler;

    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    public WhisperProcessManager() {
        this(new DefaultProcessFactory());
    }

    WhisperProcessManager(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Executes whisper.cpp for the given WAV file.
     *
     * <pre>
     * ${binary} -m ${model} -f ${wav} -l ${language} -otxt -of stdout -t ${threads} -nt
     * </pre>
     *
     * @param wavPath WAV file created by the caller
     * @param cfg whisper configuration
     * @return stdout content (may be empty)
     * @throws TranscriptionException on timeout, non-zero exit, or I/O error
     */
    public String transcribe(Path wavPath, WhisperConfig cfg) {
        Objects.requireNonNull(wavPath, "wavPath");
        Objects.requireNonNull(cfg, "cfg");

        List<String> command = buildCommand(cfg, wavPath);
        long startTime = System.nanoTime();
        try {
            ProcessExecution exec = start(command, wavPath, cfg);
            boolean finished = exec.process().waitFor(cfg.timeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                destroyProcess(exec.process());
                throw whisperError("Timeout after " + cfg.timeoutSeconds() + "s", cfg, -1, exec.stderr(),
                        startTime, null);
            }
            joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = exec.process().exitValue();
            if (exitCode != 0) {
                throw whisperError("Non-zero exit: " + exitCode, cfg, exitCode, exec.stderr(), startTime, null);
            }
            String output = exec.stdout().toString();
            LOG.debug("Whisper finished in {} ms, stdout size={} chars", TimeUtils.elapsedMillis(startTime),
                    output.length());
            return output;
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw whisperError("I/O failure: " + e.getMessage(), cfg, -1, null, startTime, e);
        } finally {
            close();
        }
    }

    private ProcessExecution start(List<String> command, Path wavPath, WhisperConfig cfg) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();

        Process process = processFactory.start(command, wavPath.getParent());
        this.current = process;

        // Gobblers start before waiting so a full pipe cannot block the process
        Thread out = startGobbler(process.getInputStream(), stdout, "whisper-out", cfg.maxStdoutBytes());
        Thread err = startGobbler(process.getErrorStream(), stderr, "whisper-err", STDERR_MAX_BYTES);
        this.outGobbler = out;
        this.errGobbler = err;
        return new ProcessExecution(process, out, err, stdout, stderr);
    }

    // Package-private for tests
    List<String> buildCommand(WhisperConfig cfg, Path wavPath) {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolvePath(cfg.binaryPath()).toString());
        cmd.add("-m");
        cmd.add(resolvePath(cfg.modelPath()).toString());
        cmd.add("-f");
        cmd.add(wavPath.toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(cfg.language());
        cmd.add("-otxt");
        cmd.add("-of");
        cmd.add("stdout");
        cmd.add("-t");
        cmd.add(String.valueOf(cfg.threads()));
        cmd.add("-nt");
        return cmd;
    }

    private static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a sink until the cap is reached, then keeps draining without storing.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        sink.append(line, 0, Math.min(line.length(), Math.max(0, available)));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
        }
    }

    private TranscriptionException whisperError(String msg, WhisperConfig cfg, int exitCode,
                                                StringBuilder stderr, long startNano, Throwable cause) {
        String stderrSnippet = stderr == null ? "" : snippet(stderr, ERROR_SNIPPET_MAX_CHARS);
        TranscriptionExceptionBuilder builder = TranscriptionExceptionBuilder.create(msg)
                .engine(ENGINE)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNano))
                .metadata("binaryPath", cfg.binaryPath())
                .metadata("modelPath", cfg.modelPath())
                .metadata("stderr", stderrSnippet);
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }

    private static String snippet(StringBuilder sb, int maxChars) {
        synchronized (sb) {
            return sb.substring(0, Math.min(maxChars, sb.length()));
        }
    }

    /**
     * Idempotent cleanup of any running process and gobbler threads.
     */
    @Override
    public void close() {
        Process process = this.current;
        this.current = null;
        if (process != null && process.isAlive()) {
            destroyProcess(process);
        }
        joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        outGobbler = null;
        errGobbler = null;
    }
}
