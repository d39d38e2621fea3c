package com.fleetdiag.tools;

import com.fleetdiag.core.model.ToolKind;
import com.fleetdiag.core.tool.CancellationSignal;
import com.fleetdiag.core.tool.DiagnosticToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Time-bounded CPU / execution trace of the target JVM via Flight Recorder.
 *
 * {@code JFR.start} returns as soon as the recording begins, so after the command
 * exits this tool waits out the recording and then for the file to stop growing.
 * The recording length comes from the {@code duration} tool parameter.
 */
public class CpuTraceTool extends ProcessDiagnosticTool {

    private static final Logger log = LoggerFactory.getLogger(CpuTraceTool.class);

    public static final String DEFAULT_COMMAND =
        "jcmd {pid} JFR.start duration={durationSeconds}s filename={output}";
    public static final Duration DEFAULT_DURATION = Duration.ofSeconds(60);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(2);
    public static final String DURATION_PARAMETER = "duration";

    private static final Duration MAX_DURATION = Duration.ofMinutes(15);
    private static final long POLL_MILLIS = 250;

    private final Duration defaultDuration;
    private final Duration flushGrace;

    public CpuTraceTool(Path outputDir, long targetPid) {
        this(splitCommand(DEFAULT_COMMAND), outputDir, targetPid, DEFAULT_TIMEOUT, DEFAULT_DURATION, Duration.ofSeconds(30));
    }

    public CpuTraceTool(
            List<String> command,
            Path outputDir,
            long targetPid,
            Duration timeout,
            Duration defaultDuration,
            Duration flushGrace) {
        super(ToolKind.PROFILER, command, outputDir, targetPid, timeout);
        this.defaultDuration = defaultDuration;
        this.flushGrace = flushGrace;
    }

    @Override
    protected String outputFileName() {
        return "trace-" + targetPid() + ".jfr";
    }

    @Override
    protected Duration collectionDuration(ToolParameters parameters) {
        Duration duration = parameters.getDuration(DURATION_PARAMETER, defaultDuration);
        if (duration.compareTo(MAX_DURATION) > 0) {
            throw new IllegalArgumentException("Trace duration " + duration + " exceeds " + MAX_DURATION);
        }
        return duration;
    }

    @Override
    protected void awaitArtifacts(Path output, ToolParameters parameters, CancellationSignal cancellation)
            throws DiagnosticToolException {
        Duration duration = collectionDuration(parameters);
        long deadline = System.nanoTime() + duration.plus(flushGrace).toNanos();
        long lastSize = -1;

        while (System.nanoTime() < deadline) {
            cancellation.throwIfCancelled();
            long size = sizeOf(output);
            if (size > 0 && size == lastSize) {
                log.debug("Trace {} complete at {} bytes", output.getFileName(), size);
                return;
            }
            lastSize = size;
            sleep();
        }

        if (sizeOf(output) <= 0) {
            throw new DiagnosticToolException(DiagnosticToolException.TIMED_OUT,
                "Trace file " + output + " not written within " + duration.plus(flushGrace));
        }
        log.warn("Trace {} still growing after {}, collecting as is", output.getFileName(), duration.plus(flushGrace));
    }

    private static long sizeOf(Path file) {
        try {
            return Files.exists(file) ? Files.size(file) : -1;
        } catch (IOException e) {
            return -1;
        }
    }

    private static void sleep() throws DiagnosticToolException {
        try {
            Thread.sleep(POLL_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw DiagnosticToolException.cancelled("Trace wait interrupted");
        }
    }
}
