package com.fleetdiag.tools;

import com.fleetdiag.core.model.LogFile;
import com.fleetdiag.core.model.ToolKind;
import com.fleetdiag.core.tool.CancellationSignal;
import com.fleetdiag.core.tool.DiagnosticTool;
import com.fleetdiag.core.tool.DiagnosticToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Base class for tools that run an external command against a target process.
 *
 * The command is a template whose arguments may contain {@code {pid}},
 * {@code {output}} and {@code {durationSeconds}}. Every invocation gets a fresh
 * working directory under the output directory; combined stdout/stderr go to
 * {@code tool.log} there, and every other file left in it is an artifact.
 *
 * Cancellation destroys the process.
 */
public abstract class ProcessDiagnosticTool implements DiagnosticTool {

    private static final Logger log = LoggerFactory.getLogger(ProcessDiagnosticTool.class);

    public static final String TOOL_LOG = "tool.log";
    private static final int MAX_ERROR_CHARS = 512;
    private static final DateTimeFormatter DIR_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS");

    private final ToolKind kind;
    private final List<String> commandTemplate;
    private final Path outputDir;
    private final long targetPid;
    private final Duration timeout;

    protected ProcessDiagnosticTool(
            ToolKind kind,
            List<String> commandTemplate,
            Path outputDir,
            long targetPid,
            Duration timeout) {
        if (commandTemplate == null || commandTemplate.isEmpty()) {
            throw new IllegalArgumentException("Command cannot be empty for " + kind);
        }
        this.kind = kind;
        this.commandTemplate = List.copyOf(commandTemplate);
        this.outputDir = outputDir;
        this.targetPid = targetPid;
        this.timeout = timeout;
    }

    /**
     * Split a configured command line on whitespace.
     */
    public static List<String> splitCommand(String commandLine) {
        if (commandLine == null || commandLine.isBlank()) {
            return List.of();
        }
        return Arrays.asList(commandLine.trim().split("\\s+"));
    }

    @Override
    public ToolKind kind() {
        return kind;
    }

    /**
     * File name the command is asked to write to.
     */
    protected abstract String outputFileName();

    /**
     * How long the collection runs, for tools that sample over time.
     */
    protected Duration collectionDuration(ToolParameters parameters) {
        return Duration.ZERO;
    }

    /**
     * Wait for artifacts the command produces after it exits. Default: none.
     */
    protected void awaitArtifacts(Path output, ToolParameters parameters, CancellationSignal cancellation)
            throws DiagnosticToolException {
    }

    @Override
    public List<LogFile> invoke(String toolParameters, CancellationSignal cancellation) throws DiagnosticToolException {
        cancellation.throwIfCancelled();

        ToolParameters parameters;
        Duration duration;
        try {
            parameters = ToolParameters.parse(toolParameters);
            duration = collectionDuration(parameters);
        } catch (IllegalArgumentException e) {
            throw new DiagnosticToolException(DiagnosticToolException.INVALID_PARAMETERS, e.getMessage(), e);
        }

        Path workDir = createWorkDir();
        Path output = workDir.resolve(outputFileName());
        Path toolLog = workDir.resolve(TOOL_LOG);
        List<String> command = render(Map.of(
            "{pid}", String.valueOf(targetPid),
            "{output}", output.toString(),
            "{durationSeconds}", String.valueOf(duration.toSeconds())
        ));

        log.info("Running {} collection: {}", kind, command);
        Process process = start(command, workDir, toolLog);
        cancellation.onCancel(process::destroyForcibly);

        waitForExit(process, timeout.plus(duration), cancellation);
        cancellation.throwIfCancelled();

        int exit = process.exitValue();
        if (exit != 0) {
            throw new DiagnosticToolException(DiagnosticToolException.EXIT_CODE,
                kind + " command exited with " + exit + ": " + readTail(toolLog));
        }

        awaitArtifacts(output, parameters, cancellation);

        List<LogFile> artifacts = collectArtifacts(workDir);
        if (artifacts.isEmpty()) {
            throw new DiagnosticToolException(DiagnosticToolException.NO_ARTIFACTS,
                kind + " command produced no artifacts in " + workDir);
        }
        log.info("{} collection produced {} artifact(s) in {}", kind, artifacts.size(), workDir);
        return artifacts;
    }

    private Path createWorkDir() throws DiagnosticToolException {
        String name = kind.name().toLowerCase(Locale.ROOT) + "-" + LocalDateTime.now(ZoneOffset.UTC).format(DIR_FORMAT)
            + "-" + Long.toHexString(System.nanoTime());
        try {
            return Files.createDirectories(outputDir.resolve(name));
        } catch (IOException e) {
            throw new DiagnosticToolException(DiagnosticToolException.LAUNCH_FAILED,
                "Cannot create output directory under " + outputDir, e);
        }
    }

    List<String> render(Map<String, String> placeholders) {
        List<String> command = new ArrayList<>(commandTemplate.size());
        for (String arg : commandTemplate) {
            String rendered = arg;
            for (Map.Entry<String, String> entry : placeholders.entrySet()) {
                rendered = rendered.replace(entry.getKey(), entry.getValue());
            }
            command.add(rendered);
        }
        return command;
    }

    private Process start(List<String> command, Path workDir, Path toolLog) throws DiagnosticToolException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workDir.toFile());
        pb.redirectErrorStream(true);
        pb.redirectOutput(toolLog.toFile());
        try {
            return pb.start();
        } catch (IOException e) {
            throw new DiagnosticToolException(DiagnosticToolException.LAUNCH_FAILED,
                kind + " command failed to start: " + e.getMessage(), e);
        }
    }

    private void waitForExit(Process process, Duration limit, CancellationSignal cancellation)
            throws DiagnosticToolException {
        try {
            boolean finished = process.waitFor(limit.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                cancellation.throwIfCancelled();
                throw new DiagnosticToolException(DiagnosticToolException.TIMED_OUT,
                    kind + " command timed out after " + limit);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw DiagnosticToolException.cancelled(kind + " collection interrupted");
        }
    }

    private List<LogFile> collectArtifacts(Path workDir) throws DiagnosticToolException {
        try (Stream<Path> files = Files.list(workDir)) {
            return files.filter(Files::isRegularFile)
                .filter(p -> !p.getFileName().toString().equals(TOOL_LOG))
                .sorted()
                .map(p -> LogFile.of(p.toString()))
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new DiagnosticToolException(DiagnosticToolException.NO_ARTIFACTS,
                "Cannot list artifacts in " + workDir, e);
        }
    }

    private String readTail(Path toolLog) {
        try {
            String raw = Files.readString(toolLog, StandardCharsets.UTF_8);
            String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
            if (normalized.length() <= MAX_ERROR_CHARS) {
                return normalized;
            }
            return "..." + normalized.substring(normalized.length() - MAX_ERROR_CHARS);
        } catch (IOException e) {
            return "(no output)";
        }
    }

    public Path outputDir() {
        return outputDir;
    }

    public long targetPid() {
        return targetPid;
    }
}
