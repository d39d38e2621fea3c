package com.fleetdiag.tools;

import com.fleetdiag.core.model.ToolKind;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Heap dump of the target JVM.
 */
public class MemoryDumpTool extends ProcessDiagnosticTool {

    public static final String DEFAULT_COMMAND = "jcmd {pid} GC.heap_dump {output}";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(10);

    public MemoryDumpTool(Path outputDir, long targetPid) {
        this(splitCommand(DEFAULT_COMMAND), outputDir, targetPid, DEFAULT_TIMEOUT);
    }

    public MemoryDumpTool(List<String> command, Path outputDir, long targetPid, Duration timeout) {
        super(ToolKind.MEMORY_DUMP, command, outputDir, targetPid, timeout);
    }

    @Override
    protected String outputFileName() {
        return "heap-" + targetPid() + ".hprof";
    }
}
