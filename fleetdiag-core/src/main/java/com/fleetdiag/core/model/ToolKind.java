package com.fleetdiag.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Diagnostic tools a session can ask the fleet to run.
 */
public enum ToolKind {
    /**
     * Heap snapshot of the target process.
     */
    MEMORY_DUMP,

    /**
     * Execution / CPU trace of the target process for a bounded duration.
     */
    PROFILER,

    /**
     * Any value read from storage that does not name a known tool.
     * Sessions carrying it fail fatally on every instance.
     */
    UNKNOWN;

    /**
     * Lenient parse used for JSON and request input. Accepts the enum names as well as
     * the spellings other writers use ({@code MemoryDump}, {@code memory-dump},
     * {@code CpuTrace}, {@code ClrTrace}).
     */
    @JsonCreator
    public static ToolKind fromString(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.replace("-", "").replace("_", "").trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "MEMORYDUMP" -> MEMORY_DUMP;
            case "PROFILER", "CPUTRACE", "CLRTRACE" -> PROFILER;
            default -> UNKNOWN;
        };
    }
}
