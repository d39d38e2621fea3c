package com.fleetdiag.engine.session;

import com.fleetdiag.core.exception.UnsupportedToolException;
import com.fleetdiag.core.model.ToolKind;
import com.fleetdiag.core.tool.DiagnosticTool;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Resolves a session's tool kind to the tool that runs it on this instance.
 */
public class DiagnosticToolRegistry {

    private final Map<ToolKind, DiagnosticTool> tools = new EnumMap<>(ToolKind.class);

    public DiagnosticToolRegistry(Collection<? extends DiagnosticTool> tools) {
        for (DiagnosticTool tool : tools) {
            if (tool.kind() == ToolKind.UNKNOWN) {
                throw new IllegalArgumentException("Cannot register a tool for " + ToolKind.UNKNOWN);
            }
            DiagnosticTool previous = this.tools.putIfAbsent(tool.kind(), tool);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate tool for " + tool.kind());
            }
        }
    }

    /**
     * Get the tool for a kind.
     *
     * @throws UnsupportedToolException if the kind is unknown or has no tool registered
     */
    public DiagnosticTool resolve(ToolKind kind) {
        if (kind == null) {
            throw new UnsupportedToolException(ToolKind.UNKNOWN);
        }
        DiagnosticTool tool = switch (kind) {
            case MEMORY_DUMP, PROFILER -> tools.get(kind);
            case UNKNOWN -> null;
        };
        if (tool == null) {
            throw new UnsupportedToolException(kind);
        }
        return tool;
    }

    public Set<ToolKind> supportedKinds() {
        return Set.copyOf(tools.keySet());
    }
}
