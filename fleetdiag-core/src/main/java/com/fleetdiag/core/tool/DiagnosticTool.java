package com.fleetdiag.core.tool;

import com.fleetdiag.core.model.LogFile;
import com.fleetdiag.core.model.ToolKind;

import java.util.List;

/**
 * A diagnostic collector run on one instance for one session.
 * Implementations produce artifact files and return them in order.
 */
public interface DiagnosticTool {

    /**
     * The tool kind this implementation serves.
     */
    ToolKind kind();

    /**
     * Run the tool.
     * 
     * @param toolParameters Opaque parameters from the session
     * @param cancellation Signal to stop early
     * @return Artifacts produced, with at least {@code fullPath} set
     * @throws DiagnosticToolException if the tool fails or is cancelled
     */
    List<LogFile> invoke(String toolParameters, CancellationSignal cancellation) throws DiagnosticToolException;
}
