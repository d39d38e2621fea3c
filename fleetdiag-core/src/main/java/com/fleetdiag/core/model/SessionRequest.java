package com.fleetdiag.core.model;

import java.util.List;

/**
 * A client's request for a new diagnostic session.
 * An empty or null instance list means every instance of the fleet participates.
 */
public record SessionRequest(
    ToolKind tool,
    String toolParameters,
    List<String> instances
) {
    public SessionRequest {
        instances = instances == null ? List.of() : List.copyOf(instances);
    }

    public static SessionRequest allInstances(ToolKind tool, String toolParameters) {
        return new SessionRequest(tool, toolParameters, List.of());
    }
}
