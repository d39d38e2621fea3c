package com.fleetdiag.api.rest;

import com.fleetdiag.core.exception.NotFoundException;
import com.fleetdiag.core.exception.UnsupportedToolException;
import com.fleetdiag.core.model.LocalSessionState;
import com.fleetdiag.core.model.LogFile;
import com.fleetdiag.core.model.Session;
import com.fleetdiag.core.model.SessionRequest;
import com.fleetdiag.core.model.ToolKind;
import com.fleetdiag.core.store.SessionStore;
import com.fleetdiag.engine.session.SessionOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * REST API for diagnostic sessions.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private final SessionStore sessionStore;
    private final SessionOrchestrator orchestrator;

    public SessionController(SessionStore sessionStore, SessionOrchestrator orchestrator) {
        this.sessionStore = sessionStore;
        this.orchestrator = orchestrator;
    }

    /**
     * Submit a new session. Rejected while another session is active.
     */
    @PostMapping
    public ResponseEntity<SessionResponse> submitSession(@RequestBody SubmitSessionRequest request) {
        ToolKind tool = ToolKind.fromString(request.tool());
        if (tool == ToolKind.UNKNOWN) {
            throw new UnsupportedToolException(tool);
        }

        Session session = sessionStore.submitSession(
            new SessionRequest(tool, request.toolParameters(), request.instances()));

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(SessionResponse.from(session));
    }

    /**
     * List sessions, newest first.
     */
    @GetMapping
    public ResponseEntity<List<SessionResponse>> listSessions() {
        List<SessionResponse> sessions = sessionStore.listSessions().stream()
            .map(SessionResponse::from)
            .collect(Collectors.toList());
        return ResponseEntity.ok(sessions);
    }

    @GetMapping("/active")
    public ResponseEntity<SessionResponse> getActiveSession() {
        Session session = sessionStore.getActiveSession()
            .orElseThrow(() -> new NotFoundException("Session", "active"));
        return ResponseEntity.ok(SessionResponse.from(session));
    }

    /**
     * Where the active session stands on the instance serving the request.
     */
    @GetMapping("/active/local-state")
    public ResponseEntity<LocalStateResponse> getLocalState() {
        Optional<Session> active = sessionStore.getActiveSession();
        LocalSessionState state = active.isPresent()
            ? orchestrator.localState(active.get().sessionId())
            : LocalSessionState.NO_ACTIVE_SESSION;

        return ResponseEntity.ok(new LocalStateResponse(
            orchestrator.instanceId(),
            active.map(Session::sessionId).orElse(null),
            state,
            orchestrator.runningCount()
        ));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionResponse> getSession(@PathVariable String sessionId) {
        Session session = sessionStore.getSession(sessionId)
            .orElseThrow(() -> new NotFoundException("Session", sessionId));
        return ResponseEntity.ok(SessionResponse.from(session));
    }

    // DTOs

    public record SubmitSessionRequest(
        String tool,
        String toolParameters,
        List<String> instances
    ) {}

    public record SessionResponse(
        String sessionId,
        ToolKind tool,
        String toolParameters,
        List<String> instances,
        boolean allInstances,
        Instant startTime,
        Instant endTime,
        Set<String> startedInstances,
        Set<String> completedInstances,
        boolean complete,
        List<LogFile> logs
    ) {
        public static SessionResponse from(Session session) {
            return new SessionResponse(
                session.sessionId(),
                session.tool(),
                session.toolParameters(),
                session.instances(),
                session.isAllInstances(),
                session.startTime(),
                session.endTime(),
                new TreeSet<>(session.startedInstances()),
                new TreeSet<>(session.completedInstances()),
                session.complete(),
                session.logs()
            );
        }
    }

    public record LocalStateResponse(
        String instanceId,
        String sessionId,
        LocalSessionState state,
        int runningCollections
    ) {}
}
