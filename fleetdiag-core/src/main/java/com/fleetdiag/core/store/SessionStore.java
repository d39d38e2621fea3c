package com.fleetdiag.core.store;

import com.fleetdiag.core.model.LogFile;
import com.fleetdiag.core.model.Session;
import com.fleetdiag.core.model.SessionRequest;

import java.util.List;
import java.util.Optional;

/**
 * Shared store of diagnostic sessions.
 * Every instance of the fleet talks to the same store; implementations must tolerate
 * concurrent readers and writers from several processes.
 *
 * Instance-scoped operations act on behalf of the local instance the store was
 * created for. The session argument identifies the session; implementations read
 * its current state from storage rather than trusting the passed snapshot.
 */
public interface SessionStore {

    /**
     * Find the single session that is not yet complete.
     *
     * @return The active session, if any
     */
    Optional<Session> getActiveSession();

    /**
     * Check if the local instance is in the session's participation scope.
     */
    boolean shouldCollectOnThisInstance(Session session);

    /**
     * Check if the local instance already reported completion for the session.
     */
    boolean hasThisInstanceCollected(Session session);

    /**
     * Record that the local instance started collecting.
     */
    void markInstanceStarted(Session session);

    /**
     * Record that the local instance finished collecting.
     */
    void markInstanceComplete(Session session);

    /**
     * Check if every instance required by the session has completed.
     */
    boolean allInstancesCollected(Session session);

    /**
     * Mark the session complete. Idempotent.
     *
     * @return true if this call completed the session, false if it was already complete
     */
    boolean markSessionComplete(Session session);

    /**
     * Append artifacts collected by the local instance.
     */
    void addLogs(Session session, List<LogFile> logs);

    /**
     * Create a new active session.
     *
     * @param request The session request
     * @return The created session
     * @throws com.fleetdiag.core.exception.SessionAlreadyActiveException if a session is active
     */
    Session submitSession(SessionRequest request);

    /**
     * Find a session by id.
     */
    Optional<Session> getSession(String sessionId);

    /**
     * All known sessions, newest first.
     */
    List<Session> listSessions();
}
