package com.fleetdiag.engine.persistence;

import com.fleetdiag.core.exception.NotFoundException;
import com.fleetdiag.core.exception.SessionAlreadyActiveException;
import com.fleetdiag.core.model.LogFile;
import com.fleetdiag.core.model.Session;
import com.fleetdiag.core.model.SessionRequest;
import com.fleetdiag.core.store.InstanceRegistry;
import com.fleetdiag.core.store.SessionStore;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory implementation of SessionStore.
 * For single-node use and testing; several orchestrators sharing one instance
 * behave like a fleet sharing one store.
 */
public class InMemorySessionStore implements SessionStore {

    private final Map<String, Session> sessions;
    private final InstanceRegistry registry;
    private final Clock clock;

    public InMemorySessionStore(InstanceRegistry registry, Clock clock) {
        this(new LinkedHashMap<>(), registry, clock);
    }

    private InMemorySessionStore(Map<String, Session> sessions, InstanceRegistry registry, Clock clock) {
        this.sessions = sessions;
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * View of this store acting for another instance, sharing the same sessions.
     */
    public InMemorySessionStore forInstance(InstanceRegistry otherRegistry) {
        return new InMemorySessionStore(sessions, otherRegistry, clock);
    }

    @Override
    public Optional<Session> getActiveSession() {
        synchronized (sessions) {
            return sessions.values().stream()
                .filter(s -> !s.complete())
                .max(Comparator.comparing(Session::startTime));
        }
    }

    @Override
    public boolean shouldCollectOnThisInstance(Session session) {
        return current(session).includes(registry.localInstanceId());
    }

    @Override
    public boolean hasThisInstanceCollected(Session session) {
        return current(session).hasCompleted(registry.localInstanceId());
    }

    @Override
    public void markInstanceStarted(Session session) {
        synchronized (sessions) {
            sessions.put(session.sessionId(), current(session).withStarted(registry.localInstanceId()));
        }
    }

    @Override
    public void markInstanceComplete(Session session) {
        synchronized (sessions) {
            sessions.put(session.sessionId(), current(session).withCompleted(registry.localInstanceId()));
        }
    }

    @Override
    public boolean allInstancesCollected(Session session) {
        return current(session).allCollected(registry.liveInstances());
    }

    @Override
    public boolean markSessionComplete(Session session) {
        synchronized (sessions) {
            Session stored = current(session);
            if (stored.complete()) {
                return false;
            }
            sessions.put(session.sessionId(), stored.withComplete(clock.instant()));
            return true;
        }
    }

    @Override
    public void addLogs(Session session, List<LogFile> logs) {
        if (logs.isEmpty()) {
            return;
        }
        synchronized (sessions) {
            sessions.put(session.sessionId(), current(session).withLogs(logs));
        }
    }

    @Override
    public Session submitSession(SessionRequest request) {
        synchronized (sessions) {
            Optional<Session> active = getActiveSession();
            if (active.isPresent()) {
                throw new SessionAlreadyActiveException(active.get().sessionId());
            }
            Session session = Session.create(request, clock.instant());
            sessions.put(session.sessionId(), session);
            return session;
        }
    }

    @Override
    public Optional<Session> getSession(String sessionId) {
        synchronized (sessions) {
            return Optional.ofNullable(sessions.get(sessionId));
        }
    }

    @Override
    public List<Session> listSessions() {
        synchronized (sessions) {
            return sessions.values().stream()
                .sorted(Comparator.comparing(Session::startTime).reversed())
                .collect(Collectors.toList());
        }
    }

    private Session current(Session session) {
        synchronized (sessions) {
            Session stored = sessions.get(session.sessionId());
            if (stored == null) {
                throw new NotFoundException("Session", session.sessionId());
            }
            return stored;
        }
    }
}
