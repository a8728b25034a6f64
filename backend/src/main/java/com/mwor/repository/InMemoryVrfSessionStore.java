package com.mwor.repository;

import com.mwor.model.VrfSession;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Repository
public class InMemoryVrfSessionStore implements VrfSessionStore {

    private final ConcurrentMap<String, VrfSession> sessions = new ConcurrentHashMap<>();

    @Override
    public boolean putIfAbsent(VrfSession session) {
        return sessions.putIfAbsent(session.getSessionId(), session) == null;
    }

    @Override
    public Optional<VrfSession> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public Collection<VrfSession> all() {
        return List.copyOf(sessions.values());
    }

    @Override
    public boolean remove(VrfSession session) {
        return sessions.remove(session.getSessionId(), session);
    }

    @Override
    public int size() {
        return sessions.size();
    }
}
