package com.mwor.repository;

import com.mwor.model.VrfSession;

import java.util.Collection;
import java.util.Optional;

/**
 * Keyed store of live VRF sessions. Sessions hold secret seed material and must stay in process.
 */
public interface VrfSessionStore {

    /**
     * @return false when a session with the same id already exists
     */
    boolean putIfAbsent(VrfSession session);

    Optional<VrfSession> find(String sessionId);

    Collection<VrfSession> all();

    /**
     * Removes the session only if the stored instance is the given one.
     */
    boolean remove(VrfSession session);

    int size();
}
