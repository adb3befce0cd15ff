package com.labyrinth.repository;

import com.labyrinth.dto.SessionSnapshot;

import java.util.Optional;

/**
 * Saved games keyed by player login.
 * <p>
 * Implementations never fail on a missing or unreadable store: reads report "no save"
 * and writes start from an empty collection.
 */
public interface SessionStore {

    Optional<SessionSnapshot> loadSessionFor(String login);

    boolean hasSessionFor(String login);

    /**
     * Insert or replace the save for a login, keeping every other player's save.
     */
    void saveSessionFor(String login, SessionSnapshot snapshot);

    void deleteSessionFor(String login);
}
