package com.labyrinth.service;

import com.labyrinth.config.LabyrinthDefinition;
import com.labyrinth.config.LabyrinthLoader;
import com.labyrinth.dto.SessionSnapshot;
import com.labyrinth.exception.SaveFailedException;
import com.labyrinth.model.Coordinate;
import com.labyrinth.model.GameSession;
import com.labyrinth.model.GridMap;
import com.labyrinth.model.Hero;
import com.labyrinth.model.Labyrinth;
import com.labyrinth.repository.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Service responsible for the session lifecycle: creating, resuming, saving and discarding games.
 */
@Service
@Slf4j
public class GameSessionService {

    private final SessionStore sessionStore;
    private final LabyrinthLoader labyrinthLoader;
    private final RosterService rosterService;
    private final String layoutId;

    public GameSessionService(SessionStore sessionStore,
                              LabyrinthLoader labyrinthLoader,
                              RosterService rosterService,
                              @Value("${labyrinth.layout-id:classic}") String layoutId) {
        this.sessionStore = sessionStore;
        this.labyrinthLoader = labyrinthLoader;
        this.rosterService = rosterService;
        this.layoutId = layoutId;
    }

    /**
     * Create a game with an empty roster on the configured layout.
     */
    public GameSession newSession(String login) {
        log.info("Creating a new game for '{}'", login);
        return GameSession.builder()
                .playerLogin(login)
                .labyrinth(createLabyrinth())
                .build();
    }

    /**
     * Create a game and seat the named heroes in the given order.
     *
     * @throws com.labyrinth.exception.InvalidRosterException if the names do not form a valid roster
     */
    public GameSession newSession(String login, List<String> heroNames) {
        rosterService.validateHeroCount(heroNames.size());
        GameSession session = newSession(login);
        heroNames.forEach(name -> addHero(session, name));
        return session;
    }

    public Hero addHero(GameSession session, String name) {
        return rosterService.addHero(session, name, Coordinate.fromPair(layout().start()));
    }

    public Labyrinth createLabyrinth() {
        LabyrinthDefinition layout = layout();
        return Labyrinth.builder()
                .grid(GridMap.fromRows(layout.grid()))
                .keyPresent(true)
                .keyCoordinate(Coordinate.fromPair(layout.key()))
                .hearts(heartsOf(layout))
                .golemCoordinate(Coordinate.fromPair(layout.golem()))
                .hazardCount(layout.hazardCount())
                .build();
    }

    public boolean hasSavedSession(String login) {
        return sessionStore.hasSessionFor(login);
    }

    /**
     * Restore the saved game for a login, if there is a readable one.
     * A save whose content cannot be turned back into a game counts as no save.
     */
    public Optional<GameSession> resumeSession(String login) {
        LabyrinthDefinition layout = layout();
        return sessionStore.loadSessionFor(login)
                .flatMap(snapshot -> restore(login, snapshot, layout));
    }

    private Optional<GameSession> restore(String login, SessionSnapshot snapshot, LabyrinthDefinition layout) {
        GameSession session;
        try {
            session = snapshot.toSession(login, heartsOf(layout));
        } catch (IllegalArgumentException | NullPointerException e) {
            log.warn("Saved game for '{}' is damaged and cannot be loaded: {}", login, e.getMessage());
            return Optional.empty();
        }
        session.getLabyrinth().setHazardCount(layout.hazardCount());
        log.info("Loaded game for '{}' at round {} with {} hero(es)",
                login, session.getRound(), session.getHeroes().size());
        return Optional.of(session);
    }

    /**
     * Persist the session under its player's login.
     *
     * @return false if the save file could not be written; the game goes on either way
     */
    public boolean saveGame(GameSession session) {
        try {
            sessionStore.saveSessionFor(session.getPlayerLogin(), SessionSnapshot.fromSession(session));
            return true;
        } catch (SaveFailedException e) {
            log.warn("Game for '{}' was not saved: {}", session.getPlayerLogin(), e.getMessage());
            return false;
        }
    }

    public void discardSavedSession(String login) {
        sessionStore.deleteSessionFor(login);
        log.info("Saved game for '{}' was discarded", login);
    }

    private LabyrinthDefinition layout() {
        return labyrinthLoader.getLayout(layoutId);
    }

    private static Set<Coordinate> heartsOf(LabyrinthDefinition layout) {
        Set<Coordinate> hearts = new LinkedHashSet<>();
        if (layout.hearts() != null) {
            layout.hearts().forEach(pair -> hearts.add(Coordinate.fromPair(pair)));
        }
        return hearts;
    }
}
