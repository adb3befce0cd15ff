package com.labyrinth.service;

import com.labyrinth.exception.InvalidRosterException;
import com.labyrinth.model.Coordinate;
import com.labyrinth.model.GameSession;
import com.labyrinth.model.Hero;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Service responsible for assembling the hero roster of a new game.
 */
@Service
@Slf4j
public class RosterService {

    private final int maxHeroes;

    public RosterService(@Value("${labyrinth.max-heroes:5}") int maxHeroes) {
        this.maxHeroes = maxHeroes;
    }

    public int getMaxHeroes() {
        return maxHeroes;
    }

    /**
     * Check a requested hero count before any names are asked for.
     *
     * @throws InvalidRosterException if the count is outside 1..maxHeroes
     */
    public void validateHeroCount(int count) {
        if (count < 1 || count > maxHeroes) {
            throw new InvalidRosterException("The number of heroes must be between 1 and " + maxHeroes);
        }
    }

    /**
     * Add a hero to the end of the turn order. The roster is left untouched when the hero is rejected.
     *
     * @throws InvalidRosterException if the roster is full or the name is empty or taken
     */
    public Hero addHero(GameSession session, String name, Coordinate start) {
        if (session.getHeroes().size() >= maxHeroes) {
            throw new InvalidRosterException("The maximum number of heroes is " + maxHeroes);
        }
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidRosterException("Enter a name for the hero");
        }
        boolean taken = session.getHeroes().stream().anyMatch(hero -> hero.getName().equals(trimmed));
        if (taken) {
            throw new InvalidRosterException("Hero name already taken: " + trimmed);
        }

        Hero hero = Hero.startingAt(trimmed, start);
        session.getHeroes().add(hero);
        log.info("Hero {} joined the game at {}", trimmed, start);
        return hero;
    }
}
