package com.labyrinth.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents one player's game: the labyrinth, the hero roster in turn order,
 * and where play currently stands.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GameSession {

    private String playerLogin;

    /** Incremented at the start of every round; 0 until the first round starts. */
    @Builder.Default
    private int round = 0;

    /** Offset of the active hero in {@link #heroes}. */
    @Builder.Default
    private int turnIndex = 0;

    private Labyrinth labyrinth;

    @Builder.Default
    private List<Hero> heroes = new ArrayList<>();

    @Builder.Default
    private GameStatus status = GameStatus.IN_PROGRESS;

    @Builder.Default
    private TurnState turnState = TurnState.AWAITING_ACTION;

    private String winnerName;

    public Hero getCurrentHero() {
        if (heroes.isEmpty()) return null;
        return heroes.get(turnIndex);
    }

    public boolean hasHeroes() {
        return !heroes.isEmpty();
    }

    public boolean isOver() {
        return status.isTerminal();
    }

    /**
     * Advance the turn to the next hero in the roster.
     *
     * @return true if the index wrapped back to the first hero
     */
    public boolean nextHero() {
        turnIndex = (turnIndex + 1) % heroes.size();
        return turnIndex == 0;
    }

    /**
     * Take a hero out of the roster, keeping the turn index on the hero who
     * should act next.
     *
     * @return true if removing the hero wrapped the turn index back to the first hero
     */
    public boolean removeHero(Hero hero) {
        int removedIndex = heroes.indexOf(hero);
        if (removedIndex < 0) {
            return false;
        }
        heroes.remove(removedIndex);
        if (heroes.isEmpty()) {
            turnIndex = 0;
            return false;
        }
        if (removedIndex < turnIndex) {
            turnIndex--;
        } else if (turnIndex >= heroes.size()) {
            turnIndex = 0;
            return true;
        }
        return false;
    }

    public void finish(GameStatus finalStatus) {
        this.status = finalStatus;
    }
}
