package com.labyrinth.service;

import com.labyrinth.model.Coordinate;
import com.labyrinth.model.Direction;
import com.labyrinth.model.Hero;
import com.labyrinth.model.HeroAction;

import java.util.List;
import java.util.Optional;

/**
 * Source of the choices the turn engine needs from the player.
 * Every call blocks until the player has decided; implementations re-ask on bad input.
 */
public interface PlayerDecisions {

    /**
     * Pick one of the offered actions for the active hero.
     */
    HeroAction chooseAction(Hero hero, List<HeroAction> options);

    /**
     * Pick a direction to move in, or empty to back out of moving.
     */
    Optional<Direction> chooseDirection(Hero hero);

    /**
     * Confirm stepping back onto the previous cell, which kills the hero.
     */
    boolean confirmRetreat(Hero hero, Coordinate target);
}
