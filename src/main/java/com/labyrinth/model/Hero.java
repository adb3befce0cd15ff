package com.labyrinth.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * A player-controlled hero.
 * <p>
 * Heroes hold their own state and apply the effects of their actions; they never
 * look up the session. Whatever an action needs (the labyrinth, the target) is passed in.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Hero {

    public static final int MAX_HEALTH = 5;
    public static final int SELF_HEAL_CHARGES = 3;

    @EqualsAndHashCode.Include
    private String name;

    @Builder.Default
    private int health = MAX_HEALTH;

    @Builder.Default
    private boolean carryingKey = false;

    private Coordinate position;

    @Builder.Default
    private Coordinate previousPosition = Coordinate.of(0, 0);

    @Builder.Default
    private int remainingSelfHeals = SELF_HEAL_CHARGES;

    public static Hero startingAt(String name, Coordinate start) {
        return Hero.builder()
                .name(name)
                .position(start)
                .build();
    }

    public boolean isAlive() {
        return health > 0;
    }

    public boolean isAtFullHealth() {
        return health >= MAX_HEALTH;
    }

    public boolean isAt(Coordinate coordinate) {
        return position != null && position.equals(coordinate);
    }

    /**
     * Strike another hero for one point. Health may dip below zero; liveness treats that as dead.
     */
    public void attack(Hero target) {
        target.takeDamage(1);
    }

    public void takeDamage(int amount) {
        health -= amount;
    }

    public void kill() {
        health = 0;
    }

    /**
     * @return true if the key was taken, false if it is not here
     */
    public boolean pickUpKey(Labyrinth labyrinth) {
        if (!labyrinth.isKeyAt(position)) {
            return false;
        }
        carryingKey = true;
        labyrinth.takeKey();
        return true;
    }

    /**
     * Restore full health at a heart.
     *
     * @return false when not on a heart or already at full health; no turn is spent then
     */
    public boolean healAtStation(Labyrinth labyrinth) {
        if (!labyrinth.isHeartAt(position) || isAtFullHealth()) {
            return false;
        }
        health = MAX_HEALTH;
        return true;
    }

    /**
     * Use one self-heal charge for one point of health.
     *
     * @return false when no charges remain or health is already full
     */
    public boolean selfHeal() {
        if (remainingSelfHeals <= 0 || isAtFullHealth()) {
            return false;
        }
        health++;
        remainingSelfHeals--;
        return true;
    }

    /**
     * Move to a new cell.
     *
     * @param rememberDeparture whether the cell being left becomes {@code previousPosition}
     */
    public void relocate(Coordinate target, boolean rememberDeparture) {
        if (rememberDeparture) {
            previousPosition = position;
        }
        position = target;
    }

    /**
     * Give up the key, e.g. on death.
     */
    public void releaseKey() {
        carryingKey = false;
    }
}
