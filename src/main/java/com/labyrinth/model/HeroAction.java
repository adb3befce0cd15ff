package com.labyrinth.model;

import java.util.List;

/**
 * An entry in the action menu offered to the active hero.
 *
 * @param type   what the action does
 * @param target the hero to strike, only for {@link ActionType#ATTACK}
 */
public record HeroAction(ActionType type, Hero target) {

    /** Actions offered on every turn, after the contextual ones. */
    public static final List<HeroAction> STATIC_ACTIONS = List.of(
            new HeroAction(ActionType.MOVE, null),
            new HeroAction(ActionType.SELF_HEAL, null),
            new HeroAction(ActionType.SAVE_GAME, null),
            new HeroAction(ActionType.QUIT, null));

    public static HeroAction attack(Hero target) {
        return new HeroAction(ActionType.ATTACK, target);
    }

    public static HeroAction pickUpKey() {
        return new HeroAction(ActionType.PICK_UP_KEY, null);
    }

    public static HeroAction healAtStation() {
        return new HeroAction(ActionType.HEAL_AT_STATION, null);
    }

    public String label() {
        return type == ActionType.ATTACK ? "Attack " + target.getName() + " with the sword" : type.getLabel();
    }
}
