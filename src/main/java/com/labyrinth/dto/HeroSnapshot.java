package com.labyrinth.dto;

import com.labyrinth.model.Coordinate;
import com.labyrinth.model.Hero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Persisted state of one hero.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HeroSnapshot {

    private String name;
    private int health;
    private List<Integer> position;
    private List<Integer> previousPosition;
    private boolean hasKey;
    private int remainingSelfHeals;

    public static HeroSnapshot fromHero(Hero hero) {
        return HeroSnapshot.builder()
                .name(hero.getName())
                .health(hero.getHealth())
                .position(hero.getPosition().toPair())
                .previousPosition(hero.getPreviousPosition().toPair())
                .hasKey(hero.isCarryingKey())
                .remainingSelfHeals(hero.getRemainingSelfHeals())
                .build();
    }

    /**
     * Rebuild the hero, capping health at full and treating negative charges as none.
     */
    public Hero toHero() {
        return Hero.builder()
                .name(name)
                .health(Math.min(health, Hero.MAX_HEALTH))
                .position(Coordinate.fromPair(position))
                .previousPosition(Coordinate.fromPair(previousPosition))
                .carryingKey(hasKey)
                .remainingSelfHeals(Math.max(remainingSelfHeals, 0))
                .build();
    }
}
