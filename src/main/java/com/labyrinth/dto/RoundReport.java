package com.labyrinth.dto;

import com.labyrinth.model.Coordinate;
import com.labyrinth.model.GameSession;
import com.labyrinth.model.Hero;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Status announced at the start of each round.
 */
@Data
@Builder
public class RoundReport {
    private int round;
    private List<Coordinate> hazards;
    private List<HeroStatus> heroes;

    public static RoundReport fromSession(GameSession session) {
        return RoundReport.builder()
                .round(session.getRound())
                .hazards(List.copyOf(session.getLabyrinth().getHazards()))
                .heroes(session.getHeroes().stream()
                        .map(HeroStatus::of)
                        .toList())
                .build();
    }

    public record HeroStatus(String name, int health, boolean carryingKey) {
        public static HeroStatus of(Hero hero) {
            return new HeroStatus(hero.getName(), hero.getHealth(), hero.isCarryingKey());
        }
    }
}
