package com.labyrinth.dto;

import com.labyrinth.model.Coordinate;
import com.labyrinth.model.GameSession;
import com.labyrinth.model.Hero;
import com.labyrinth.model.Labyrinth;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Everything needed to resume a game, as written to the save file.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionSnapshot {

    private int round;
    private int turnIndex;
    private List<List<Integer>> hazards;
    private List<HeroSnapshot> heroes;
    private LabyrinthSnapshot labyrinth;

    public static SessionSnapshot fromSession(GameSession session) {
        return SessionSnapshot.builder()
                .round(session.getRound())
                .turnIndex(session.getTurnIndex())
                .hazards(LabyrinthSnapshot.toPairs(session.getLabyrinth().getHazards()))
                .heroes(session.getHeroes().stream()
                        .map(HeroSnapshot::fromHero)
                        .toList())
                .labyrinth(LabyrinthSnapshot.fromLabyrinth(session.getLabyrinth()))
                .build();
    }

    /**
     * Rebuild a playable session for the given login.
     *
     * @param fallbackHearts hearts of the configured layout, for saves without stored hearts
     */
    public GameSession toSession(String playerLogin, Set<Coordinate> fallbackHearts) {
        Labyrinth restored = labyrinth.toLabyrinth(fallbackHearts);
        if (hazards != null) {
            restored.replaceHazards(LabyrinthSnapshot.toCoordinates(hazards));
        }
        List<Hero> roster = new ArrayList<>();
        if (heroes != null) {
            heroes.forEach(hero -> roster.add(hero.toHero()));
        }
        int index = roster.isEmpty() ? 0 : Math.floorMod(turnIndex, roster.size());
        return GameSession.builder()
                .playerLogin(playerLogin)
                .round(round)
                .turnIndex(index)
                .labyrinth(restored)
                .heroes(roster)
                .build();
    }
}
