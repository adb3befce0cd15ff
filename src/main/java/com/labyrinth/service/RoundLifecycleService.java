package com.labyrinth.service;

import com.labyrinth.dto.RoundReport;
import com.labyrinth.model.GameSession;
import com.labyrinth.model.Labyrinth;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.stream.Collectors;

/**
 * Service responsible for starting rounds and announcing the round status.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoundLifecycleService {

    private final HazardGenerator hazardGenerator;

    /**
     * Start the next round: bump the counter and set a fresh hazard set in place of the old one.
     */
    public RoundReport startRound(GameSession session) {
        session.setRound(session.getRound() + 1);
        Labyrinth labyrinth = session.getLabyrinth();
        labyrinth.replaceHazards(hazardGenerator.regenerateHazards(labyrinth.getGrid(), labyrinth.getHazardCount()));

        RoundReport report = RoundReport.fromSession(session);
        log.info("Round {} started. Cells on fire: {}", report.getRound(),
                report.getHazards().stream().map(Object::toString).collect(Collectors.joining(", ")));
        for (RoundReport.HeroStatus hero : report.getHeroes()) {
            log.info("{} has {} health", hero.name(), hero.health());
            if (hero.carryingKey()) {
                log.info("{} carries the key", hero.name());
            }
        }
        return report;
    }

    /**
     * A session needs its opening round when no turn has been recorded yet.
     */
    public boolean needsOpeningRound(GameSession session) {
        return session.getTurnIndex() == 0;
    }
}
