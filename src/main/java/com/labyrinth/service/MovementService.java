package com.labyrinth.service;

import com.labyrinth.dto.MoveResult;
import com.labyrinth.model.Coordinate;
import com.labyrinth.model.Direction;
import com.labyrinth.model.GridMap;
import com.labyrinth.model.Hero;
import com.labyrinth.model.Labyrinth;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service responsible for moving a hero one cell and resolving what waits on arrival.
 */
@Service
@Slf4j
public class MovementService {

    /**
     * Move the hero one step.
     * <p>
     * Walls and the grid edge cost one health and leave the hero in place. Stepping back onto
     * the previous cell from plain floor must be confirmed and is fatal. After arriving, fire
     * costs one health and the golem either lets a key carrier through or kills the hero.
     */
    public MoveResult move(Labyrinth labyrinth, Hero hero, Direction direction, PlayerDecisions decisions) {
        GridMap grid = labyrinth.getGrid();
        Coordinate from = hero.getPosition();
        Coordinate to = from.step(direction);

        if (!grid.isPassable(to)) {
            hero.takeDamage(1);
            log.info("Hero {} crashed into a wall and loses one health", hero.getName());
            return result(MoveResult.Outcome.COLLIDED_WITH_WALL, from, from, false);
        }

        boolean departingPlainFloor = grid.isPlainFloor(from);
        if (departingPlainFloor && to.equals(hero.getPreviousPosition())) {
            log.info("Hero {} got scared and wants to turn back", hero.getName());
            if (!decisions.confirmRetreat(hero, to)) {
                return result(MoveResult.Outcome.RETREAT_DECLINED, from, from, false);
            }
            hero.kill();
            log.info("Hero {} turned back and was lost in the labyrinth", hero.getName());
            return result(MoveResult.Outcome.RETREAT_FATAL, from, from, false);
        }

        hero.relocate(to, departingPlainFloor);
        log.info("Hero {} moved to cell {}", hero.getName(), to);

        boolean caughtFire = false;
        if (labyrinth.isHazardAt(to)) {
            hero.takeDamage(1);
            caughtFire = true;
            log.info("Hero {} stepped into a burning cell and loses one health", hero.getName());
        }

        if (labyrinth.isGolemAt(to)) {
            log.info("Hero {} met the golem", hero.getName());
            if (hero.isCarryingKey()) {
                log.info("Hero {} handed the key to the golem and passed through", hero.getName());
                return result(MoveResult.Outcome.VICTORY, from, to, caughtFire);
            }
            hero.kill();
            log.info("Hero {} had no key for the golem and was struck down", hero.getName());
            return result(MoveResult.Outcome.SLAIN_BY_GOLEM, from, to, caughtFire);
        }

        return result(MoveResult.Outcome.MOVED, from, to, caughtFire);
    }

    private MoveResult result(MoveResult.Outcome outcome, Coordinate from, Coordinate to, boolean caughtFire) {
        return MoveResult.builder()
                .outcome(outcome)
                .from(from)
                .to(to)
                .caughtFire(caughtFire)
                .build();
    }
}
