package com.labyrinth.service;

import com.labyrinth.dto.MoveResult;
import com.labyrinth.model.ActionOutcome;
import com.labyrinth.model.Direction;
import com.labyrinth.model.GameSession;
import com.labyrinth.model.GameStatus;
import com.labyrinth.model.Hero;
import com.labyrinth.model.HeroAction;
import com.labyrinth.model.Labyrinth;
import com.labyrinth.model.TurnState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The turn state machine: whose turn it is, what the active hero may do, and what
 * happens once it has acted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TurnEngine {

    private final MovementService movementService;
    private final RoundLifecycleService roundLifecycleService;
    private final GameSessionService gameSessionService;

    /**
     * Play turns until the game reaches a terminal state.
     * Opens round 1 first when no turn has been recorded yet.
     */
    public TurnState play(GameSession session, PlayerDecisions decisions) {
        log.info("The game has begun");
        if (session.hasHeroes() && !session.isOver() && roundLifecycleService.needsOpeningRound(session)) {
            roundLifecycleService.startRound(session);
        }
        TurnState state;
        do {
            state = playTurn(session, decisions);
        } while (!state.isTerminal());
        return state;
    }

    /**
     * Play the active hero's turn, looping over action choices until one consumes the turn.
     */
    public TurnState playTurn(GameSession session, PlayerDecisions decisions) {
        if (session.isOver()) {
            return terminalStateOf(session.getStatus());
        }
        if (!session.hasHeroes()) {
            return allHeroesDead(session);
        }

        Hero hero = session.getCurrentHero();
        log.info("It is now the turn of hero {}", hero.getName());
        log.info("Hero {} has {} health", hero.getName(), hero.getHealth());
        if (!hero.isAlive()) {
            return eliminateActiveHero(session, hero);
        }

        session.setTurnState(TurnState.AWAITING_ACTION);
        ActionOutcome outcome;
        do {
            HeroAction choice = decisions.chooseAction(hero, availableActions(session, hero));
            outcome = applyAction(session, hero, choice, decisions);
            if (outcome == ActionOutcome.NOT_APPLIED) {
                log.info("The turn cannot be skipped, choose another action");
            }
        } while (!outcome.endsDecisionLoop());

        if (outcome == ActionOutcome.QUIT) {
            log.info("The player left the game");
            session.finish(GameStatus.QUIT);
            return record(session, TurnState.QUIT);
        }
        if (outcome == ActionOutcome.VICTORY) {
            log.info("Hero {} won the game", hero.getName());
            session.setWinnerName(hero.getName());
            session.finish(GameStatus.VICTORY);
            return record(session, TurnState.VICTORY);
        }
        if (!hero.isAlive()) {
            return eliminateActiveHero(session, hero);
        }
        if (session.nextHero()) {
            roundLifecycleService.startRound(session);
            return record(session, TurnState.ROUND_COMPLETE);
        }
        return record(session, TurnState.TURN_COMPLETE);
    }

    /**
     * Actions open to the hero right now: attacks on living heroes sharing its cell, the key
     * and the heart when it stands on them, then the actions offered on every turn.
     */
    public List<HeroAction> availableActions(GameSession session, Hero hero) {
        Labyrinth labyrinth = session.getLabyrinth();
        List<HeroAction> actions = new ArrayList<>();

        for (Hero other : session.getHeroes()) {
            if (!other.equals(hero) && other.isAlive() && other.isAt(hero.getPosition())) {
                log.debug("Hero {} shares a cell with {}", hero.getName(), other.getName());
                actions.add(HeroAction.attack(other));
            }
        }
        if (labyrinth.isKeyAt(hero.getPosition())) {
            log.debug("Hero {} can pick up the key", hero.getName());
            actions.add(HeroAction.pickUpKey());
        }
        if (labyrinth.isHeartAt(hero.getPosition())) {
            log.debug("Hero {} can restore health at the heart", hero.getName());
            actions.add(HeroAction.healAtStation());
        }

        actions.addAll(HeroAction.STATIC_ACTIONS);
        return actions;
    }

    /**
     * Apply one chosen action. Actions that are not on offer for this hero are not applied.
     */
    ActionOutcome applyAction(GameSession session, Hero hero, HeroAction action, PlayerDecisions decisions) {
        if (action == null || !availableActions(session, hero).contains(action)) {
            log.warn("Action {} is not available to hero {}", action, hero.getName());
            return ActionOutcome.NOT_APPLIED;
        }
        Labyrinth labyrinth = session.getLabyrinth();

        return switch (action.type()) {
            case ATTACK -> {
                Hero target = action.target();
                hero.attack(target);
                log.info("Hero {} drew a sword and struck {}, who loses one health", hero.getName(), target.getName());
                if (!target.isAlive()) {
                    removeFallenHero(session, target);
                }
                yield ActionOutcome.TURN_CONSUMED;
            }
            case PICK_UP_KEY -> {
                hero.pickUpKey(labyrinth);
                log.info("Hero {} picked up the key", hero.getName());
                yield ActionOutcome.TURN_CONSUMED;
            }
            case HEAL_AT_STATION -> {
                if (!hero.healAtStation(labyrinth)) {
                    log.info("Hero {} already has full health", hero.getName());
                    yield ActionOutcome.NOT_APPLIED;
                }
                log.info("Hero {} restored full health at the heart", hero.getName());
                yield ActionOutcome.TURN_CONSUMED;
            }
            case MOVE -> move(labyrinth, hero, decisions);
            case SELF_HEAL -> selfHeal(hero);
            case SAVE_GAME -> {
                if (gameSessionService.saveGame(session)) {
                    log.info("The game was saved");
                }
                yield ActionOutcome.SAVED;
            }
            case QUIT -> ActionOutcome.QUIT;
        };
    }

    private ActionOutcome move(Labyrinth labyrinth, Hero hero, PlayerDecisions decisions) {
        Optional<Direction> direction = decisions.chooseDirection(hero);
        if (direction.isEmpty()) {
            log.info("Hero {} did not choose a direction", hero.getName());
            return ActionOutcome.NOT_APPLIED;
        }
        MoveResult result = movementService.move(labyrinth, hero, direction.get(), decisions);
        if (result.getOutcome() == MoveResult.Outcome.VICTORY) {
            return ActionOutcome.VICTORY;
        }
        return result.isTurnConsumed() ? ActionOutcome.TURN_CONSUMED : ActionOutcome.NOT_APPLIED;
    }

    private ActionOutcome selfHeal(Hero hero) {
        log.info("Hero {} reached for the first-aid kit", hero.getName());
        if (hero.getRemainingSelfHeals() <= 0) {
            log.info("The first-aid kit of hero {} is empty", hero.getName());
            return ActionOutcome.NOT_APPLIED;
        }
        if (!hero.selfHeal()) {
            log.info("Hero {} already has full health", hero.getName());
            return ActionOutcome.NOT_APPLIED;
        }
        log.info("Hero {} healed and now has {} health", hero.getName(), hero.getHealth());
        return ActionOutcome.TURN_CONSUMED;
    }

    private TurnState eliminateActiveHero(GameSession session, Hero hero) {
        boolean wrapped = removeFallenHero(session, hero);
        if (!session.hasHeroes()) {
            return allHeroesDead(session);
        }
        if (wrapped) {
            roundLifecycleService.startRound(session);
        }
        log.info("The turn passes to the next hero");
        return record(session, TurnState.HERO_ELIMINATED);
    }

    /**
     * Take a dead hero off the board, leaving the key where it fell.
     *
     * @return true if the turn index wrapped to the first hero
     */
    private boolean removeFallenHero(GameSession session, Hero hero) {
        log.info("Hero {} suffered fatal wounds and died", hero.getName());
        if (hero.isCarryingKey()) {
            log.info("The key fell from {} at {}", hero.getName(), hero.getPosition());
            hero.releaseKey();
            session.getLabyrinth().dropKey(hero.getPosition());
        }
        return session.removeHero(hero);
    }

    private TurnState allHeroesDead(GameSession session) {
        log.info("All heroes are dead, nobody won. Game over");
        session.finish(GameStatus.ALL_HEROES_DEAD);
        return record(session, TurnState.ALL_HEROES_DEAD);
    }

    private TurnState record(GameSession session, TurnState state) {
        session.setTurnState(state);
        return state;
    }

    private static TurnState terminalStateOf(GameStatus status) {
        return switch (status) {
            case VICTORY -> TurnState.VICTORY;
            case QUIT -> TurnState.QUIT;
            case ALL_HEROES_DEAD, IN_PROGRESS -> TurnState.ALL_HEROES_DEAD;
        };
    }
}
