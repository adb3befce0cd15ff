package com.labyrinth.cli;

import com.labyrinth.exception.InvalidRosterException;
import com.labyrinth.model.GameSession;
import com.labyrinth.model.TurnState;
import com.labyrinth.service.GameSessionService;
import com.labyrinth.service.RosterService;
import com.labyrinth.service.TurnEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one game on the console: login, resume or roster setup, then play until the game ends.
 */
@Component
@ConditionalOnProperty(name = "labyrinth.console.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ConsoleGameRunner implements CommandLineRunner {

    private final ConsolePrompter prompter;
    private final ConsolePlayerDecisions decisions;
    private final GameSessionService gameSessionService;
    private final RosterService rosterService;
    private final TurnEngine turnEngine;

    @Override
    public void run(String... args) {
        prompter.say("Welcome to the game \"Labyrinth\".");
        try {
            String login = askLogin();
            GameSession session = openSession(login);
            TurnState result = turnEngine.play(session, decisions);
            announce(result, session);
        } catch (InputClosedException e) {
            log.info("Input closed, leaving the game");
        }
    }

    String askLogin() {
        while (true) {
            String login = prompter.ask("Enter your login: ");
            if (!login.isEmpty()) {
                return login;
            }
            prompter.say("The login must not be empty.");
        }
    }

    GameSession openSession(String login) {
        if (gameSessionService.hasSavedSession(login)) {
            if (prompter.askYesNo("You have a saved game. Do you want to load it? (yes/no): ")) {
                log.info("Loading the saved game");
                return gameSessionService.resumeSession(login).orElseGet(() -> createSession(login));
            }
            gameSessionService.discardSavedSession(login);
        } else {
            log.info("There is no saved game for this login");
        }
        return createSession(login);
    }

    GameSession createSession(String login) {
        GameSession session = gameSessionService.newSession(login);
        int count = askHeroCount();
        for (int i = 1; i <= count; i++) {
            while (true) {
                try {
                    gameSessionService.addHero(session, prompter.ask("Enter the name of hero " + i + ": "));
                    break;
                } catch (InvalidRosterException e) {
                    prompter.say(e.getMessage() + ". Names must be unique.");
                }
            }
        }
        return session;
    }

    private int askHeroCount() {
        while (true) {
            String answer = prompter.ask("Enter the number of heroes: ");
            try {
                int count = Integer.parseInt(answer);
                rosterService.validateHeroCount(count);
                return count;
            } catch (NumberFormatException e) {
                prompter.say("Enter a whole number.");
            } catch (InvalidRosterException e) {
                prompter.say(e.getMessage());
            }
        }
    }

    private void announce(TurnState result, GameSession session) {
        switch (result) {
            case VICTORY -> prompter.say("Hero " + session.getWinnerName() + " passed the golem and won the game!");
            case ALL_HEROES_DEAD -> prompter.say("All heroes are dead. Nobody won.");
            case QUIT -> prompter.say("You left the game.");
            default -> log.warn("Game ended in unexpected state {}", result);
        }
    }
}
