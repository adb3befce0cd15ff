package com.labyrinth.cli;

import com.labyrinth.model.Coordinate;
import com.labyrinth.model.Direction;
import com.labyrinth.model.Hero;
import com.labyrinth.model.HeroAction;
import com.labyrinth.service.PlayerDecisions;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * {@link PlayerDecisions} answered by the person at the console.
 */
@Component
@RequiredArgsConstructor
public class ConsolePlayerDecisions implements PlayerDecisions {

    static final String DECLINE = "NO";

    private final ConsolePrompter prompter;

    @Override
    public HeroAction chooseAction(Hero hero, List<HeroAction> options) {
        prompter.printMenu("Choose an action for hero " + hero.getName() + ":",
                options.stream().map(HeroAction::label).toList());
        int choice = prompter.askNumber("Enter the action number: ", 1, options.size());
        return options.get(choice - 1);
    }

    @Override
    public Optional<Direction> chooseDirection(Hero hero) {
        Direction[] directions = Direction.values();
        prompter.printMenu("Choose a direction:", Arrays.stream(directions).map(Direction::getLabel).toList());
        while (true) {
            String answer = prompter.ask("Enter the direction number or \"" + DECLINE + "\" to cancel: ");
            if (answer.equalsIgnoreCase(DECLINE)) {
                return Optional.empty();
            }
            try {
                int choice = Integer.parseInt(answer);
                if (choice >= 1 && choice <= directions.length) {
                    return Optional.of(directions[choice - 1]);
                }
                prompter.say("Invalid direction. Try again.");
            } catch (NumberFormatException e) {
                prompter.say("Invalid input. Enter the direction number or \"" + DECLINE + "\".");
            }
        }
    }

    @Override
    public boolean confirmRetreat(Hero hero, Coordinate target) {
        return prompter.askYesNo("Are you sure? Hero " + hero.getName() + " will die (yes/no): ");
    }
}
