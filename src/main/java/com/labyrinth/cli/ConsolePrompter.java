package com.labyrinth.cli;

import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Line-based prompts on the console. Invalid answers are reported and asked again.
 */
@Component
public class ConsolePrompter {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsolePrompter() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public ConsolePrompter(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public void say(String message) {
        out.println(message);
    }

    /**
     * @throws InputClosedException when input has ended
     */
    public String ask(String prompt) {
        out.print(prompt);
        out.flush();
        try {
            String line = in.readLine();
            if (line == null) {
                throw new InputClosedException();
            }
            return line.trim();
        } catch (IOException e) {
            throw new InputClosedException(e);
        }
    }

    public void printMenu(String title, List<String> labels) {
        say(title);
        for (int i = 0; i < labels.size(); i++) {
            say((i + 1) + ". " + labels.get(i));
        }
    }

    /**
     * Ask until the answer is a whole number in {@code [min, max]}.
     */
    public int askNumber(String prompt, int min, int max) {
        while (true) {
            String answer = ask(prompt);
            try {
                int number = Integer.parseInt(answer);
                if (number >= min && number <= max) {
                    return number;
                }
                say("Enter a number from " + min + " to " + max + ".");
            } catch (NumberFormatException e) {
                say("Invalid input. Enter a whole number.");
            }
        }
    }

    /**
     * Ask until the answer is {@code yes} or {@code no}, ignoring case.
     */
    public boolean askYesNo(String prompt) {
        while (true) {
            String answer = ask(prompt).toLowerCase();
            if (answer.equals("yes")) {
                return true;
            }
            if (answer.equals("no")) {
                return false;
            }
            say("Invalid input. Please enter \"yes\" or \"no\".");
        }
    }
}
