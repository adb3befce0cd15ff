package com.labyrinth.cli;

/**
 * Standard input ended (or broke) while a prompt was waiting for an answer.
 */
public class InputClosedException extends RuntimeException {

    public InputClosedException() {
        super("Input closed");
    }

    public InputClosedException(Throwable cause) {
        super("Input closed", cause);
    }
}
