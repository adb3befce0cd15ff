package com.labyrinth.exception;

/**
 * The save file could not be written.
 */
public class SaveFailedException extends RuntimeException {

    public SaveFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
