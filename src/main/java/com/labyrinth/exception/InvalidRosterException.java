package com.labyrinth.exception;

/**
 * Rejected roster input: hero count out of range, or an empty or duplicate hero name.
 */
public class InvalidRosterException extends IllegalArgumentException {

    public InvalidRosterException(String message) {
        super(message);
    }
}
