package com.architecture.design.nodeforge.exception;

/**
 * Thrown when a colour literal is not a 3 or 6 digit hex string.
 */
public class InvalidColorException extends IllegalArgumentException {

    public InvalidColorException(String message) {
        super(message);
    }
}
