package com.architecture.design.nodeforge.exception;

/**
 * Theme input that cannot be turned into a variable catalog, e.g. duplicate mode names.
 */
public class ThemeConfigurationException extends RuntimeException {

    public ThemeConfigurationException(String message) {
        super(message);
    }
}
