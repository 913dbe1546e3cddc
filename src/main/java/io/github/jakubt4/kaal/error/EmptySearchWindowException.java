package io.github.jakubt4.kaal.error;

import java.util.Map;

/**
 * Raised when a muhurta search range is shorter than one sampling step.
 */
public class EmptySearchWindowException extends KaalException {

    public EmptySearchWindowException(final String message, final Map<String, ?> context) {
        super(ErrorKind.EMPTY_SEARCH_WINDOW, message, context);
    }
}
