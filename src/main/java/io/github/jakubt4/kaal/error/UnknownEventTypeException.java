package io.github.jakubt4.kaal.error;

import java.util.Map;

/**
 * Raised when a muhurta event tag does not name a known event type.
 */
public class UnknownEventTypeException extends KaalException {

    public UnknownEventTypeException(final String message, final Map<String, ?> context) {
        super(ErrorKind.UNKNOWN_EVENT_TYPE, message, context);
    }
}
