package io.github.jakubt4.kaal.error;

import java.util.Map;

/**
 * Raised when an ayanamsha tag does not name a supported system.
 */
public class UnknownAyanamshaSystemException extends KaalException {

    public UnknownAyanamshaSystemException(final String message, final Map<String, ?> context) {
        super(ErrorKind.UNKNOWN_AYANAMSHA_SYSTEM, message, context);
    }
}
