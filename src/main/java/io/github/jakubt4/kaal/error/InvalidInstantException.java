package io.github.jakubt4.kaal.error;

import java.util.Map;

/**
 * Raised for instants outside the supported calendrical range, where no ΔT correction is defined.
 */
public class InvalidInstantException extends KaalException {

    public InvalidInstantException(final String message, final Map<String, ?> context) {
        super(ErrorKind.INVALID_INSTANT, message, context);
    }
}
