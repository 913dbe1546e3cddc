package io.github.jakubt4.kaal.error;

import java.util.Map;

/**
 * Raised when a latitude, longitude or elevation is outside its valid range.
 */
public class InvalidCoordinateException extends KaalException {

    public InvalidCoordinateException(final String message, final Map<String, ?> context) {
        super(ErrorKind.INVALID_COORDINATE, message, context);
    }
}
