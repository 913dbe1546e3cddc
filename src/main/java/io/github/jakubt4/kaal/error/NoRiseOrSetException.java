package io.github.jakubt4.kaal.error;

import java.util.Map;

/**
 * Raised when a rising or setting cannot be found, e.g. polar day or night.
 */
public class NoRiseOrSetException extends KaalException {

    public NoRiseOrSetException(final String message, final Map<String, ?> context) {
        super(ErrorKind.NO_RISE_OR_SET, message, context);
    }
}
