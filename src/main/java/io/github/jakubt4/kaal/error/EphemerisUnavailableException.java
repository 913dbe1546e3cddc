package io.github.jakubt4.kaal.error;

import java.util.Map;

/**
 * Raised when the ephemeris provider cannot supply a position: unsupported body,
 * instant outside the provider's range, an underlying library failure, or a
 * malformed (non-finite) value.
 */
public class EphemerisUnavailableException extends KaalException {

    public EphemerisUnavailableException(final String message, final Map<String, ?> context) {
        super(ErrorKind.EPHEMERIS_UNAVAILABLE, message, context);
    }

    public EphemerisUnavailableException(final String message, final Map<String, ?> context,
                                         final Throwable cause) {
        super(ErrorKind.EPHEMERIS_UNAVAILABLE, message, context, cause);
    }
}
