package io.github.jakubt4.kaal.error;

/**
 * Closed set of failure kinds reported by the core. Every {@link KaalException}
 * carries exactly one of these so callers can branch without inspecting messages.
 */
public enum ErrorKind {
    INVALID_COORDINATE,
    INVALID_INSTANT,
    UNKNOWN_AYANAMSHA_SYSTEM,
    UNKNOWN_EVENT_TYPE,
    EPHEMERIS_UNAVAILABLE,
    NO_RISE_OR_SET,
    EMPTY_SEARCH_WINDOW
}
