package io.github.jakubt4.kaal.muhurta;

import io.github.jakubt4.kaal.error.UnknownEventTypeException;

import java.util.Locale;
import java.util.Map;

/**
 * Activities a muhurta can be searched for. Each has its own rule in the rule set.
 */
public enum EventType {
    MARRIAGE,
    BUSINESS,
    TRAVEL,
    EDUCATION,
    PROPERTY,
    GENERAL;

    /**
     * @throws UnknownEventTypeException for a tag that names no event type
     */
    public static EventType fromTag(final String tag) {
        if (tag != null) {
            final var canonical = tag.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
            for (final var type : values()) {
                if (type.name().equals(canonical)) {
                    return type;
                }
            }
        }
        throw new UnknownEventTypeException("Unknown muhurta event type", Map.of("tag", String.valueOf(tag)));
    }
}
