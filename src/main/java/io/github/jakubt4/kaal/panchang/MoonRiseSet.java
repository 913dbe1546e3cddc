package io.github.jakubt4.kaal.panchang;

import java.time.Instant;

/**
 * First moonrise and first moonset searched from the start of a local-mean-time
 * day. Either may fall on the following day when the Moon skips an event.
 */
public record MoonRiseSet(Instant moonrise, Instant moonset) {
}
