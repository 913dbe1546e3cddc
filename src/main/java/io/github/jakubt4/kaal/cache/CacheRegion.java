package io.github.jakubt4.kaal.cache;

/**
 * Independent cache partitions, one per memoised layer. Each region has its own
 * size bound and expiry policy because their volatility differs: an ayanamsha
 * for a fixed date never changes, a muhurta search depends on the rule-table version.
 */
public enum CacheRegion {
    AYANAMSHA,
    RISE_SET,
    PANCHANG,
    MUHURTA
}
