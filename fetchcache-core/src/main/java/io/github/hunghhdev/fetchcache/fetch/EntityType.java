package io.github.hunghhdev.fetchcache.fetch;

import java.time.Duration;

/**
 * The kinds of data the orchestrator can fetch, with their cache-key prefix, the number of
 * discriminators that identify one instance, and how long a fetched value stays fresh.
 */
public enum EntityType {

    /**
     * Customer profile. Uses the orchestrator's default TTL.
     */
    CUSTOMER("customer", 1, null),
    APPOINTMENTS("appointments", 1, Duration.ofMinutes(1)),
    TREATMENT_HISTORY("treatment-history", 1, Duration.ofMinutes(10)),
    SATISFACTION("satisfaction", 1, Duration.ofMinutes(10)),
    TREATMENTS_BY_CONCERN("treatments:concern", 1, Duration.ofMinutes(30)),
    TREATMENTS_BY_SKIN_TYPE("treatments:skin-type", 1, Duration.ofMinutes(30)),

    /**
     * Available booking slots, identified by date and treatment id.
     */
    TIME_SLOTS("time-slots", 2, Duration.ofSeconds(30)),
    REVIEWS("reviews", 1, Duration.ofMinutes(10)),
    AVERAGE_RATING("rating", 1, Duration.ofMinutes(10));

    private final String keyPrefix;
    private final int discriminatorCount;
    private final Duration defaultTtl;

    EntityType(String keyPrefix, int discriminatorCount, Duration defaultTtl) {
        this.keyPrefix = keyPrefix;
        this.discriminatorCount = discriminatorCount;
        this.defaultTtl = defaultTtl;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public int getDiscriminatorCount() {
        return discriminatorCount;
    }

    /**
     * Returns the TTL for this type when no override is configured.
     *
     * @param fallback the orchestrator's default TTL
     */
    public Duration ttlOrDefault(Duration fallback) {
        return defaultTtl != null ? defaultTtl : fallback;
    }
}
