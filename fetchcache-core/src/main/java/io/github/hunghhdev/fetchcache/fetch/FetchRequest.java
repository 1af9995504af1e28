package io.github.hunghhdev.fetchcache.fetch;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Identifies one entity instance to fetch: its type and the discriminator values that select it.
 * The cache key is {@code "{prefix}:{d1}[:{d2}...]"}.
 */
public final class FetchRequest {

    private final EntityType type;
    private final List<String> discriminators;

    private FetchRequest(EntityType type, String... discriminators) {
        this.type = Objects.requireNonNull(type, "type");
        if (discriminators.length != type.getDiscriminatorCount()) {
            throw new IllegalArgumentException(type + " expects " + type.getDiscriminatorCount()
                + " discriminator(s), got " + discriminators.length);
        }
        for (String discriminator : discriminators) {
            if (discriminator == null || discriminator.isEmpty()) {
                throw new IllegalArgumentException("Discriminator for " + type + " cannot be null or empty");
            }
        }
        this.discriminators = Collections.unmodifiableList(Arrays.asList(discriminators.clone()));
    }

    public static FetchRequest of(EntityType type, String... discriminators) {
        return new FetchRequest(type, discriminators);
    }

    public static FetchRequest customer(String customerId) {
        return of(EntityType.CUSTOMER, customerId);
    }

    public static FetchRequest appointments(String customerId) {
        return of(EntityType.APPOINTMENTS, customerId);
    }

    public static FetchRequest treatmentHistory(String customerId) {
        return of(EntityType.TREATMENT_HISTORY, customerId);
    }

    public static FetchRequest satisfaction(String customerId) {
        return of(EntityType.SATISFACTION, customerId);
    }

    public static FetchRequest treatmentsByConcern(String concern) {
        return of(EntityType.TREATMENTS_BY_CONCERN, concern);
    }

    public static FetchRequest treatmentsBySkinType(String skinType) {
        return of(EntityType.TREATMENTS_BY_SKIN_TYPE, skinType);
    }

    public static FetchRequest timeSlots(String date, String treatmentId) {
        return of(EntityType.TIME_SLOTS, date, treatmentId);
    }

    public static FetchRequest reviews(String treatmentId) {
        return of(EntityType.REVIEWS, treatmentId);
    }

    public static FetchRequest averageRating(String treatmentId) {
        return of(EntityType.AVERAGE_RATING, treatmentId);
    }

    public EntityType getType() {
        return type;
    }

    public List<String> getDiscriminators() {
        return discriminators;
    }

    /**
     * Returns the first discriminator, e.g. the customer id or the date of a time-slot request.
     */
    public String getDiscriminator() {
        return discriminators.get(0);
    }

    public String cacheKey() {
        return type.getKeyPrefix() + ":" + String.join(":", discriminators);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FetchRequest)) {
            return false;
        }
        FetchRequest that = (FetchRequest) o;
        return type == that.type && discriminators.equals(that.discriminators);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, discriminators);
    }

    @Override
    public String toString() {
        return cacheKey();
    }
}
