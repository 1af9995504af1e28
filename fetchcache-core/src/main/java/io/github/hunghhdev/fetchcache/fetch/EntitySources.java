package io.github.hunghhdev.fetchcache.fetch;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of the entity source for each entity type.
 */
public final class EntitySources {

    private final Map<EntityType, EntitySource<?>> sources = new EnumMap<>(EntityType.class);

    public static EntitySources create() {
        return new EntitySources();
    }

    /**
     * Returns a new registry holding the same sources as {@code other}.
     */
    public static EntitySources copyOf(EntitySources other) {
        EntitySources copy = new EntitySources();
        copy.sources.putAll(Objects.requireNonNull(other, "other").sources);
        return copy;
    }

    /**
     * Registers the source for an entity type, replacing any previous one.
     *
     * @return this registry
     */
    public EntitySources register(EntityType type, EntitySource<?> source) {
        sources.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(source, "source"));
        return this;
    }

    public Optional<EntitySource<?>> find(EntityType type) {
        return Optional.ofNullable(sources.get(type));
    }

    public Set<EntityType> registeredTypes() {
        return Collections.unmodifiableSet(sources.keySet());
    }
}
