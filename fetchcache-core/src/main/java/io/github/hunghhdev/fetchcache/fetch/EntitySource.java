package io.github.hunghhdev.fetchcache.fetch;

/**
 * Produces the value for one entity type, typically by calling a remote service or database.
 *
 * <p>Calls run on a worker thread and are cancelled by interruption when they exceed the
 * operation timeout; implementations should let {@link InterruptedException} propagate or
 * check {@link Thread#isInterrupted()} during long work.</p>
 *
 * @param <T> the value type
 */
@FunctionalInterface
public interface EntitySource<T> {

    /**
     * Loads the entity identified by the request.
     *
     * @param request the entity type and discriminators
     * @return the value, never {@code null}
     * @throws Exception if the value cannot be produced
     */
    T load(FetchRequest request) throws Exception;
}
