package io.github.hunghhdev.fetchcache.fetch;

/**
 * Why a fetch attempt did not produce a value.
 */
public enum FailureKind {

    /**
     * The bounded wait elapsed before the entity source responded. The source call was cancelled.
     */
    TIMEOUT,

    /**
     * The entity source threw, returned no value, or no source was registered.
     */
    FAILURE
}
