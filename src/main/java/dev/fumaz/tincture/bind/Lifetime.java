package dev.fumaz.tincture.bind;

/**
 * Controls how many instances of a registration may exist and for how long.
 */
public enum Lifetime {

    /**
     * Every resolution constructs a fresh instance. Nothing is cached.
     */
    PER_REQUEST,

    /**
     * One instance per active scope. Resolving outside of a scope fails.
     */
    SCOPED,

    /**
     * One instance for the whole lifetime of the container, created on first resolution.
     */
    SINGLETON

}
