package io.xmldecl.core.model;

/**
 * A user callback intercepting a value immediately after decode or immediately before encode.
 * Receives the already-typed value and returns the value to continue with; the engine does not
 * re-check the returned type.
 */
@FunctionalInterface
public interface ValueHook {

    /**
     * @param state the engine's current position
     * @param value the value being processed, never a raw markup string for non-string types
     * @return the value to use in its place
     */
    Object apply(ProcessorState state, Object value);
}
