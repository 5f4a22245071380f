package io.xmldecl.core.model;

import io.xmldecl.core.error.HookFailureException;
import io.xmldecl.core.error.XmlProcessingException.Phase;
import java.util.Objects;

/**
 * Read-only view of the engine's position, handed to {@link ValueHook}s. Hooks use it to
 * report failures that are attributed to the current location.
 */
public final class ProcessorState {

    private final Location location;
    private final Phase phase;

    public ProcessorState(Location location, Phase phase) {
        this.location = Objects.requireNonNull(location, "location must not be null");
        this.phase = Objects.requireNonNull(phase, "phase must not be null");
    }

    /** Where the engine currently is in the document. */
    public Location location() {
        return location;
    }

    /** {@link Phase#DECODE} inside an after-decode hook, {@link Phase#ENCODE} inside a before-encode hook. */
    public Phase phase() {
        return phase;
    }

    /**
     * Aborts processing with a user-defined failure at the current location.
     *
     * <pre>{@code
     * ValueHook positive = (state, value) -> {
     *     if ((Integer) value < 0) {
     *         throw state.raiseError("Value must not be negative");
     *     }
     *     return value;
     * };
     * }</pre>
     *
     * @param message the failure description
     * @return never returns normally; declared so callers can write {@code throw state.raiseError(..)}
     * @throws HookFailureException always
     */
    public HookFailureException raiseError(String message) {
        throw new HookFailureException(message, location.toString(), phase);
    }

    @Override
    public String toString() {
        return "ProcessorState[" + location + ", " + phase + "]";
    }
}
