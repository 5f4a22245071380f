package io.xmldecl.core.model;

/**
 * Optional pair of value hooks attached to a processor. Either side may be {@code null}, in which
 * case values pass through unchanged.
 *
 * <p>Thread-safe if the hook functions are.
 */
public record Hooks(ValueHook afterDecode, ValueHook beforeEncode) {

    private static final Hooks NONE = new Hooks(null, null);

    /** Hooks that do nothing. */
    public static Hooks none() {
        return NONE;
    }

    /** Hooks with only an after-decode callback. */
    public static Hooks afterDecode(ValueHook hook) {
        return new Hooks(hook, null);
    }

    /** Hooks with only a before-encode callback. */
    public static Hooks beforeEncode(ValueHook hook) {
        return new Hooks(null, hook);
    }

    /** Hooks that run the same callback in both directions, typically a validator. */
    public static Hooks both(ValueHook hook) {
        return new Hooks(hook, hook);
    }
}
