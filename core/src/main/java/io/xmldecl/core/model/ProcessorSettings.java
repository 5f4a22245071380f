package io.xmldecl.core.model;

import io.xmldecl.core.error.InvalidRootProcessorException;

/**
 * Metadata shared by every processor kind.
 *
 * @param alias        name of the value on the structured side; {@code null} to derive it from the
 *                     path
 * @param required     whether absence is a {@link io.xmldecl.core.error.MissingValueException}
 * @param defaultValue value produced for an absent optional value; ignored when required
 * @param omitEmpty    skip emitting empty values on encode; only valid when not required
 * @param hooks        value hooks, never null
 */
public record ProcessorSettings(
        String alias, boolean required, Object defaultValue, boolean omitEmpty, Hooks hooks) {

    private static final ProcessorSettings REQUIRED = new ProcessorSettings(null, true, null, false, Hooks.none());

    /** Canonical constructor with validation. */
    public ProcessorSettings {
        if (alias != null && alias.isBlank()) {
            throw new InvalidRootProcessorException("Alias must not be blank");
        }
        if (omitEmpty && required) {
            throw new InvalidRootProcessorException(
                    "omitEmpty is only valid on optional processors; call optional() first");
        }
        hooks = hooks != null ? hooks : Hooks.none();
    }

    /** Settings of a freshly declared processor: required, no alias, no default, no hooks. */
    public static ProcessorSettings defaults() {
        return REQUIRED;
    }

    public ProcessorSettings withAlias(String newAlias) {
        return new ProcessorSettings(newAlias, required, defaultValue, omitEmpty, hooks);
    }

    public ProcessorSettings withRequired(boolean newRequired) {
        return new ProcessorSettings(alias, newRequired, defaultValue, omitEmpty, hooks);
    }

    public ProcessorSettings withDefaultValue(Object newDefault) {
        return new ProcessorSettings(alias, required, newDefault, omitEmpty, hooks);
    }

    public ProcessorSettings withOmitEmpty(boolean newOmitEmpty) {
        return new ProcessorSettings(alias, required, defaultValue, newOmitEmpty, hooks);
    }

    public ProcessorSettings withHooks(Hooks newHooks) {
        return new ProcessorSettings(alias, required, defaultValue, omitEmpty, newHooks);
    }
}
