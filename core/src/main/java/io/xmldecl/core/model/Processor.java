package io.xmldecl.core.model;

/**
 * A declarative description of how one value maps to and from a location in an XML tree.
 * Processors are composed once into a tree and then drive both decode and encode, which keeps
 * the two directions in lock-step.
 *
 * <p>Implementations are a sealed hierarchy of immutable records. The fluent methods below
 * return modified copies and never change the receiver, so a processor tree can be shared by
 * any number of threads.
 */
public sealed interface Processor permits PrimitiveProcessor, ArrayProcessor, AggregateProcessor {

    /** Where this processor's element lives, relative to its parent's element. */
    PathExpression path();

    /** Metadata shared by all processor kinds. */
    ProcessorSettings settings();

    /** Returns a copy of this processor with different settings. */
    Processor withSettings(ProcessorSettings settings);

    /** Name of the value on the structured side (map key, field name). */
    String alias();

    default boolean required() {
        return settings().required();
    }

    default Hooks hooks() {
        return settings().hooks();
    }

    /** Returns a copy whose value is named {@code alias} on the structured side. */
    default Processor alias(String alias) {
        return withSettings(settings().withAlias(alias));
    }

    /** Returns a copy whose absence is tolerated. */
    default Processor optional() {
        return withSettings(settings().withRequired(false));
    }

    /** Returns a copy producing {@code value} when absent; only consulted once {@link #optional()}. */
    default Processor defaultValue(Object value) {
        return withSettings(settings().withDefaultValue(value));
    }

    /**
     * Returns a copy that skips empty values on encode.
     *
     * @throws io.xmldecl.core.error.InvalidRootProcessorException if this processor is required
     */
    default Processor omitEmpty() {
        return withSettings(settings().withOmitEmpty(true));
    }

    /** Returns a copy with the given value hooks. */
    default Processor hooks(Hooks hooks) {
        return withSettings(settings().withHooks(hooks));
    }
}
