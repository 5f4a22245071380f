package io.xmldecl.core.model;

import io.xmldecl.core.error.InvalidRootProcessorException;
import java.util.List;
import java.util.Objects;

/**
 * Maps an element to an instance of a Java {@code record}; each child's alias names a record
 * component.
 *
 * @param path     the element
 * @param binding  record construction and component access
 * @param children child processors in declaration order
 * @param settings shared metadata
 * @param <T>      the record type
 */
public record NamedTupleProcessor<T extends Record>(
        PathExpression path, TupleBinding<T> binding, List<Processor> children, ProcessorSettings settings)
        implements AggregateProcessor {

    /** Canonical constructor with validation and a defensive copy. */
    public NamedTupleProcessor {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        if (binding == null) {
            throw new InvalidRootProcessorException("Named tuple '" + path + "' has no record type");
        }
        children = Aggregates.checkChildren(path, children);
        binding.checkComponents(Aggregates.aliases(children));
    }

    @Override
    public NamedTupleProcessor<T> withSettings(ProcessorSettings newSettings) {
        return new NamedTupleProcessor<>(path, binding, children, newSettings);
    }

    @Override
    public String alias() {
        if (settings.alias() != null) {
            return settings.alias();
        }
        return path.lastName()
                .orElseThrow(() -> new InvalidRootProcessorException("A named tuple on '.' needs an explicit alias"));
    }
}
