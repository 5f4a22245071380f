package io.xmldecl.core.model;

import io.xmldecl.core.error.InvalidRootProcessorException;
import java.util.List;
import java.util.Objects;

/**
 * Maps an element to a {@code Map<String, Object>} keyed by the aliases of its children.
 *
 * @param path     the element; {@code "."} groups the children on the context element
 * @param children child processors in declaration order
 * @param settings shared metadata
 */
public record DictionaryProcessor(PathExpression path, List<Processor> children, ProcessorSettings settings)
        implements AggregateProcessor {

    /** Canonical constructor with validation and a defensive copy. */
    public DictionaryProcessor {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        children = Aggregates.checkChildren(path, children);
    }

    @Override
    public DictionaryProcessor withSettings(ProcessorSettings newSettings) {
        return new DictionaryProcessor(path, children, newSettings);
    }

    @Override
    public String alias() {
        if (settings.alias() != null) {
            return settings.alias();
        }
        return path.lastName()
                .orElseThrow(() -> new InvalidRootProcessorException("A dictionary on '.' needs an explicit alias"));
    }
}
