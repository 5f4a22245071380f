package io.xmldecl.core.model;

import io.xmldecl.core.error.InvalidRootProcessorException;
import java.util.List;
import java.util.Objects;

/**
 * Maps an element to an instance of a user type, built by constructing an empty instance and
 * assigning each decoded child value to the field named by the child's alias.
 *
 * @param path     the element
 * @param binding  construction and field access for the user type
 * @param children child processors in declaration order
 * @param settings shared metadata
 * @param <T>      the user type
 */
public record UserObjectProcessor<T>(
        PathExpression path, ObjectBinding<T> binding, List<Processor> children, ProcessorSettings settings)
        implements AggregateProcessor {

    /** Canonical constructor with validation and a defensive copy. */
    public UserObjectProcessor {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        if (binding == null) {
            throw new InvalidRootProcessorException("User object '" + path + "' has no object binding");
        }
        children = Aggregates.checkChildren(path, children);
        binding.checkFields(Aggregates.aliases(children));
    }

    @Override
    public UserObjectProcessor<T> withSettings(ProcessorSettings newSettings) {
        return new UserObjectProcessor<>(path, binding, children, newSettings);
    }

    @Override
    public String alias() {
        if (settings.alias() != null) {
            return settings.alias();
        }
        return path.lastName()
                .orElseThrow(() -> new InvalidRootProcessorException("A user object on '.' needs an explicit alias"));
    }
}
