package io.xmldecl.core.model;

import io.xmldecl.core.error.InvalidRootProcessorException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Declaration checks shared by the aggregate processors. */
final class Aggregates {

    private Aggregates() {}

    /** Validates a child list and returns an immutable copy. */
    static List<Processor> checkChildren(PathExpression path, List<Processor> children) {
        if (children == null) {
            throw new InvalidRootProcessorException("Children of '" + path + "' must not be null");
        }
        List<Processor> copy = List.copyOf(children);
        Set<String> aliases = new HashSet<>();
        for (Processor child : copy) {
            if (!aliases.add(child.alias())) {
                throw new InvalidRootProcessorException(
                        "Duplicate alias '" + child.alias() + "' among the children of '" + path + "'");
            }
        }
        return copy;
    }

    static List<String> aliases(List<Processor> children) {
        return children.stream().map(Processor::alias).toList();
    }
}
