package io.xmldecl.core.model;

import java.util.Objects;

/**
 * One step of a {@link PathExpression}. Implementations are a sealed hierarchy: a step is either
 * the self selector {@code "."} or a named child element.
 *
 * <p>Thread-safe and immutable.
 */
public sealed interface Segment {

    /** Returns the textual form of this step as it appears in a path string. */
    String text();

    /** The self selector {@code "."}: operate on the context element itself. */
    record Self() implements Segment {

        static final Self INSTANCE = new Self();

        @Override
        public String text() {
            return ".";
        }
    }

    /** Descend into the child element with the given name. */
    record Named(String name) implements Segment {
        public Named {
            Objects.requireNonNull(name, "name must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Segment name must not be blank");
            }
        }

        @Override
        public String text() {
            return name;
        }
    }
}
