package io.xmldecl.core.model;

import io.xmldecl.core.error.InvalidRootProcessorException;
import java.util.Objects;

/**
 * Maps a scalar value to the text of an element, or to an attribute of that element when
 * {@code attribute} is set.
 *
 * @param path            element holding the value; {@code "."} for the context element
 * @param attribute       attribute name, or {@code null} for element text
 * @param type            scalar type
 * @param stripWhitespace trim decoded strings (ignored for other types)
 * @param settings        shared metadata
 */
public record PrimitiveProcessor(
        PathExpression path, String attribute, PrimitiveType type, boolean stripWhitespace, ProcessorSettings settings)
        implements Processor {

    /** Canonical constructor with validation. */
    public PrimitiveProcessor {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        if (attribute != null && attribute.isBlank()) {
            throw new InvalidRootProcessorException("Attribute name must not be blank on '" + path + "'");
        }
    }

    @Override
    public PrimitiveProcessor withSettings(ProcessorSettings newSettings) {
        return new PrimitiveProcessor(path, attribute, type, stripWhitespace, newSettings);
    }

    @Override
    public String alias() {
        if (settings.alias() != null) {
            return settings.alias();
        }
        if (attribute != null) {
            return attribute;
        }
        return path.lastName()
                .orElseThrow(() -> new InvalidRootProcessorException(
                        "A " + type.id() + " processor on '.' needs an attribute or an explicit alias"));
    }

    /** True if the value lives in an attribute rather than in element text. */
    public boolean isAttribute() {
        return attribute != null;
    }
}
