package io.xmldecl.core.model;

import io.xmldecl.core.error.InvalidRootProcessorException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a sequence of repeated elements to a {@code List<Object>}.
 *
 * <p>An <em>embedded</em> array ({@code nested == null}) reads its items directly from the
 * parent element. A <em>nested</em> array reads them from a container element:
 *
 * <pre>{@code
 * <author>                      <author>
 *   <book>..</book>               <books>
 *   <book>..</book>                 <book>..</book>
 * </author>                       </books>
 *                               </author>
 *    embedded                     nested("books")
 * }</pre>
 *
 * <p>Zero items fail only when the item processor is required. {@link #optional()} on a nested
 * array tolerates a missing container; {@link #omitEmpty()} then drops the container on encode
 * when the sequence is empty.
 *
 * @param item     processor applied to each item element
 * @param nested   container element path, or {@code null} for an embedded array
 * @param settings shared metadata; {@code defaultValue} is ignored
 */
public record ArrayProcessor(Processor item, PathExpression nested, ProcessorSettings settings) implements Processor {

    private static final Logger LOG = LoggerFactory.getLogger(ArrayProcessor.class);

    /** Canonical constructor with validation. */
    public ArrayProcessor {
        Objects.requireNonNull(settings, "settings must not be null");
        if (item == null) {
            throw new InvalidRootProcessorException("Array item processor must not be null");
        }
        if (item.path().isSelf()) {
            throw new InvalidRootProcessorException(
                    "Array item on '" + item.path() + "' must name an element; '.' cannot repeat");
        }
        if (item instanceof ArrayProcessor inner && inner.isEmbedded()) {
            throw new InvalidRootProcessorException(
                    "Array item on '" + item.path() + "' is an embedded array; arrays of arrays must nest their items");
        }
        if (nested != null && nested.isSelf()) {
            throw new InvalidRootProcessorException("Nested array container must name an element, got '.'");
        }
        if (nested == null && settings.omitEmpty()) {
            LOG.warn("omitEmpty ignored on embedded array '{}': there is no container element to omit", item.alias());
        }
    }

    @Override
    public ArrayProcessor withSettings(ProcessorSettings newSettings) {
        return new ArrayProcessor(item, nested, newSettings);
    }

    /** The container path for nested arrays, otherwise the item path. */
    @Override
    public PathExpression path() {
        return nested != null ? nested : item.path();
    }

    @Override
    public String alias() {
        if (settings.alias() != null) {
            return settings.alias();
        }
        if (nested != null) {
            return nested.lastName().orElseThrow();
        }
        return item.alias();
    }

    /** True if items are direct children of the parent element. */
    public boolean isEmbedded() {
        return nested == null;
    }
}
