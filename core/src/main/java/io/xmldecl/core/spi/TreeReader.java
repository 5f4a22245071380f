package io.xmldecl.core.spi;

import java.util.List;
import java.util.Optional;

/**
 * Read access to a parsed XML tree, consumed by the decoder. Implementations adapt a concrete
 * tree model (DOM, a streaming buffer, a test double) without the engine knowing about it.
 *
 * <p>Implementations MUST be stateless and thread-safe; node instances are owned by the caller.
 *
 * @param <N> the element type of the underlying tree
 */
public interface TreeReader<N> {

    /** Returns the element's name (local name when namespaces are involved). */
    String name(N node);

    /** Returns the first child element with the given name. */
    Optional<N> child(N node, String name);

    /** Returns all child elements with the given name, in document order. */
    List<N> children(N node, String name);

    /** Returns the value of the named attribute, or empty if the attribute is absent. */
    Optional<String> attribute(N node, String name);

    /** Returns the element's text content, or empty if the element has no text. */
    Optional<String> text(N node);
}
