package io.xmldecl.core.spi;

import java.util.Optional;

/**
 * Builds an XML tree, consumed by the encoder. The encoder only ever appends; the lookup in
 * {@link #child} lets several processors share an intermediate element
 * ({@code coordinates/lat} and {@code coordinates/lon}).
 *
 * @param <N> the element type of the tree being built
 */
public interface TreeWriter<N> {

    /** Creates the document's root element. */
    N newRoot(String name);

    /** Appends a new child element and returns it. */
    N appendChild(N parent, String name);

    /** Returns the first child element with the given name that was appended so far. */
    Optional<N> child(N parent, String name);

    /** Sets an attribute, replacing any previous value. */
    void setAttribute(N node, String name, String value);

    /** Sets the element's text content. */
    void setText(N node, String text);
}
