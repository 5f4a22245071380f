package io.xmldecl.core.dom;

import io.xmldecl.core.spi.TreeReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * {@link TreeReader} over a W3C DOM. Element names are compared by local name, so a document
 * parsed with namespaces matches un-prefixed selectors.
 *
 * <p>Text is the concatenation of the element's direct text and CDATA children; text inside child
 * elements is not included.
 *
 * <p>Thread-safe and stateless.
 */
public final class DomTreeReader implements TreeReader<Element> {

    public static final DomTreeReader INSTANCE = new DomTreeReader();

    private DomTreeReader() {}

    @Override
    public String name(Element node) {
        return nameOf(node);
    }

    @Override
    public Optional<Element> child(Element node, String name) {
        for (Node child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element && name.equals(nameOf(element))) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    @Override
    public List<Element> children(Element node, String name) {
        List<Element> matches = new ArrayList<>();
        NodeList nodes = node.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element element && name.equals(nameOf(element))) {
                matches.add(element);
            }
        }
        return matches;
    }

    @Override
    public Optional<String> attribute(Element node, String name) {
        return node.hasAttribute(name) ? Optional.of(node.getAttribute(name)) : Optional.empty();
    }

    @Override
    public Optional<String> text(Element node) {
        StringBuilder text = null;
        for (Node child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
            short type = child.getNodeType();
            if (type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE) {
                if (text == null) {
                    text = new StringBuilder();
                }
                text.append(child.getNodeValue());
            }
        }
        return text == null ? Optional.empty() : Optional.of(text.toString());
    }

    static String nameOf(Element element) {
        return element.getLocalName() != null ? element.getLocalName() : element.getTagName();
    }
}
