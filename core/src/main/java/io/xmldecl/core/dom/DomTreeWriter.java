package io.xmldecl.core.dom;

import io.xmldecl.core.spi.TreeWriter;
import java.util.Optional;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * {@link TreeWriter} that builds a W3C DOM. Every {@link #newRoot} call starts a fresh
 * {@link Document}; the root element's {@code getOwnerDocument()} gives access to it.
 *
 * <p>Thread-safe and stateless; documents are never shared between calls.
 */
public final class DomTreeWriter implements TreeWriter<Element> {

    public static final DomTreeWriter INSTANCE = new DomTreeWriter();

    private DomTreeWriter() {}

    @Override
    public Element newRoot(String name) {
        Document document = DomDocuments.newDocument();
        Element root = document.createElement(name);
        document.appendChild(root);
        return root;
    }

    @Override
    public Element appendChild(Element parent, String name) {
        Element child = parent.getOwnerDocument().createElement(name);
        parent.appendChild(child);
        return child;
    }

    @Override
    public Optional<Element> child(Element parent, String name) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element && name.equals(element.getTagName())) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    @Override
    public void setAttribute(Element node, String name, String value) {
        node.setAttribute(name, value);
    }

    /**
     * Replaces the element's own text; child elements already appended are kept. Empty text leaves
     * a bare element.
     */
    @Override
    public void setText(Element node, String text) {
        Node child = node.getFirstChild();
        while (child != null) {
            Node next = child.getNextSibling();
            if (child.getNodeType() == Node.TEXT_NODE) {
                node.removeChild(child);
            }
            child = next;
        }
        if (!text.isEmpty()) {
            node.insertBefore(node.getOwnerDocument().createTextNode(text), node.getFirstChild());
        }
    }
}
