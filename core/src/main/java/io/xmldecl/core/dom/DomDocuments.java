package io.xmldecl.core.dom;

import io.xmldecl.core.error.DocumentParseException;
import io.xmldecl.core.error.XmlProcessingException.Phase;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Result;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.DOMException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * Parses and writes DOM documents for the processor engine.
 *
 * <p>Parsing is hardened against external entities and DOCTYPE declarations. Namespaces are
 * stripped after parsing: every element and attribute is renamed to its local name and
 * {@code xmlns} declarations are dropped, so processors select by plain names.
 *
 * <p>Thread-safe: stateless utility class; a fresh builder or transformer is created per call.
 */
public final class DomDocuments {

    private static final Logger LOG = LoggerFactory.getLogger(DomDocuments.class);

    private static final DocumentBuilderFactory FACTORY = createHardenedFactory();

    private DomDocuments() {}

    /** Parses markup held in a string. */
    public static Document parse(String xml) {
        return parse(new InputSource(new StringReader(xml)));
    }

    /** Parses markup bytes; the encoding comes from the XML declaration, UTF-8 by default. */
    public static Document parse(byte[] xml) {
        return parse(new InputSource(new ByteArrayInputStream(xml)));
    }

    /** Parses markup from a stream. The stream is not closed. */
    public static Document parse(InputStream xml) {
        return parse(new InputSource(xml));
    }

    /** Parses a file. */
    public static Document parse(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            InputSource source = new InputSource(in);
            source.setSystemId(file.toUri().toString());
            return parse(source);
        } catch (IOException e) {
            throw new DocumentParseException("Cannot read " + file + ": " + e.getMessage(), e, Phase.DECODE);
        }
    }

    /** Creates an empty document. */
    public static Document newDocument() {
        Document document = newBuilder(Phase.ENCODE).newDocument();
        document.setXmlStandalone(true);
        return document;
    }

    /**
     * Renders a document without an XML declaration.
     *
     * @param indent spaces per nesting level; {@code 0} for a single line
     */
    public static String toString(Document document, int indent) {
        StringWriter out = new StringWriter();
        transform(document, new StreamResult(out), false, indent);
        return out.toString();
    }

    /** Renders a document as UTF-8 bytes with an XML declaration. */
    public static byte[] toBytes(Document document, int indent) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        transform(document, new StreamResult(out), true, indent);
        return out.toByteArray();
    }

    /** Writes a document to a file as UTF-8 with an XML declaration, replacing any existing file. */
    public static void write(Document document, Path file, int indent) {
        try (OutputStream out = Files.newOutputStream(file)) {
            transform(document, new StreamResult(out), true, indent);
        } catch (IOException e) {
            throw new DocumentParseException("Cannot write " + file + ": " + e.getMessage(), e, Phase.ENCODE);
        }
    }

    private static Document parse(InputSource source) {
        Document document;
        try {
            document = newBuilder(Phase.DECODE).parse(source);
        } catch (SAXException e) {
            throw new DocumentParseException("Malformed XML: " + e.getMessage(), e, Phase.DECODE);
        } catch (IOException e) {
            throw new DocumentParseException("Cannot read XML: " + e.getMessage(), e, Phase.DECODE);
        }
        try {
            stripNamespaces(document);
        } catch (DOMException e) {
            throw new DocumentParseException("Cannot strip namespaces: " + e.getMessage(), e, Phase.DECODE);
        }
        return document;
    }

    static void stripNamespaces(Document document) {
        int renamed = 0;
        List<Element> pending = new ArrayList<>();
        pending.add(document.getDocumentElement());
        while (!pending.isEmpty()) {
            Element element = pending.remove(pending.size() - 1);
            if (element.getNamespaceURI() != null || element.getPrefix() != null) {
                element = (Element) document.renameNode(element, null, element.getLocalName());
                renamed++;
            }
            renamed += stripAttributes(document, element);
            for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
                if (child instanceof Element childElement) {
                    pending.add(childElement);
                }
            }
        }
        if (renamed > 0) {
            LOG.debug("namespaces.stripped renamed_nodes={}", renamed);
        }
    }

    private static int stripAttributes(Document document, Element element) {
        int renamed = 0;
        NamedNodeMap attributes = element.getAttributes();
        List<Attr> namespaced = new ArrayList<>();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attribute = (Attr) attributes.item(i);
            if (attribute.getNamespaceURI() != null) {
                namespaced.add(attribute);
            }
        }
        for (Attr attribute : namespaced) {
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attribute.getNamespaceURI())) {
                element.removeAttributeNode(attribute);
            } else {
                document.renameNode(attribute, null, attribute.getLocalName());
            }
            renamed++;
        }
        return renamed;
    }

    private static void transform(Document document, Result result, boolean declaration, int indent) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, declaration ? "no" : "yes");
            if (indent > 0) {
                transformer.setOutputProperty(OutputKeys.INDENT, "yes");
                transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", Integer.toString(indent));
            }
            transformer.transform(new DOMSource(document), result);
        } catch (TransformerException e) {
            throw new DocumentParseException("Cannot serialize XML: " + e.getMessage(), e, Phase.ENCODE);
        }
    }

    private static DocumentBuilder newBuilder(Phase phase) {
        try {
            return FACTORY.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new DocumentParseException("XML parser unavailable: " + e.getMessage(), e, phase);
        }
    }

    private static DocumentBuilderFactory createHardenedFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Cannot harden XML parser", e);
        }
        return factory;
    }
}
