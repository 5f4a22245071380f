package io.xmldecl.core;

import io.xmldecl.core.dom.DomDocuments;
import io.xmldecl.core.dom.DomTreeReader;
import io.xmldecl.core.dom.DomTreeWriter;
import io.xmldecl.core.engine.Decoder;
import io.xmldecl.core.engine.Encoder;
import io.xmldecl.core.model.Processor;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Entry points that run a processor tree against XML text, bytes, streams, files or DOM
 * documents.
 *
 * <pre>{@code
 * Map<String, Object> author = (Map<String, Object>) XmlMapper.decode(processor, xml);
 * String xml = XmlMapper.encodeToString(processor, author, 2);
 * }</pre>
 *
 * <p>Thread-safe and stateless; processor trees may be shared by concurrent calls.
 */
public final class XmlMapper {

    private static final Logger LOG = LoggerFactory.getLogger(XmlMapper.class);

    private static final Decoder<Element> DECODER = new Decoder<>(DomTreeReader.INSTANCE);
    private static final Encoder<Element> ENCODER = new Encoder<>(DomTreeWriter.INSTANCE);

    private XmlMapper() {}

    /**
     * Decodes a parsed document.
     *
     * @return a {@code Map}, {@code List}, user object or record, depending on the root processor
     * @throws io.xmldecl.core.error.XmlProcessingException on the first failure
     */
    public static Object decode(Processor root, Document document) {
        Objects.requireNonNull(document, "document must not be null");
        long start = System.nanoTime();
        Object value = DECODER.decode(root, document.getDocumentElement());
        LOG.debug("decode.completed root={} duration_us={}", root.alias(), (System.nanoTime() - start) / 1_000);
        return value;
    }

    /** Decodes XML text. */
    public static Object decode(Processor root, String xml) {
        return decode(root, DomDocuments.parse(xml));
    }

    /** Decodes XML bytes. */
    public static Object decode(Processor root, byte[] xml) {
        return decode(root, DomDocuments.parse(xml));
    }

    /** Decodes XML read from a stream; the stream is left open. */
    public static Object decode(Processor root, InputStream xml) {
        return decode(root, DomDocuments.parse(xml));
    }

    /** Decodes an XML file. */
    public static Object decode(Processor root, Path file) {
        return decode(root, DomDocuments.parse(file));
    }

    /**
     * Encodes a value into a new DOM document.
     *
     * @throws io.xmldecl.core.error.XmlProcessingException on the first failure
     */
    public static Document encode(Processor root, Object value) {
        long start = System.nanoTime();
        Element element = ENCODER.encode(root, value);
        LOG.debug("encode.completed root={} duration_us={}", root.alias(), (System.nanoTime() - start) / 1_000);
        return element.getOwnerDocument();
    }

    /** Encodes a value to a single line of XML without a declaration. */
    public static String encodeToString(Processor root, Object value) {
        return encodeToString(root, value, 0);
    }

    /**
     * Encodes a value to XML text without a declaration.
     *
     * @param indent spaces per nesting level; {@code 0} for a single line
     */
    public static String encodeToString(Processor root, Object value, int indent) {
        return DomDocuments.toString(encode(root, value), indent);
    }

    /** Encodes a value to UTF-8 bytes with an XML declaration. */
    public static byte[] encodeToBytes(Processor root, Object value) {
        return DomDocuments.toBytes(encode(root, value), 0);
    }

    /** Encodes a value to a UTF-8 file with an XML declaration, replacing any existing file. */
    public static void encodeToFile(Processor root, Object value, Path file, int indent) {
        DomDocuments.write(encode(root, value), file, indent);
    }
}
