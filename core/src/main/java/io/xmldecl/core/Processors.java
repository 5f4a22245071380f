package io.xmldecl.core;

import io.xmldecl.core.model.ArrayProcessor;
import io.xmldecl.core.model.DictionaryProcessor;
import io.xmldecl.core.model.NamedTupleProcessor;
import io.xmldecl.core.model.ObjectBinding;
import io.xmldecl.core.model.PathExpression;
import io.xmldecl.core.model.PrimitiveProcessor;
import io.xmldecl.core.model.PrimitiveType;
import io.xmldecl.core.model.Processor;
import io.xmldecl.core.model.ProcessorSettings;
import io.xmldecl.core.model.TupleBinding;
import io.xmldecl.core.model.UserObjectProcessor;
import java.util.List;

/**
 * Declaration DSL for processor trees.
 *
 * <pre>{@code
 * Processor author = Processors.dictionary("author",
 *         Processors.string("name"),
 *         Processors.integer("birth-year"),
 *         Processors.array(Processors.dictionary("book",
 *                 Processors.string("title"),
 *                 Processors.integer("published")), "books").alias("works"));
 * }</pre>
 *
 * <p>Every processor starts out required with no alias, default or hooks. Declaration mistakes
 * fail immediately with {@link io.xmldecl.core.error.InvalidRootProcessorException}.
 */
public final class Processors {

    private Processors() {}

    public static PrimitiveProcessor bool(String path) {
        return primitive(path, null, PrimitiveType.BOOLEAN, false);
    }

    public static PrimitiveProcessor bool(String path, String attribute) {
        return primitive(path, attribute, PrimitiveType.BOOLEAN, false);
    }

    public static PrimitiveProcessor integer(String path) {
        return primitive(path, null, PrimitiveType.INTEGER, false);
    }

    public static PrimitiveProcessor integer(String path, String attribute) {
        return primitive(path, attribute, PrimitiveType.INTEGER, false);
    }

    public static PrimitiveProcessor floatingPoint(String path) {
        return primitive(path, null, PrimitiveType.FLOAT, false);
    }

    public static PrimitiveProcessor floatingPoint(String path, String attribute) {
        return primitive(path, attribute, PrimitiveType.FLOAT, false);
    }

    /** A string held in element text; surrounding whitespace is stripped on decode. */
    public static PrimitiveProcessor string(String path) {
        return primitive(path, null, PrimitiveType.STRING, true);
    }

    /** A string held in an attribute; surrounding whitespace is stripped on decode. */
    public static PrimitiveProcessor string(String path, String attribute) {
        return primitive(path, attribute, PrimitiveType.STRING, true);
    }

    /**
     * A string with explicit whitespace handling.
     *
     * @param attribute       attribute name, or {@code null} for element text
     * @param stripWhitespace {@code false} to keep the text exactly as written
     */
    public static PrimitiveProcessor string(String path, String attribute, boolean stripWhitespace) {
        return primitive(path, attribute, PrimitiveType.STRING, stripWhitespace);
    }

    public static DictionaryProcessor dictionary(String path, Processor... children) {
        return dictionary(path, List.of(children));
    }

    public static DictionaryProcessor dictionary(String path, List<Processor> children) {
        return new DictionaryProcessor(PathExpression.parse(path), children, ProcessorSettings.defaults());
    }

    /** An array whose items are direct children of the parent element. */
    public static ArrayProcessor array(Processor item) {
        return array(item, (PathExpression) null);
    }

    /** An array whose items live inside the container element {@code nested}. */
    public static ArrayProcessor array(Processor item, String nested) {
        return array(item, PathExpression.parse(nested));
    }

    private static ArrayProcessor array(Processor item, PathExpression nested) {
        boolean required = item == null || item.required();
        return new ArrayProcessor(item, nested, ProcessorSettings.defaults().withRequired(required));
    }

    /** A user object bound by field name; {@code type} needs a no-argument constructor. */
    public static <T> UserObjectProcessor<T> userObject(String path, Class<T> type, Processor... children) {
        return userObject(path, ObjectBinding.fields(type), children);
    }

    public static <T> UserObjectProcessor<T> userObject(String path, ObjectBinding<T> binding, Processor... children) {
        return userObject(path, binding, List.of(children));
    }

    public static <T> UserObjectProcessor<T> userObject(
            String path, ObjectBinding<T> binding, List<Processor> children) {
        return new UserObjectProcessor<>(PathExpression.parse(path), binding, children, ProcessorSettings.defaults());
    }

    /** A Java record; each child's alias names a record component. */
    public static <T extends Record> NamedTupleProcessor<T> namedTuple(
            String path, Class<T> type, Processor... children) {
        return namedTuple(path, type, List.of(children));
    }

    public static <T extends Record> NamedTupleProcessor<T> namedTuple(
            String path, Class<T> type, List<Processor> children) {
        return new NamedTupleProcessor<>(
                PathExpression.parse(path), TupleBinding.of(type), children, ProcessorSettings.defaults());
    }

    private static PrimitiveProcessor primitive(String path, String attribute, PrimitiveType type, boolean strip) {
        return new PrimitiveProcessor(PathExpression.parse(path), attribute, type, strip, ProcessorSettings.defaults());
    }
}
