package io.xmldecl.core.engine;

import io.xmldecl.core.error.InvalidPrimitiveValueException;
import io.xmldecl.core.error.MissingValueException;
import io.xmldecl.core.error.XmlProcessingException.Phase;
import io.xmldecl.core.model.AggregateProcessor;
import io.xmldecl.core.model.ArrayProcessor;
import io.xmldecl.core.model.DictionaryProcessor;
import io.xmldecl.core.model.Location;
import io.xmldecl.core.model.NamedTupleProcessor;
import io.xmldecl.core.model.ObjectBinding;
import io.xmldecl.core.model.PrimitiveProcessor;
import io.xmldecl.core.model.Processor;
import io.xmldecl.core.model.TupleBinding;
import io.xmldecl.core.model.UserObjectProcessor;
import io.xmldecl.core.spi.TreeWriter;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Walks a processor tree against a structured value and builds the corresponding document. The
 * structural inverse of {@link Decoder}: aggregates read each child's value by alias, arrays
 * append one item element per sequence entry, primitives write element text or an attribute.
 *
 * <p>Write-only: elements shared by several processors ({@code coordinates/lat},
 * {@code coordinates/lon}) are looked up among the ones appended so far, never read back for
 * values.
 *
 * <p>Thread-safe if the {@link TreeWriter} is; holds no per-call state.
 *
 * @param <N> element type of the tree being built
 */
public final class Encoder<N> {

    private final TreeWriter<N> writer;

    public Encoder(TreeWriter<N> writer) {
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
    }

    /**
     * Encodes a whole document.
     *
     * @param root  a root-capable processor; the first step of its path names the root element
     * @param value the structured value
     * @return the root element of the new document
     * @throws io.xmldecl.core.error.XmlProcessingException on the first failure
     */
    public N encode(Processor root, Object value) {
        RootValidator.requireRoot(root);

        List<String> names = root.path().names();
        Location location = Location.root().descend(names);
        N document = writer.newRoot(names.get(0));
        N element = PathResolver.resolveOrCreate(writer, document, names.subList(1, names.size()));

        if (root instanceof ArrayProcessor array) {
            encodeItems(array, element, location, sequence(array, value, location));
        } else {
            encodeAggregateInto((AggregateProcessor) root, element, location, value);
        }
        return document;
    }

    // --- Children: paths are resolved (and created) relative to the parent element ---

    private void encodeChild(Processor processor, N parent, Location parentLocation, Object value) {
        if (processor instanceof PrimitiveProcessor primitive) {
            encodePrimitive(primitive, parent, parentLocation, value);
        } else if (processor instanceof ArrayProcessor array) {
            encodeArray(array, parent, parentLocation, value);
        } else {
            encodeAggregate((AggregateProcessor) processor, parent, parentLocation, value);
        }
    }

    private void encodePrimitive(PrimitiveProcessor processor, N parent, Location parentLocation, Object value) {
        List<String> names = processor.path().names();
        Location location = parentLocation.descend(names);
        Object output;
        if (value == null) {
            if (processor.required()) {
                throw new MissingValueException(
                        "Missing required value \"" + processor.alias() + "\"", location.toString(), Phase.ENCODE);
            }
            Object fallback = processor.settings().defaultValue();
            if (processor.settings().omitEmpty() || fallback == null) {
                return;
            }
            output = fallback;
        } else {
            output = HookInvoker.beforeEncode(processor.hooks(), location, value);
            if (processor.settings().omitEmpty() && StructuredValues.isEmpty(output)) {
                return;
            }
        }
        String text = serialize(processor, output, location);
        write(processor, PathResolver.resolveOrCreate(writer, parent, names), text);
    }

    private void encodeAggregate(AggregateProcessor processor, N parent, Location parentLocation, Object value) {
        List<String> names = processor.path().names();
        Location location = parentLocation.descend(names);
        if (value == null) {
            if (processor.required()) {
                throw new MissingValueException(
                        "Missing required aggregate \"" + processor.alias() + "\"", location.toString(), Phase.ENCODE);
            }
            return;
        }
        Object output = HookInvoker.beforeEncode(processor.hooks(), location, value);
        if (processor.settings().omitEmpty() && StructuredValues.isEmpty(output)) {
            return;
        }
        encodeFields(processor, PathResolver.resolveOrCreate(writer, parent, names), location, output);
    }

    private void encodeArray(ArrayProcessor array, N parent, Location parentLocation, Object value) {
        if (array.isEmbedded()) {
            encodeItems(array, parent, parentLocation, sequence(array, value, parentLocation));
            return;
        }
        List<String> names = array.nested().names();
        Location location = parentLocation.descend(names);
        Collection<?> items = sequence(array, value, location);
        if (items.isEmpty() && array.settings().omitEmpty()) {
            return;
        }
        encodeItems(array, PathResolver.resolveOrCreate(writer, parent, names), location, items);
    }

    // --- Array items: each item gets a freshly appended element ---

    private void encodeItems(ArrayProcessor array, N container, Location location, Collection<?> items) {
        Processor item = array.item();
        List<String> names = item.path().names();
        List<String> parentSteps = PathResolver.parentSteps(names);
        String itemName = PathResolver.lastStep(names);
        Location holderLocation = location.descend(parentSteps);
        N holder = PathResolver.resolveOrCreate(writer, container, parentSteps);

        int index = 0;
        for (Object itemValue : items) {
            N element = writer.appendChild(holder, itemName);
            encodeItem(item, element, holderLocation.item(itemName, index++), itemValue);
        }
    }

    private void encodeItem(Processor processor, N element, Location location, Object value) {
        if (processor instanceof PrimitiveProcessor primitive) {
            Object output = value != null
                    ? HookInvoker.beforeEncode(primitive.hooks(), location, value)
                    : primitive.settings().defaultValue();
            // Items are never omitted; an absent value leaves a bare element
            if (output != null) {
                write(primitive, element, serialize(primitive, output, location));
            }
        } else if (processor instanceof ArrayProcessor array) {
            encodeItems(array, element, location, sequence(array, value, location));
        } else {
            encodeAggregateInto((AggregateProcessor) processor, element, location, value);
        }
    }

    private void encodeAggregateInto(AggregateProcessor processor, N element, Location location, Object value) {
        if (value == null) {
            if (processor.required()) {
                throw new MissingValueException(
                        "Missing required aggregate \"" + processor.alias() + "\"", location.toString(), Phase.ENCODE);
            }
            return;
        }
        encodeFields(processor, element, location, HookInvoker.beforeEncode(processor.hooks(), location, value));
    }

    private void encodeFields(AggregateProcessor processor, N element, Location location, Object value) {
        for (Processor child : processor.children()) {
            encodeChild(child, element, location, readField(processor, value, child.alias(), location));
        }
    }

    private Object readField(AggregateProcessor processor, Object value, String field, Location location) {
        try {
            if (processor instanceof DictionaryProcessor) {
                if (value instanceof Map<?, ?> map) {
                    return map.get(field);
                }
                throw new InvalidPrimitiveValueException(
                        "Expected a Map for \"" + processor.alias() + "\", got " + value.getClass().getName(),
                        value,
                        location.toString(),
                        Phase.ENCODE);
            }
            if (processor instanceof UserObjectProcessor<?> userObject) {
                ObjectBinding<?> binding = userObject.binding();
                return readObject(binding, requireType(binding.type(), processor, value, location), field);
            }
            if (processor instanceof NamedTupleProcessor<?> tuple) {
                TupleBinding<?> binding = tuple.binding();
                return readRecord(binding, requireType(binding.type(), processor, value, location), field);
            }
        } catch (ClassCastException | IllegalArgumentException | IllegalStateException e) {
            throw new InvalidPrimitiveValueException(
                    "Cannot read \"" + field + "\" from \"" + processor.alias() + "\": " + e.getMessage(),
                    value,
                    e,
                    location.toString(),
                    Phase.ENCODE);
        }
        throw new IllegalStateException("Unhandled aggregate processor: " + processor.getClass().getName());
    }

    private static <T> Object readObject(ObjectBinding<T> binding, Object source, String field) {
        return binding.read(binding.type().cast(source), field);
    }

    private static <T extends Record> Object readRecord(TupleBinding<T> binding, Object source, String field) {
        return binding.read(binding.type().cast(source), field);
    }

    private static Object requireType(Class<?> type, AggregateProcessor processor, Object value, Location location) {
        if (!type.isInstance(value)) {
            throw new InvalidPrimitiveValueException(
                    "Expected a " + type.getName() + " for \"" + processor.alias() + "\", got "
                            + value.getClass().getName(),
                    value,
                    location.toString(),
                    Phase.ENCODE);
        }
        return value;
    }

    /** Runs the array hook and checks the sequence against the required flag. */
    private Collection<?> sequence(ArrayProcessor array, Object value, Location location) {
        if (value == null && array.required()) {
            throw new MissingValueException(
                    "Missing required array \"" + array.alias() + "\"", location.toString(), Phase.ENCODE);
        }
        Object output = value != null ? HookInvoker.beforeEncode(array.hooks(), location, value) : null;
        if (output == null) {
            return List.of();
        }
        if (!(output instanceof Collection<?> items)) {
            throw new InvalidPrimitiveValueException(
                    "Expected a sequence for \"" + array.alias() + "\", got " + output.getClass().getName(),
                    output,
                    location.toString(),
                    Phase.ENCODE);
        }
        if (items.isEmpty() && array.item().required()) {
            throw new MissingValueException(
                    "Missing required array \"" + array.alias() + "\"", location.toString(), Phase.ENCODE);
        }
        return items;
    }

    private static String serialize(PrimitiveProcessor processor, Object value, Location location) {
        try {
            return PrimitiveCodec.serialize(value, processor.type());
        } catch (IllegalArgumentException e) {
            throw new InvalidPrimitiveValueException(e.getMessage(), value, e, location.toString(), Phase.ENCODE);
        }
    }

    private void write(PrimitiveProcessor processor, N element, String text) {
        if (processor.isAttribute()) {
            writer.setAttribute(element, processor.attribute(), text);
        } else {
            writer.setText(element, text);
        }
    }
}
