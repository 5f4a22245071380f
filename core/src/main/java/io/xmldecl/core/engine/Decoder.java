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
import io.xmldecl.core.model.UserObjectProcessor;
import io.xmldecl.core.spi.TreeReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Walks a processor tree against a parsed document and produces the structured value:
 * {@code Map<String, Object>} for dictionaries, {@code List<Object>} for arrays, user objects
 * and records for the object processors, and boxed scalars for primitives.
 *
 * <p>Single pass, depth-first, children in declaration order. The first failure aborts the whole
 * decode and carries the location where it happened.
 *
 * <p>Thread-safe if the {@link TreeReader} is; holds no per-call state.
 *
 * @param <N> element type of the document tree
 */
public final class Decoder<N> {

    private final TreeReader<N> reader;

    public Decoder(TreeReader<N> reader) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
    }

    /**
     * Decodes a whole document.
     *
     * @param root     a root-capable processor whose path starts with the root element's name
     * @param document the document's root element
     * @return the decoded value
     * @throws io.xmldecl.core.error.XmlProcessingException on the first failure
     */
    public Object decode(Processor root, N document) {
        RootValidator.requireRoot(root);
        Objects.requireNonNull(document, "document must not be null");

        List<String> names = root.path().names();
        Location location = Location.root().descend(names);
        Optional<N> element = names.get(0).equals(reader.name(document))
                ? PathResolver.resolve(reader, document, names.subList(1, names.size()))
                : Optional.empty();

        if (root instanceof ArrayProcessor array) {
            if (element.isEmpty()) {
                return absentArray(array, location);
            }
            return decodeItems(array, element.get(), location);
        }
        return decodeAggregate((AggregateProcessor) root, element, location);
    }

    // --- Children: the processor's path is resolved relative to the parent element ---

    private Object decodeChild(Processor processor, N parent, Location parentLocation) {
        if (processor instanceof ArrayProcessor array) {
            return decodeArray(array, parent, parentLocation);
        }
        List<String> names = processor.path().names();
        Location location = parentLocation.descend(names);
        Optional<N> element = PathResolver.resolve(reader, parent, names);
        if (processor instanceof PrimitiveProcessor primitive) {
            return decodePrimitive(primitive, element, location);
        }
        return decodeAggregate((AggregateProcessor) processor, element, location);
    }

    // --- Array items: the item element has already been located ---

    private Object decodeItem(Processor processor, N element, Location location) {
        if (processor instanceof PrimitiveProcessor primitive) {
            return decodePrimitive(primitive, Optional.of(element), location);
        }
        if (processor instanceof ArrayProcessor array) {
            return decodeItems(array, element, location);
        }
        return decodeAggregate((AggregateProcessor) processor, Optional.of(element), location);
    }

    private Object decodePrimitive(PrimitiveProcessor processor, Optional<N> element, Location location) {
        Optional<String> raw;
        if (element.isEmpty()) {
            raw = Optional.empty();
        } else if (processor.isAttribute()) {
            raw = reader.attribute(element.get(), processor.attribute());
        } else {
            raw = Optional.of(reader.text(element.get()).orElse(""));
        }

        if (raw.isEmpty()) {
            if (processor.required()) {
                throw new MissingValueException(
                        missingDetail(processor, element.isPresent()), location.toString(), Phase.DECODE);
            }
            // Defaults were never parsed, so hooks do not see them
            return StructuredValues.deepCopy(processor.settings().defaultValue());
        }

        Object value;
        try {
            value = PrimitiveCodec.parse(raw.get(), processor.type(), processor.stripWhitespace());
        } catch (IllegalArgumentException e) {
            throw new InvalidPrimitiveValueException(e.getMessage(), raw.get(), e, location.toString(), Phase.DECODE);
        }
        return HookInvoker.afterDecode(processor.hooks(), location, value);
    }

    private Object decodeAggregate(AggregateProcessor processor, Optional<N> element, Location location) {
        if (element.isEmpty()) {
            if (processor.required()) {
                throw new MissingValueException(
                        "Missing required aggregate \"" + processor.alias() + "\"", location.toString(), Phase.DECODE);
            }
            Object fallback = StructuredValues.deepCopy(processor.settings().defaultValue());
            if (fallback == null && processor instanceof DictionaryProcessor) {
                return new LinkedHashMap<String, Object>();
            }
            return fallback;
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        for (Processor child : processor.children()) {
            fields.put(child.alias(), decodeChild(child, element.get(), location));
        }
        Object value = build(processor, fields, location);
        return HookInvoker.afterDecode(processor.hooks(), location, value);
    }

    private Object build(AggregateProcessor processor, Map<String, Object> fields, Location location) {
        try {
            if (processor instanceof DictionaryProcessor) {
                return fields;
            }
            if (processor instanceof UserObjectProcessor<?> userObject) {
                return construct(userObject.binding(), fields);
            }
            if (processor instanceof NamedTupleProcessor<?> tuple) {
                return tuple.binding().construct(fields);
            }
        } catch (IllegalArgumentException | IllegalStateException | ClassCastException e) {
            throw new InvalidPrimitiveValueException(
                    "Cannot build \"" + processor.alias() + "\": " + e.getMessage(),
                    fields,
                    e,
                    location.toString(),
                    Phase.DECODE);
        }
        throw new IllegalStateException("Unhandled aggregate processor: " + processor.getClass().getName());
    }

    private static <T> T construct(ObjectBinding<T> binding, Map<String, Object> fields) {
        T instance = binding.construct();
        fields.forEach((field, value) -> binding.assign(instance, field, value));
        return instance;
    }

    private Object decodeArray(ArrayProcessor array, N parent, Location parentLocation) {
        if (array.isEmbedded()) {
            return decodeItems(array, parent, parentLocation);
        }
        List<String> names = array.nested().names();
        Location location = parentLocation.descend(names);
        Optional<N> container = PathResolver.resolve(reader, parent, names);
        if (container.isEmpty()) {
            return absentArray(array, location);
        }
        return decodeItems(array, container.get(), location);
    }

    private Object absentArray(ArrayProcessor array, Location location) {
        if (array.required()) {
            throw new MissingValueException(
                    "Missing required array \"" + array.alias() + "\"", location.toString(), Phase.DECODE);
        }
        return new ArrayList<>();
    }

    private Object decodeItems(ArrayProcessor array, N container, Location location) {
        Processor item = array.item();
        List<String> names = item.path().names();
        List<String> parentSteps = PathResolver.parentSteps(names);
        String itemName = PathResolver.lastStep(names);
        Location holderLocation = location.descend(parentSteps);

        List<N> elements = PathResolver.resolve(reader, container, parentSteps)
                .map(holder -> reader.children(holder, itemName))
                .orElse(List.of());
        if (elements.isEmpty() && item.required()) {
            throw new MissingValueException(
                    "Missing required array \"" + array.alias() + "\"", location.toString(), Phase.DECODE);
        }

        List<Object> values = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            values.add(decodeItem(item, elements.get(i), holderLocation.item(itemName, i)));
        }
        return HookInvoker.afterDecode(array.hooks(), location, values);
    }

    private static String missingDetail(PrimitiveProcessor processor, boolean elementPresent) {
        if (processor.isAttribute()) {
            return elementPresent
                    ? "Missing required attribute \"" + processor.attribute() + "\""
                    : "Missing required attribute \"" + processor.attribute() + "\" (element absent)";
        }
        return "Missing required element \"" + processor.alias() + "\"";
    }
}
