package io.xmldecl.core.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers over decoded/encoded values: the emptiness rule behind {@code omitEmpty}, and copying
 * of declared defaults so that no two decode calls share a mutable default.
 *
 * <p>Thread-safe: stateless utility class.
 */
public final class StructuredValues {

    private StructuredValues() {}

    /**
     * True for {@code null}, {@code ""}, {@code false}, numeric zero, an empty collection and an
     * empty map. Everything else, including user objects, is non-empty.
     */
    public static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence s) {
            return s.length() == 0;
        }
        if (value instanceof Boolean b) {
            return !b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() == 0d;
        }
        if (value instanceof Collection<?> c) {
            return c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return m.isEmpty();
        }
        return false;
    }

    /** Copies maps and lists recursively; scalars and user objects are returned as they are. */
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, deepCopy(v)));
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(v -> copy.add(deepCopy(v)));
            return copy;
        }
        return value;
    }
}
