package io.xmldecl.core.model;

import io.xmldecl.core.error.InvalidRootProcessorException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds and reads instances of a Java {@code record} by component name. Components without a
 * decoded value receive {@code null}, or zero / {@code false} for primitive components.
 *
 * <p>Thread-safe and immutable.
 *
 * @param <T> the record type
 */
public final class TupleBinding<T extends Record> {

    private static final Map<Class<?>, Object> PRIMITIVE_ZEROS = Map.of(
            boolean.class, false,
            byte.class, (byte) 0,
            short.class, (short) 0,
            char.class, (char) 0,
            int.class, 0,
            long.class, 0L,
            float.class, 0f,
            double.class, 0d);

    private final Class<T> type;
    private final RecordComponent[] components;
    private final Map<String, Method> accessors;
    private final Constructor<T> canonical;

    private TupleBinding(Class<T> type) {
        this.type = type;
        this.components = type.getRecordComponents();
        Map<String, Method> byName = new LinkedHashMap<>();
        Class<?>[] parameterTypes = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) {
            Method accessor = components[i].getAccessor();
            accessor.setAccessible(true);
            byName.put(components[i].getName(), accessor);
            parameterTypes[i] = components[i].getType();
        }
        this.accessors = byName;
        try {
            this.canonical = type.getDeclaredConstructor(parameterTypes);
            this.canonical.setAccessible(true);
        } catch (NoSuchMethodException | RuntimeException e) {
            throw new InvalidRootProcessorException(
                    "Record " + type.getName() + " has no accessible canonical constructor", e);
        }
    }

    /**
     * Creates a binding for the given record type.
     *
     * @throws InvalidRootProcessorException if {@code type} is null or not a record
     */
    public static <T extends Record> TupleBinding<T> of(Class<T> type) {
        if (type == null || !type.isRecord()) {
            throw new InvalidRootProcessorException(
                    "Named tuple type must be a record class, got: " + (type == null ? "null" : type.getName()));
        }
        return new TupleBinding<>(type);
    }

    /** The record class. */
    public Class<T> type() {
        return type;
    }

    /**
     * Builds an instance from decoded values keyed by component name.
     *
     * @throws IllegalArgumentException if a value does not fit its component type
     */
    public T construct(Map<String, Object> values) {
        Object[] arguments = new Object[components.length];
        for (int i = 0; i < components.length; i++) {
            Object value = values.get(components[i].getName());
            arguments[i] = value == null ? PRIMITIVE_ZEROS.get(components[i].getType()) : value;
        }
        try {
            return canonical.newInstance(arguments);
        } catch (InvocationTargetException e) {
            throw new IllegalArgumentException(
                    "Constructor of " + type.getName() + " rejected " + values, e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Cannot construct " + type.getName() + " from " + values, e);
        }
    }

    /** Reads a component value. */
    public Object read(T source, String component) {
        Method accessor = accessors.get(component);
        if (accessor == null) {
            throw new IllegalArgumentException("No component '" + component + "' on " + type.getName());
        }
        try {
            return accessor.invoke(source);
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("Accessor " + type.getName() + "." + component + " failed", e.getCause());
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read " + type.getName() + "." + component, e);
        }
    }

    /**
     * Verifies that every name in {@code names} is a component of the record.
     *
     * @throws InvalidRootProcessorException if a name is not a component
     */
    void checkComponents(Collection<String> names) {
        for (String name : names) {
            if (!accessors.containsKey(name)) {
                throw new InvalidRootProcessorException(
                        "Record " + type.getName() + " has no component '" + name + "'; recognized components are: "
                                + accessors.keySet());
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TupleBinding<?> other && type.equals(other.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type);
    }

    @Override
    public String toString() {
        return "TupleBinding[" + type.getName() + "]";
    }
}
