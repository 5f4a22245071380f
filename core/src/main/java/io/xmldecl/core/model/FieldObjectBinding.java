package io.xmldecl.core.model;

import io.xmldecl.core.error.InvalidRootProcessorException;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** {@link ObjectBinding} over a class's no-argument constructor and instance fields. */
final class FieldObjectBinding<T> implements ObjectBinding<T> {

    private final Class<T> type;
    private final Constructor<T> constructor;
    private final Map<String, Field> fields;

    FieldObjectBinding(Class<T> type) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        try {
            this.constructor = type.getDeclaredConstructor();
            this.constructor.setAccessible(true);
        } catch (NoSuchMethodException | RuntimeException e) {
            throw new InvalidRootProcessorException(
                    "User object type " + type.getName() + " has no accessible no-argument constructor", e);
        }
        this.fields = collectFields(type);
    }

    @Override
    public Class<T> type() {
        return type;
    }

    @Override
    public T construct() {
        try {
            return constructor.newInstance();
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("Constructor of " + type.getName() + " failed", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot instantiate " + type.getName(), e);
        }
    }

    @Override
    public void assign(T target, String field, Object value) {
        Field member = field(field);
        // Primitive fields keep their constructor value when nothing was decoded
        if (value == null && member.getType().isPrimitive()) {
            return;
        }
        try {
            member.set(target, value);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot assign " + type.getName() + "." + field, e);
        }
    }

    @Override
    public Object read(T source, String field) {
        try {
            return field(field).get(source);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read " + type.getName() + "." + field, e);
        }
    }

    @Override
    public void checkFields(Collection<String> names) {
        for (String name : names) {
            if (!fields.containsKey(name)) {
                throw new InvalidRootProcessorException(
                        "User object type " + type.getName() + " has no field '" + name + "'");
            }
        }
    }

    private Field field(String name) {
        Field field = fields.get(name);
        if (field == null) {
            throw new IllegalArgumentException("No field '" + name + "' on " + type.getName());
        }
        return field;
    }

    private static Map<String, Field> collectFields(Class<?> type) {
        Map<String, Field> fields = new LinkedHashMap<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field field : c.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (Modifier.isStatic(modifiers) || Modifier.isFinal(modifiers) || field.isSynthetic()) {
                    continue;
                }
                // Subclass fields shadow superclass fields of the same name
                if (!fields.containsKey(field.getName())) {
                    field.setAccessible(true);
                    fields.put(field.getName(), field);
                }
            }
        }
        return Map.copyOf(fields);
    }
}
