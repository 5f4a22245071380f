package io.xmldecl.core.model;

import java.util.Collection;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * How a {@link UserObjectProcessor} creates, fills and reads instances of a user type: a
 * zero-argument constructor plus per-field assignment and read access.
 *
 * <p>Use {@link #of} with lambdas for full control, or {@link #fields} to bind a class with a
 * no-argument constructor by its field names.
 *
 * @param <T> the user type
 */
public interface ObjectBinding<T> {

    /** The user type; values handed to the encoder must be instances of it. */
    Class<T> type();

    /** Creates an empty instance. */
    T construct();

    /** Assigns one decoded field value. */
    void assign(T target, String field, Object value);

    /** Reads one field value for encoding; {@code null} if unset. */
    Object read(T source, String field);

    /**
     * Verifies at declaration time that every name in {@code fields} can be assigned and read.
     *
     * @throws io.xmldecl.core.error.InvalidRootProcessorException if a field is unknown
     */
    default void checkFields(Collection<String> fields) {}

    /** Assigns a field on a user object. */
    @FunctionalInterface
    interface FieldAssigner<T> {
        void assign(T target, String field, Object value);
    }

    /** Reads a field from a user object. */
    @FunctionalInterface
    interface FieldReader<T> {
        Object read(T source, String field);
    }

    /** A binding built from explicit callbacks. */
    static <T> ObjectBinding<T> of(
            Class<T> type, Supplier<T> constructor, FieldAssigner<T> assigner, FieldReader<T> reader) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(constructor, "constructor must not be null");
        Objects.requireNonNull(assigner, "assigner must not be null");
        Objects.requireNonNull(reader, "reader must not be null");
        return new ObjectBinding<>() {
            @Override
            public Class<T> type() {
                return type;
            }

            @Override
            public T construct() {
                return constructor.get();
            }

            @Override
            public void assign(T target, String field, Object value) {
                assigner.assign(target, field, value);
            }

            @Override
            public Object read(T source, String field) {
                return reader.read(source, field);
            }
        };
    }

    /**
     * A binding that instantiates {@code type} through its no-argument constructor and accesses
     * its instance fields (including inherited ones) by name.
     */
    static <T> ObjectBinding<T> fields(Class<T> type) {
        return new FieldObjectBinding<>(type);
    }
}
