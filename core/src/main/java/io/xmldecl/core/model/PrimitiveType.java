package io.xmldecl.core.model;

/** Scalar types a {@link PrimitiveProcessor} converts to and from markup text. */
public enum PrimitiveType {
    BOOLEAN(Boolean.class),
    INTEGER(Integer.class),
    FLOAT(Double.class),
    STRING(String.class);

    private final Class<?> javaType;

    PrimitiveType(Class<?> javaType) {
        this.javaType = javaType;
    }

    /** The Java type decoded values of this kind have. */
    public Class<?> javaType() {
        return javaType;
    }

    /** Lowercase name used in messages and YAML schemas, e.g. {@code "integer"}. */
    public String id() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
