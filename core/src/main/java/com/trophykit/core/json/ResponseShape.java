package com.trophykit.core.json;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Declared root shape of a response, chosen at the call site.
 * Only {@link Kind#OBJECT} demands content; the others have an empty value.
 *
 * @param <T> decoded Java type
 */
public final class ResponseShape<T> {

    public enum Kind { OBJECT, OPTIONAL, LIST, MAP }

    private final Kind kind;
    private final Class<?> elementType;

    private ResponseShape(Kind kind, Class<?> elementType) {
        this.kind = kind;
        this.elementType = Objects.requireNonNull(elementType, "elementType");
    }

    public static <T> ResponseShape<T> object(Class<T> type) {
        return new ResponseShape<>(Kind.OBJECT, type);
    }

    public static <T> ResponseShape<Optional<T>> optional(Class<T> type) {
        return new ResponseShape<>(Kind.OPTIONAL, type);
    }

    public static <T> ResponseShape<List<T>> listOf(Class<T> type) {
        return new ResponseShape<>(Kind.LIST, type);
    }

    /** JSON object keyed by string, e.g. {@code {"1234": {...}}}. */
    public static <V> ResponseShape<Map<String, V>> mapOf(Class<V> valueType) {
        return new ResponseShape<>(Kind.MAP, valueType);
    }

    public Kind kind() { return kind; }
    public Class<?> elementType() { return elementType; }
    public boolean requiresContent() { return kind == Kind.OBJECT; }

    @SuppressWarnings("unchecked")
    T emptyValue() {
        switch (kind) {
            case LIST: return (T) List.of();
            case MAP: return (T) Map.of();
            case OPTIONAL: return (T) Optional.empty();
            default: throw new IllegalStateException("OBJECT shape has no empty value");
        }
    }

    JavaType javaType(TypeFactory tf) {
        switch (kind) {
            case LIST: return tf.constructCollectionType(List.class, elementType);
            case MAP: return tf.constructMapType(Map.class, String.class, elementType);
            default: return tf.constructType(elementType);
        }
    }

    @SuppressWarnings("unchecked")
    T wrap(Object decoded) {
        if (kind == Kind.OPTIONAL) return (T) Optional.ofNullable(decoded);
        return (T) decoded;
    }

    @Override public String toString() { return kind + "<" + elementType.getSimpleName() + ">"; }
}
