package io.github.eutro.mirlens.core.index;

/**
 * The broad kind of a type table entry.
 */
public enum TypeKind {
    PRIMITIVE,
    ENUM,
    STRUCT,
    UNION,
    ARRAY,
    POINTER,
    REFERENCE,
    TUPLE,
    FUNCTION,
    VOID,
}
