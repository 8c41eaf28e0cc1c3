package org.pxdforge.generator.frontend.ast;

/**
 * Shape of a {@link TypeDescriptor}. Decorations wrap another descriptor,
 * everything else is a base type.
 */
public enum TypeKind {
    BUILTIN,
    POINTER,
    LVALUE_REFERENCE,
    RVALUE_REFERENCE,
    CONSTANT_ARRAY,
    INCOMPLETE_ARRAY,
    RECORD,
    ENUM,
    TYPEDEF,
    TEMPLATE_PARAMETER,
    FUNCTION_PROTO,
    DEPENDENT,
    BLOCK_POINTER,
    UNEXPOSED;

    public boolean isDecoration() {
        return this == POINTER || this == LVALUE_REFERENCE || this == RVALUE_REFERENCE
                || this == CONSTANT_ARRAY || this == INCOMPLETE_ARRAY;
    }

    public boolean isArray() {
        return this == CONSTANT_ARRAY || this == INCOMPLETE_ARRAY;
    }

    public static TypeKind parse(String name) {
        if (name == null) {
            return UNEXPOSED;
        }
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNEXPOSED;
        }
    }
}
