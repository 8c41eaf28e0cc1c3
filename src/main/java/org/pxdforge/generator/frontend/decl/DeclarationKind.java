package org.pxdforge.generator.frontend.decl;

/**
 * The closed set of declaration variants. Renderers switch over this enum so that a new
 * variant fails compilation until every switch handles it.
 */
public enum DeclarationKind {
    DATA_MEMBER,
    FUNCTION,
    CONSTRUCTOR,
    ENUMERATION,
    UNION,
    STRUCT,
    TYPEDEF,
    MACRO,
    OPAQUE
}
