package org.pxdforge.generator.frontend.ast;

/**
 * Member access of a cursor. {@link #NONE} marks declarations that are not class
 * members and are therefore always visible.
 */
public enum AccessSpecifier {
    PUBLIC,
    PROTECTED,
    PRIVATE,
    NONE;

    public boolean isVisible() {
        return this == PUBLIC || this == NONE;
    }

    public static AccessSpecifier parse(String name) {
        if (name == null) {
            return NONE;
        }
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return NONE;
        }
    }
}
