package org.pxdforge.generator.frontend.ast;

import java.util.EnumSet;
import java.util.Set;

/**
 * Kind tags of the cursors supplied by the external AST provider.
 * The names follow libclang's {@code CXCursorKind} so that dumps can be produced
 * with a thin exporter. Kinds the generator has no use for arrive as {@link #OTHER}.
 */
public enum CursorKind {
    TRANSLATION_UNIT,
    NAMESPACE,
    STRUCT_DECL,
    CLASS_DECL,
    CLASS_TEMPLATE,
    UNION_DECL,
    ENUM_DECL,
    ENUM_CONSTANT_DECL,
    FIELD_DECL,
    VAR_DECL,
    PARM_DECL,
    FUNCTION_DECL,
    FUNCTION_TEMPLATE,
    CXX_METHOD,
    CONSTRUCTOR,
    DESTRUCTOR,
    TYPEDEF_DECL,
    TYPE_ALIAS_DECL,
    MACRO_DEFINITION,
    TEMPLATE_TYPE_PARAMETER,
    TEMPLATE_NON_TYPE_PARAMETER,
    OTHER;

    private static final Set<CursorKind> AGGREGATES = EnumSet.of(STRUCT_DECL, CLASS_DECL, CLASS_TEMPLATE, UNION_DECL, ENUM_DECL);
    private static final Set<CursorKind> CPP_CLASSES = EnumSet.of(CLASS_DECL, CLASS_TEMPLATE);
    private static final Set<CursorKind> TEMPLATE_PARAMETERS = EnumSet.of(TEMPLATE_TYPE_PARAMETER, TEMPLATE_NON_TYPE_PARAMETER);

    /**
     * Struct, class, union or enum declarations: the kinds that may be anonymous
     * or forward declared.
     */
    public boolean isAggregate() {
        return AGGREGATES.contains(this);
    }

    /**
     * C++ classes open their own scope for static members; plain structs do not.
     */
    public boolean isCppClass() {
        return CPP_CLASSES.contains(this);
    }

    public boolean isTemplateParameter() {
        return TEMPLATE_PARAMETERS.contains(this);
    }

    /**
     * Parses a kind name leniently. Unknown names map to {@link #OTHER}.
     *
     * @param name The kind name as written in the dump.
     * @return The matching kind.
     */
    public static CursorKind parse(String name) {
        if (name == null) {
            return OTHER;
        }
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
