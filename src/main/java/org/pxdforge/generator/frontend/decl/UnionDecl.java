package org.pxdforge.generator.frontend.decl;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.CursorKind;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.ast.TypeDescriptor;

/**
 * A union. Only fields and nested aggregates make it into the body.
 */
public final class UnionDecl extends Declaration implements Aggregate {

    private static final Set<CursorKind> MEMBER_KINDS = EnumSet.of(
            CursorKind.FIELD_DECL,
            CursorKind.STRUCT_DECL,
            CursorKind.UNION_DECL,
            CursorKind.ENUM_DECL);

    UnionDecl(Cursor cursor, TranslationUnit unit) {
        super(cursor, unit);
    }

    @Override
    public DeclarationKind kind() {
        return DeclarationKind.UNION;
    }

    @Override
    public String header(String name, boolean typedefForm) {
        return (typedefForm ? "ctypedef " : "") + "union " + name + ":";
    }

    @Override
    public List<String> body(RenderContext context) {
        return context.body(this, members());
    }

    @Override
    public List<Declaration> members() {
        return Declarations.members(cursor, unit, MEMBER_KINDS);
    }

    @Override
    public Declaration declaration() {
        return this;
    }

    @Override
    public List<String> lines(RenderContext context) {
        return context.aggregate(this);
    }

    @Override
    protected List<TypeDescriptor> referencedTypes() {
        return List.of();
    }
}
