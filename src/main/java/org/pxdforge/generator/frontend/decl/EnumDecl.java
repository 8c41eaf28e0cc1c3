package org.pxdforge.generator.frontend.decl;

import java.util.ArrayList;
import java.util.List;

import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.CursorKind;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.ast.TypeDescriptor;

/**
 * An enumeration. Its body lists the constants with their values.
 */
public final class EnumDecl extends Declaration implements Aggregate {

    EnumDecl(Cursor cursor, TranslationUnit unit) {
        super(cursor, unit);
    }

    @Override
    public DeclarationKind kind() {
        return DeclarationKind.ENUMERATION;
    }

    @Override
    public String header(String name, boolean typedefForm) {
        return (typedefForm ? "ctypedef " : "") + "enum " + name + ":";
    }

    @Override
    public List<String> body(RenderContext context) {
        List<String> lines = new ArrayList<>();
        for (Cursor child : cursor.children()) {
            if (child.kind() != CursorKind.ENUM_CONSTANT_DECL) {
                continue;
            }
            String value = child.enumValue() == null ? "" : " = " + child.enumValue();
            lines.add(Declarations.INDENT + child.spelling() + value);
        }
        if (lines.isEmpty()) {
            lines.add(Declarations.INDENT + "pass");
        }
        return lines;
    }

    @Override
    public List<Declaration> members() {
        return List.of();
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
