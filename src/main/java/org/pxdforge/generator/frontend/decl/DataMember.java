package org.pxdforge.generator.frontend.decl;

import java.util.Collections;
import java.util.List;

import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.ast.TypeDescriptor;

/**
 * A variable, struct field or function parameter.
 */
public final class DataMember extends Declaration {

    DataMember(Cursor cursor, TranslationUnit unit) {
        super(cursor, unit);
    }

    @Override
    public DeclarationKind kind() {
        return DeclarationKind.DATA_MEMBER;
    }

    public TypeDescriptor type() {
        return cursor.type();
    }

    /**
     * Static class variables live in the class scope, not in the instance body.
     */
    public boolean isStatic() {
        return cursor.isStatic();
    }

    @Override
    public List<String> lines(RenderContext context) {
        return List.of(declaration(context));
    }

    /**
     * The declarator of this member, e.g. {@code int* ip} or {@code void (*cb)(int)}.
     * Unnamed parameters yield the abstract declarator.
     */
    public String declaration(RenderContext context) {
        return TypeSpeller.declare(cursor.type(), name(), context, unit);
    }

    @Override
    protected List<TypeDescriptor> referencedTypes() {
        return cursor.type() == null ? List.of() : Collections.singletonList(cursor.type());
    }
}
