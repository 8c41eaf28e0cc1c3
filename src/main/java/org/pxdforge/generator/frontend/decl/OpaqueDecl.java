package org.pxdforge.generator.frontend.decl;

import java.util.List;
import java.util.Optional;

import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.ast.TypeDescriptor;

/**
 * Any cursor kind without a rendering, such as destructors, template parameters and
 * using-directives. Scopes drop these before rendering.
 */
public final class OpaqueDecl extends Declaration {

    OpaqueDecl(Cursor cursor, TranslationUnit unit) {
        super(cursor, unit);
    }

    @Override
    public DeclarationKind kind() {
        return DeclarationKind.OPAQUE;
    }

    @Override
    public List<String> lines(RenderContext context) {
        return List.of();
    }

    @Override
    public Optional<String> unsupportedReason() {
        return Optional.of("cursor kind " + cursor.kind());
    }

    @Override
    protected List<TypeDescriptor> referencedTypes() {
        return List.of();
    }
}
