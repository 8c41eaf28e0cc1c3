package org.pxdforge.generator.frontend.decl;

import java.util.List;

import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.TranslationUnit;

/**
 * A constructor. Constructors written as member templates keep a {@code void} result so
 * the template parameter list stays attached: {@code void Foo[U](U value)}.
 */
public final class ConstructorDecl extends FunctionDecl {

    ConstructorDecl(Cursor cursor, TranslationUnit unit) {
        super(cursor, unit);
    }

    @Override
    public DeclarationKind kind() {
        return DeclarationKind.CONSTRUCTOR;
    }

    @Override
    protected String signature(List<DataMember> parameters, RenderContext context) {
        String templateParameters = templateParameters();
        String result = templateParameters.isEmpty() ? "" : "void ";
        return result + name() + templateParameters + "(" + parameterList(parameters, context) + ")" + exceptionSuffix();
    }
}
