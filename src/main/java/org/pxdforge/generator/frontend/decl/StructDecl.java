package org.pxdforge.generator.frontend.decl;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.CursorKind;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.ast.TypeDescriptor;

/**
 * A struct, class or class template.
 *
 * <p>C++ classes are declared as {@code cppclass} and carry their template parameters;
 * everything else is a plain {@code struct}. The body holds instance members only.
 * Static data members belong to the scope the class opens.</p>
 */
public final class StructDecl extends Declaration implements Aggregate {

    /** Kinds rendered inside the body rather than in a namespace or class scope. */
    public static final Set<CursorKind> INSTANCE_KINDS = EnumSet.of(
            CursorKind.FIELD_DECL,
            CursorKind.CONSTRUCTOR,
            CursorKind.CXX_METHOD,
            CursorKind.FUNCTION_TEMPLATE,
            CursorKind.TYPEDEF_DECL,
            CursorKind.TYPE_ALIAS_DECL,
            CursorKind.ENUM_DECL,
            CursorKind.STRUCT_DECL,
            CursorKind.CLASS_DECL,
            CursorKind.CLASS_TEMPLATE,
            CursorKind.UNION_DECL);

    StructDecl(Cursor cursor, TranslationUnit unit) {
        super(cursor, unit);
    }

    @Override
    public DeclarationKind kind() {
        return DeclarationKind.STRUCT;
    }

    public boolean isCppClass() {
        return cursor.kind().isCppClass();
    }

    @Override
    public String header(String name, boolean typedefForm) {
        if (isCppClass()) {
            return "cppclass " + name + templateParameters() + ":";
        }
        return (typedefForm ? "ctypedef " : "") + "struct " + name + ":";
    }

    public List<String> templateParameterNames() {
        List<String> names = new ArrayList<>();
        for (Cursor child : cursor.children()) {
            if (child.kind().isTemplateParameter()) {
                names.add(child.spelling());
            }
        }
        return names;
    }

    private String templateParameters() {
        List<String> names = templateParameterNames();
        return names.isEmpty() ? "" : "[" + String.join(", ", names) + "]";
    }

    @Override
    public List<String> body(RenderContext context) {
        return context.body(this, members());
    }

    @Override
    public List<Declaration> members() {
        return Declarations.members(cursor, unit, INSTANCE_KINDS);
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
