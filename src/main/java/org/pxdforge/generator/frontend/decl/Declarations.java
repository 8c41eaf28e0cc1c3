package org.pxdforge.generator.frontend.decl;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.CursorKind;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.ast.TypeDescriptor;
import org.pxdforge.generator.frontend.ast.TypeKind;
import org.pxdforge.generator.frontend.dialect.DialectConverter;

/**
 * Factory for {@link Declaration} views.
 */
public final class Declarations {

    /** One indentation level of the target dialect. */
    public static final String INDENT = "    ";

    private Declarations() {
    }

    /**
     * Wraps a cursor in the view matching its kind.
     *
     * <p>Function templates whose result is {@code void} and whose name matches the
     * enclosing class are constructors in disguise.</p>
     *
     * @param cursor The cursor to wrap.
     * @param unit   The unit the cursor belongs to.
     * @return The specialized view.
     */
    public static Declaration specialize(Cursor cursor, TranslationUnit unit) {
        return switch (cursor.kind()) {
            case PARM_DECL, VAR_DECL, FIELD_DECL -> new DataMember(cursor, unit);
            case CONSTRUCTOR -> new ConstructorDecl(cursor, unit);
            case FUNCTION_TEMPLATE -> isTemplateConstructor(cursor)
                    ? new ConstructorDecl(cursor, unit)
                    : new FunctionDecl(cursor, unit);
            case FUNCTION_DECL, CXX_METHOD -> new FunctionDecl(cursor, unit);
            case ENUM_DECL -> new EnumDecl(cursor, unit);
            case UNION_DECL -> new UnionDecl(cursor, unit);
            case STRUCT_DECL, CLASS_DECL, CLASS_TEMPLATE -> new StructDecl(cursor, unit);
            case TYPEDEF_DECL, TYPE_ALIAS_DECL -> new TypedefDecl(cursor, unit);
            case MACRO_DEFINITION -> new MacroDecl(cursor, unit);
            default -> new OpaqueDecl(cursor, unit);
        };
    }

    private static boolean isTemplateConstructor(Cursor cursor) {
        Cursor parent = cursor.parent();
        if (parent == null || !(parent.kind() == CursorKind.STRUCT_DECL || parent.kind().isCppClass())) {
            return false;
        }
        TypeDescriptor result = cursor.resultType();
        boolean returnsVoid = result == null
                || (result.kind() == TypeKind.BUILTIN && "void".equals(result.spelling()));
        return returnsVoid && DialectConverter.stripTemplateArguments(cursor.spelling()).equals(parent.spelling());
    }

    /**
     * The children of an aggregate that belong to its instance body: visible, of one of
     * the given kinds, not a forward declaration shadowed by a definition and either
     * named or an anonymous aggregate.
     */
    static List<Declaration> members(Cursor owner, TranslationUnit unit, Set<CursorKind> kinds) {
        List<Declaration> members = new ArrayList<>();
        for (Cursor child : owner.children()) {
            if (!kinds.contains(child.kind()) || !child.access().isVisible()) {
                continue;
            }
            if (unit.isShadowedForwardDeclaration(child)) {
                continue;
            }
            Declaration member = specialize(child, unit);
            if (member.name().isEmpty() && !member.isAnonymous()) {
                continue;
            }
            if (member instanceof DataMember data && data.isStatic()) {
                continue;
            }
            members.add(member);
        }
        return members;
    }
}
