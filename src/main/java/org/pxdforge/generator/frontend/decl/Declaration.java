package org.pxdforge.generator.frontend.decl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.ast.TypeDescriptor;
import org.pxdforge.generator.frontend.ast.TypeKind;

/**
 * A read-only view of one declaration cursor.
 *
 * <p>Two views are equal when they denote the same logical declaration, which is decided
 * by {@link #key()} rather than by cursor identity: the same declaration is reachable
 * through type references, redeclarations and several headers.</p>
 *
 * <p>Views never report anything. Whether a declaration can be expressed in the target
 * dialect is answered by {@link #unsupportedReason()}; acting on it is up to the
 * renderer.</p>
 */
public abstract sealed class Declaration
        permits DataMember, FunctionDecl, EnumDecl, UnionDecl, StructDecl, TypedefDecl, MacroDecl, OpaqueDecl {

    private static final Set<String> RESERVED_NAMES = Set.of("is", "global");

    protected final Cursor cursor;
    protected final TranslationUnit unit;

    protected Declaration(Cursor cursor, TranslationUnit unit) {
        this.cursor = Objects.requireNonNull(cursor, "cursor");
        this.unit = Objects.requireNonNull(unit, "unit");
    }

    public abstract DeclarationKind kind();

    /**
     * Renders this declaration.
     *
     * @param context Resolves type names and renders aggregate bodies.
     * @return One or more lines, unindented.
     */
    public abstract List<String> lines(RenderContext context);

    /**
     * The type descriptors this declaration mentions directly.
     */
    protected abstract List<TypeDescriptor> referencedTypes();

    public Cursor cursor() {
        return cursor;
    }

    public TranslationUnit unit() {
        return unit;
    }

    public String name() {
        return cursor.spelling();
    }

    public String address() {
        return QualifiedNames.address(cursor);
    }

    public String namespace() {
        return QualifiedNames.namespace(cursor);
    }

    public String location() {
        return QualifiedNames.location(cursor);
    }

    /**
     * Dotted path from the enclosing namespace down to this declaration, e.g.
     * {@code Outer.Inner} for class {@code Inner} nested in {@code Outer}.
     */
    public String localPath() {
        return QualifiedNames.dotted(QualifiedNames.relativeTo(address(), namespace()));
    }

    public String file() {
        return cursor.file();
    }

    public boolean isPublic() {
        return cursor.access().isVisible();
    }

    public boolean isAnonymous() {
        return cursor.isAnonymous() || (cursor.kind().isAggregate() && cursor.spelling().isEmpty());
    }

    public boolean isForwardDeclaration() {
        return !cursor.isDefinition();
    }

    /**
     * Identity of the logical declaration. Anonymous aggregates have no address and are
     * keyed by their cursor id.
     */
    public String key() {
        if (isAnonymous()) {
            return "anon:" + (cursor.id() != null ? cursor.id() : cursor.file() + ":" + cursor.line());
        }
        return address();
    }

    /**
     * Every declared type referenced by this declaration, including pointee, element,
     * template argument and function pointer types. Aggregates add the types of their
     * members.
     *
     * @return The referenced declarations in discovery order, each once.
     */
    public Set<Declaration> associatedTypes() {
        return AssociatedTypes.of(this).declarations();
    }

    /**
     * Why this declaration cannot be expressed in the target dialect.
     *
     * @return A short reason, or empty when the declaration is supported.
     */
    public Optional<String> unsupportedReason() {
        if (RESERVED_NAMES.contains(name())) {
            return Optional.of("reserved name '" + name() + "'");
        }
        return unsupportedType(referencedTypes());
    }

    protected static Optional<String> unsupportedType(List<TypeDescriptor> types) {
        List<TypeDescriptor> work = new ArrayList<>(types);
        while (!work.isEmpty()) {
            TypeDescriptor type = work.remove(work.size() - 1);
            if (type == null) {
                continue;
            }
            if (type.kind() == TypeKind.BLOCK_POINTER) {
                return Optional.of("block pointer type '" + type.spelling() + "'");
            }
            if (type.kind() == TypeKind.DEPENDENT) {
                return Optional.of("dependent type '" + type.spelling() + "'");
            }
            work.add(type.target());
            work.add(type.result());
            work.addAll(type.arguments());
            work.addAll(type.templateArguments());
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Declaration other)) {
            return false;
        }
        return key().equals(other.key());
    }

    @Override
    public int hashCode() {
        return key().hashCode();
    }

    @Override
    public String toString() {
        return kind() + " " + key();
    }
}
