package org.pxdforge.generator.frontend.decl;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.ast.TypeDescriptor;
import org.pxdforge.generator.frontend.ast.TypeKind;
import org.pxdforge.generator.frontend.dialect.DialectConverter;

/**
 * A {@code typedef} or {@code using} alias.
 */
public final class TypedefDecl extends Declaration {

    private static final String VA_LIST = "__builtin_va_list";

    TypedefDecl(Cursor cursor, TranslationUnit unit) {
        super(cursor, unit);
    }

    @Override
    public DeclarationKind kind() {
        return DeclarationKind.TYPEDEF;
    }

    public TypeDescriptor underlyingType() {
        return cursor.underlyingType();
    }

    /**
     * The aggregate this typedef names directly, without decoration, e.g. the struct in
     * {@code typedef struct { int x; } Point;}.
     *
     * @return The aliased aggregate, or empty for decorated or non-aggregate aliases.
     */
    public Optional<Aggregate> aliasedAggregate() {
        TypeDescriptor type = cursor.underlyingType();
        if (type == null || !(type.kind() == TypeKind.RECORD || type.kind() == TypeKind.ENUM)) {
            return Optional.empty();
        }
        return unit.declarationOf(type)
                .map(c -> Declarations.specialize(c, unit))
                .filter(Aggregate.class::isInstance)
                .map(Aggregate.class::cast);
    }

    @Override
    public List<String> lines(RenderContext context) {
        TypeDescriptor type = cursor.underlyingType();
        if (type == null) {
            return List.of("ctypedef void* " + name());
        }
        if (type.spelling().contains(VA_LIST)) {
            return List.of("ctypedef void* " + name());
        }
        if (isSelfAlias()) {
            // typedef struct Foo Foo: the struct declaration already provides the name
            return List.of();
        }
        if (unsupportedReason().isPresent()) {
            return List.of("ctypedef " + DialectConverter.convert(type.spelling()) + " " + name());
        }
        return List.of("ctypedef " + TypeSpeller.declare(type, name(), context, unit));
    }

    public boolean isSelfAlias() {
        return aliasedAggregate()
                .map(Aggregate::declaration)
                .filter(d -> !d.isAnonymous())
                .map(d -> d.address().equals(address()))
                .orElse(false);
    }

    @Override
    protected List<TypeDescriptor> referencedTypes() {
        return cursor.underlyingType() == null ? List.of() : Collections.singletonList(cursor.underlyingType());
    }
}
