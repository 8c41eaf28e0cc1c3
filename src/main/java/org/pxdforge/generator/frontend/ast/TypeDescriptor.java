package org.pxdforge.generator.frontend.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of a C/C++ type as delivered by the AST provider.
 *
 * <p>Decorations (pointers, references, arrays) wrap their target through
 * {@link #pointee()} or {@link #element()}. Named types point at their declaring
 * cursor through {@link #declarationId()} and carry their template arguments.
 * Function prototypes carry a result type and argument types.</p>
 */
public final class TypeDescriptor {

    private final TypeKind kind;
    private final String spelling;
    private final boolean constQualified;
    private final TypeDescriptor pointee;
    private final TypeDescriptor element;
    private final long arraySize;
    private final long sizeBytes;
    private final String declarationId;
    private final List<TypeDescriptor> templateArguments;
    private final TypeDescriptor result;
    private final List<TypeDescriptor> arguments;
    private final boolean variadic;

    private TypeDescriptor(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.spelling = builder.spelling == null ? "" : builder.spelling;
        this.constQualified = builder.constQualified;
        this.pointee = builder.pointee;
        this.element = builder.element;
        this.arraySize = builder.arraySize;
        this.sizeBytes = builder.sizeBytes;
        this.declarationId = builder.declarationId;
        this.templateArguments = List.copyOf(builder.templateArguments);
        this.result = builder.result;
        this.arguments = List.copyOf(builder.arguments);
        this.variadic = builder.variadic;
    }

    public static Builder builder(TypeKind kind) {
        return new Builder(kind);
    }

    public static TypeDescriptor builtin(String spelling) {
        return builder(TypeKind.BUILTIN).spelling(spelling).build();
    }

    public static TypeDescriptor pointer(TypeDescriptor pointee) {
        return builder(TypeKind.POINTER).pointee(pointee).build();
    }

    public static TypeDescriptor lvalueReference(TypeDescriptor pointee) {
        return builder(TypeKind.LVALUE_REFERENCE).pointee(pointee).build();
    }

    public static TypeDescriptor rvalueReference(TypeDescriptor pointee) {
        return builder(TypeKind.RVALUE_REFERENCE).pointee(pointee).build();
    }

    public static TypeDescriptor array(TypeDescriptor element, long size) {
        return builder(TypeKind.CONSTANT_ARRAY).element(element).arraySize(size).build();
    }

    public static TypeDescriptor record(String spelling, String declarationId, TypeDescriptor... templateArguments) {
        return builder(TypeKind.RECORD).spelling(spelling).declarationId(declarationId)
                .templateArguments(List.of(templateArguments)).build();
    }

    public static TypeDescriptor enumType(String spelling, String declarationId) {
        return builder(TypeKind.ENUM).spelling(spelling).declarationId(declarationId).build();
    }

    public static TypeDescriptor typedef(String spelling, String declarationId) {
        return builder(TypeKind.TYPEDEF).spelling(spelling).declarationId(declarationId).build();
    }

    public static TypeDescriptor templateParameter(String name) {
        return builder(TypeKind.TEMPLATE_PARAMETER).spelling(name).build();
    }

    public static TypeDescriptor functionProto(TypeDescriptor result, TypeDescriptor... arguments) {
        return builder(TypeKind.FUNCTION_PROTO).result(result).arguments(List.of(arguments)).build();
    }

    public static TypeDescriptor dependent(String spelling) {
        return builder(TypeKind.DEPENDENT).spelling(spelling).build();
    }

    public TypeKind kind() {
        return kind;
    }

    /**
     * The provider's spelling of this type, e.g. {@code std::vector<int> *}. May be empty
     * for decorations the provider did not spell out.
     */
    public String spelling() {
        return spelling;
    }

    public boolean isConst() {
        return constQualified;
    }

    public TypeDescriptor pointee() {
        return pointee;
    }

    public TypeDescriptor element() {
        return element;
    }

    /**
     * Number of elements of a constant array, -1 for incomplete arrays and non-arrays.
     */
    public long arraySize() {
        return arraySize;
    }

    /**
     * {@code sizeof} of the type in bytes, -1 when the provider did not compute it.
     */
    public long sizeBytes() {
        return sizeBytes;
    }

    public String declarationId() {
        return declarationId;
    }

    public List<TypeDescriptor> templateArguments() {
        return templateArguments;
    }

    public TypeDescriptor result() {
        return result;
    }

    public List<TypeDescriptor> arguments() {
        return arguments;
    }

    public boolean isVariadic() {
        return variadic;
    }

    /**
     * The wrapped type of a decoration, or {@code null} for base types.
     */
    public TypeDescriptor target() {
        return switch (kind) {
            case POINTER, LVALUE_REFERENCE, RVALUE_REFERENCE, BLOCK_POINTER -> pointee;
            case CONSTANT_ARRAY, INCOMPLETE_ARRAY -> element;
            default -> null;
        };
    }

    public boolean isFunctionPointer() {
        return kind == TypeKind.POINTER && pointee != null && pointee.kind == TypeKind.FUNCTION_PROTO;
    }

    /**
     * Strips pointer, reference and array decorations.
     *
     * @return The innermost base type.
     */
    public TypeDescriptor underlying() {
        TypeDescriptor current = this;
        while (current.kind.isDecoration() && current.target() != null) {
            current = current.target();
        }
        return current;
    }

    /**
     * True when the only decorations around the base type are pointers.
     */
    public boolean isPointerChain() {
        TypeDescriptor current = this;
        while (current.kind.isDecoration() && current.target() != null) {
            if (current.kind != TypeKind.POINTER) {
                return false;
            }
            current = current.target();
        }
        return true;
    }

    @Override
    public String toString() {
        return kind + "(" + spelling + ")";
    }

    /**
     * Builder used by the JSON reader and by tests.
     */
    public static final class Builder {
        private final TypeKind kind;
        private String spelling;
        private boolean constQualified;
        private TypeDescriptor pointee;
        private TypeDescriptor element;
        private long arraySize = -1;
        private long sizeBytes = -1;
        private String declarationId;
        private final List<TypeDescriptor> templateArguments = new ArrayList<>();
        private TypeDescriptor result;
        private final List<TypeDescriptor> arguments = new ArrayList<>();
        private boolean variadic;

        private Builder(TypeKind kind) {
            this.kind = kind;
        }

        public Builder spelling(String spelling) {
            this.spelling = spelling;
            return this;
        }

        public Builder constQualified(boolean constQualified) {
            this.constQualified = constQualified;
            return this;
        }

        public Builder pointee(TypeDescriptor pointee) {
            this.pointee = pointee;
            return this;
        }

        public Builder element(TypeDescriptor element) {
            this.element = element;
            return this;
        }

        public Builder arraySize(long arraySize) {
            this.arraySize = arraySize;
            return this;
        }

        public Builder sizeBytes(long sizeBytes) {
            this.sizeBytes = sizeBytes;
            return this;
        }

        public Builder declarationId(String declarationId) {
            this.declarationId = declarationId;
            return this;
        }

        public Builder templateArguments(List<TypeDescriptor> templateArguments) {
            this.templateArguments.addAll(templateArguments);
            return this;
        }

        public Builder result(TypeDescriptor result) {
            this.result = result;
            return this;
        }

        public Builder arguments(List<TypeDescriptor> arguments) {
            this.arguments.addAll(arguments);
            return this;
        }

        public Builder variadic(boolean variadic) {
            this.variadic = variadic;
            return this;
        }

        public TypeDescriptor build() {
            return new TypeDescriptor(this);
        }
    }
}
