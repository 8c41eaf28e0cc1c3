package org.pxdforge.generator.frontend.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One node of the externally supplied syntax tree.
 *
 * <p>Cursors are read-only once their {@link TranslationUnit} is built. The unit links
 * every cursor to its lexical parent and fills in the originating file of children
 * that did not carry one.</p>
 */
public final class Cursor {

    private final String id;
    private final CursorKind kind;
    private final String spelling;
    private final int line;
    private final AccessSpecifier access;
    private final boolean anonymous;
    private final boolean definition;
    private final boolean staticStorage;
    private final boolean variadic;
    private final boolean hasDefaultValue;
    private final Long enumValue;
    private final String exceptionSpecification;
    private final boolean macroFunction;
    private final List<String> tokens;
    private final boolean inlineNamespace;
    private final TypeDescriptor type;
    private final TypeDescriptor resultType;
    private final TypeDescriptor underlyingType;
    private final List<Cursor> children;

    // Set once while the translation unit is linked
    private String file;
    private Cursor parent;

    private Cursor(Builder builder) {
        this.id = builder.id;
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.spelling = builder.spelling == null ? "" : builder.spelling;
        this.file = builder.file;
        this.line = builder.line;
        this.access = builder.access;
        this.anonymous = builder.anonymous;
        this.definition = builder.definition;
        this.staticStorage = builder.staticStorage;
        this.variadic = builder.variadic;
        this.hasDefaultValue = builder.hasDefaultValue;
        this.enumValue = builder.enumValue;
        this.exceptionSpecification = builder.exceptionSpecification;
        this.macroFunction = builder.macroFunction;
        this.tokens = List.copyOf(builder.tokens);
        this.inlineNamespace = builder.inlineNamespace;
        this.type = builder.type;
        this.resultType = builder.resultType;
        this.underlyingType = builder.underlyingType;
        this.children = List.copyOf(builder.children);
    }

    public static Builder builder(CursorKind kind, String spelling) {
        return new Builder(kind, spelling);
    }

    void link(Cursor parent) {
        this.parent = parent;
        if (this.file == null && parent != null) {
            this.file = parent.file;
        }
    }

    /**
     * Stable identifier shared by all redeclarations of one entity (a USR for
     * clang-produced dumps). {@code null} for cursors nothing refers to.
     */
    public String id() {
        return id;
    }

    public CursorKind kind() {
        return kind;
    }

    public String spelling() {
        return spelling;
    }

    public String file() {
        return file;
    }

    public int line() {
        return line;
    }

    public AccessSpecifier access() {
        return access;
    }

    public boolean isAnonymous() {
        return anonymous;
    }

    /**
     * False for forward declarations (a type named without its body).
     */
    public boolean isDefinition() {
        return definition;
    }

    /**
     * Static storage for variables, static qualification for methods.
     */
    public boolean isStatic() {
        return staticStorage;
    }

    public boolean isVariadic() {
        return variadic;
    }

    /**
     * Parameter cursors only: whether the parameter carries a default-value expression.
     */
    public boolean hasDefaultValue() {
        return hasDefaultValue;
    }

    public Long enumValue() {
        return enumValue;
    }

    public String exceptionSpecification() {
        return exceptionSpecification;
    }

    public boolean isMacroFunction() {
        return macroFunction;
    }

    public List<String> tokens() {
        return tokens;
    }

    public boolean isInlineNamespace() {
        return inlineNamespace;
    }

    public TypeDescriptor type() {
        return type;
    }

    public TypeDescriptor resultType() {
        return resultType;
    }

    public TypeDescriptor underlyingType() {
        return underlyingType;
    }

    public List<Cursor> children() {
        return children;
    }

    /**
     * The lexical parent, or {@code null} for the translation unit root.
     */
    public Cursor parent() {
        return parent;
    }

    @Override
    public String toString() {
        return kind + ":" + spelling + (file != null ? "@" + file + ":" + line : "");
    }

    /**
     * Builder used by the JSON reader and by tests.
     */
    public static final class Builder {
        private final CursorKind kind;
        private final String spelling;
        private String id;
        private String file;
        private int line;
        private AccessSpecifier access = AccessSpecifier.NONE;
        private boolean anonymous;
        private boolean definition = true;
        private boolean staticStorage;
        private boolean variadic;
        private boolean hasDefaultValue;
        private Long enumValue;
        private String exceptionSpecification;
        private boolean macroFunction;
        private final List<String> tokens = new ArrayList<>();
        private boolean inlineNamespace;
        private TypeDescriptor type;
        private TypeDescriptor resultType;
        private TypeDescriptor underlyingType;
        private final List<Cursor> children = new ArrayList<>();

        private Builder(CursorKind kind, String spelling) {
            this.kind = kind;
            this.spelling = spelling;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder file(String file) {
            this.file = file;
            return this;
        }

        public Builder line(int line) {
            this.line = line;
            return this;
        }

        public Builder access(AccessSpecifier access) {
            this.access = access;
            return this;
        }

        public Builder anonymous(boolean anonymous) {
            this.anonymous = anonymous;
            return this;
        }

        public Builder definition(boolean definition) {
            this.definition = definition;
            return this;
        }

        public Builder staticStorage(boolean staticStorage) {
            this.staticStorage = staticStorage;
            return this;
        }

        public Builder variadic(boolean variadic) {
            this.variadic = variadic;
            return this;
        }

        public Builder hasDefaultValue(boolean hasDefaultValue) {
            this.hasDefaultValue = hasDefaultValue;
            return this;
        }

        public Builder enumValue(Long enumValue) {
            this.enumValue = enumValue;
            return this;
        }

        public Builder exceptionSpecification(String exceptionSpecification) {
            this.exceptionSpecification = exceptionSpecification;
            return this;
        }

        public Builder macroFunction(boolean macroFunction) {
            this.macroFunction = macroFunction;
            return this;
        }

        public Builder tokens(List<String> tokens) {
            this.tokens.addAll(tokens);
            return this;
        }

        public Builder inlineNamespace(boolean inlineNamespace) {
            this.inlineNamespace = inlineNamespace;
            return this;
        }

        public Builder type(TypeDescriptor type) {
            this.type = type;
            return this;
        }

        public Builder resultType(TypeDescriptor resultType) {
            this.resultType = resultType;
            return this;
        }

        public Builder underlyingType(TypeDescriptor underlyingType) {
            this.underlyingType = underlyingType;
            return this;
        }

        public Builder child(Cursor child) {
            this.children.add(child);
            return this;
        }

        public Builder children(List<Cursor> children) {
            this.children.addAll(children);
            return this;
        }

        public Cursor build() {
            return new Cursor(this);
        }
    }
}
