package org.pxdforge.generator.frontend.decl;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.ast.TypeDescriptor;
import org.pxdforge.generator.frontend.ast.TypeKind;
import org.pxdforge.generator.frontend.dialect.DialectConverter;

/**
 * Builds C declarators from type descriptors.
 *
 * <p>Decorations are applied from the outside in: pointers and references prefix the
 * declarator, arrays and parameter lists suffix it, and a prefixed declarator is
 * parenthesized before a suffix is added. The leading pointer run is attached to the base
 * type, which yields {@code int* ip}, {@code int data[20]} and
 * {@code void (*callback)(int)}.</p>
 */
public final class TypeSpeller {

    private TypeSpeller() {
    }

    /**
     * Declares {@code declarator} with the given type.
     *
     * @param type       The declared type.
     * @param declarator The declared name, empty for an abstract declarator.
     * @param context    Resolves named types.
     * @param unit       Resolves declaration ids.
     * @return The declaration text.
     */
    public static String declare(TypeDescriptor type, String declarator, RenderContext context, TranslationUnit unit) {
        if (type == null) {
            return join("void", declarator);
        }
        TypeDescriptor current = type;
        String result = declarator;
        while (true) {
            switch (current.kind()) {
                case POINTER -> result = "*" + result;
                case LVALUE_REFERENCE -> result = "&" + result;
                case RVALUE_REFERENCE -> result = "&&" + result;
                case BLOCK_POINTER -> result = "^" + result;
                case CONSTANT_ARRAY -> result = parenthesize(result) + "[" + current.arraySize() + "]";
                case INCOMPLETE_ARRAY -> result = parenthesize(result) + "[]";
                case FUNCTION_PROTO -> result = parenthesize(result) + "(" + parameters(current, context, unit) + ")";
                default -> {
                    return spellBase(current, type, result, context, unit);
                }
            }
            TypeDescriptor next = current.kind() == TypeKind.FUNCTION_PROTO ? current.result() : current.target();
            if (next == null) {
                return join("void", result);
            }
            current = next;
        }
    }

    /**
     * The abstract declarator of a type, as used in parameter lists and template
     * arguments.
     */
    public static String spell(TypeDescriptor type, RenderContext context, TranslationUnit unit) {
        return declare(type, "", context, unit);
    }

    private static String parameters(TypeDescriptor proto, RenderContext context, TranslationUnit unit) {
        List<String> parts = new ArrayList<>();
        for (TypeDescriptor argument : proto.arguments()) {
            parts.add(spell(argument, context, unit));
        }
        if (proto.isVariadic()) {
            parts.add("...");
        }
        return String.join(", ", parts);
    }

    private static String spellBase(TypeDescriptor base, TypeDescriptor whole, String declarator,
                                    RenderContext context, TranslationUnit unit) {
        Optional<String> name = baseName(base, context, unit);
        if (name.isEmpty()) {
            // Anonymous type nobody named in this scope
            if (whole != base && whole.isPointerChain()) {
                return join("void", declarator);
            }
            long size = Math.max(base.sizeBytes(), 1);
            return "char " + stripPrefix(declarator) + "[" + size + "]";
        }
        String spelled = name.get();
        if (base.isConst() && !spelled.startsWith("const ")) {
            spelled = "const " + spelled;
        }
        return join(spelled, declarator);
    }

    private static Optional<String> baseName(TypeDescriptor base, RenderContext context, TranslationUnit unit) {
        switch (base.kind()) {
            case BUILTIN:
                return Optional.of(DialectConverter.convert(base.spelling()));
            case TEMPLATE_PARAMETER:
                return Optional.of(base.spelling());
            case RECORD:
            case ENUM:
            case TYPEDEF:
                Optional<Cursor> declaration = unit.declarationOf(base);
                if (declaration.isPresent()) {
                    Declaration referenced = Declarations.specialize(declaration.get(), unit);
                    return context.nameOf(referenced).map(n -> n + templateArguments(base, context, unit));
                }
                return Optional.of(undeclared(base, context, unit));
            default:
                return Optional.of(undeclared(base, context, unit));
        }
    }

    private static String undeclared(TypeDescriptor base, RenderContext context, TranslationUnit unit) {
        String spelling = DialectConverter.stripElaboration(base.spelling());
        if (spelling.startsWith("const ")) {
            spelling = spelling.substring("const ".length());
        }
        if (base.kind() == TypeKind.DEPENDENT || base.kind() == TypeKind.UNEXPOSED) {
            return DialectConverter.convert(spelling).replace(QualifiedNames.SEPARATOR, ".");
        }
        if (!base.templateArguments().isEmpty()) {
            return context.nameOf(DialectConverter.stripTemplateArguments(spelling)) + templateArguments(base, context, unit);
        }
        if (spelling.indexOf('<') >= 0) {
            return DialectConverter.convert(spelling).replace(QualifiedNames.SEPARATOR, ".");
        }
        return DialectConverter.convert(context.nameOf(spelling));
    }

    private static String templateArguments(TypeDescriptor base, RenderContext context, TranslationUnit unit) {
        if (base.templateArguments().isEmpty()) {
            return "";
        }
        return base.templateArguments().stream()
                .map(argument -> spell(argument, context, unit))
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private static String parenthesize(String declarator) {
        if (declarator.startsWith("*") || declarator.startsWith("&") || declarator.startsWith("^")) {
            return "(" + declarator + ")";
        }
        return declarator;
    }

    private static String stripPrefix(String declarator) {
        int i = 0;
        while (i < declarator.length() && (declarator.charAt(i) == '*' || declarator.charAt(i) == '&')) {
            i++;
        }
        return declarator.substring(i);
    }

    /**
     * Attaches the leading pointer and reference run of a declarator to the base type.
     */
    private static String join(String base, String declarator) {
        if (declarator.isEmpty()) {
            return base;
        }
        int i = 0;
        while (i < declarator.length() && (declarator.charAt(i) == '*' || declarator.charAt(i) == '&')) {
            i++;
        }
        String decorations = declarator.substring(0, i);
        String rest = declarator.substring(i);
        return rest.isEmpty() ? base + decorations : base + decorations + " " + rest;
    }
}
