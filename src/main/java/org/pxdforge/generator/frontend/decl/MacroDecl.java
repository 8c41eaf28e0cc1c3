package org.pxdforge.generator.frontend.decl;

import java.util.List;
import java.util.regex.Pattern;

import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.ast.TypeDescriptor;

/**
 * A preprocessor definition, declared as a constant whose type is guessed from the
 * shape of its replacement tokens.
 */
public final class MacroDecl extends Declaration {

    private static final Pattern INTEGER_LITERAL =
            Pattern.compile("[+-]?(0[xX][0-9a-fA-F]+|0[bB][01]+|\\d+)([uU]?[lL]{0,2}|[lL]{0,2}[uU]?)");
    private static final Pattern FLOAT_LITERAL =
            Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+(?=[eE]))([eE][+-]?\\d+)?[fFlL]?");

    MacroDecl(Cursor cursor, TranslationUnit unit) {
        super(cursor, unit);
    }

    @Override
    public DeclarationKind kind() {
        return DeclarationKind.MACRO;
    }

    /**
     * The replacement text, parameter list of function-like macros excluded.
     */
    public String definition() {
        List<String> tokens = cursor.tokens();
        int start = 1;
        if (cursor.isMacroFunction()) {
            int close = tokens.indexOf(")");
            start = close < 0 ? tokens.size() : close + 1;
        }
        return start >= tokens.size() ? "" : String.join("", tokens.subList(start, tokens.size()));
    }

    /**
     * Include guards and flag macros define nothing worth declaring.
     */
    public boolean isEmpty() {
        return definition().isEmpty();
    }

    public String constantType() {
        String definition = unparenthesize(definition());
        if (INTEGER_LITERAL.matcher(definition).matches()) {
            return "const long";
        }
        if (FLOAT_LITERAL.matcher(definition).matches()) {
            return "const double";
        }
        return "const int";
    }

    @Override
    public List<String> lines(RenderContext context) {
        return List.of(constantType() + " " + name() + (cursor.isMacroFunction() ? "(...)" : ""));
    }

    @Override
    protected List<TypeDescriptor> referencedTypes() {
        return List.of();
    }

    private static String unparenthesize(String text) {
        String result = text;
        while (result.length() >= 2 && result.startsWith("(") && result.endsWith(")")) {
            result = result.substring(1, result.length() - 1);
        }
        return result;
    }
}
