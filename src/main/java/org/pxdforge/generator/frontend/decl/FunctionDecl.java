package org.pxdforge.generator.frontend.decl;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.CursorKind;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.ast.TypeDescriptor;
import org.pxdforge.generator.frontend.dialect.DialectConverter;

/**
 * A free function, method or function template.
 *
 * <p>Default argument values cannot be written in an extern declaration. A function whose
 * parameters carry defaults from index {@code k} on is therefore rendered as
 * {@code n - k + 1} declarations covering the first {@code k}, {@code k + 1}, ...,
 * {@code n} parameters.</p>
 */
public sealed class FunctionDecl extends Declaration permits ConstructorDecl {

    private static final Set<String> UNSUPPORTED_OPERATORS = Set.of(
            "operator+=", "operator-=", "operator^=", "operator&=", "operator|=", "operator->");
    private static final String LITERAL_OPERATOR = "operator\"\"";
    private static final String OPERATOR = "operator";

    FunctionDecl(Cursor cursor, TranslationUnit unit) {
        super(cursor, unit);
    }

    @Override
    public DeclarationKind kind() {
        return DeclarationKind.FUNCTION;
    }

    @Override
    public String name() {
        String spelling = cursor.spelling();
        return isOperator(spelling) ? spelling : DialectConverter.stripTemplateArguments(spelling);
    }

    /**
     * {@code operator<}, {@code operator<<} and {@code operator<=>} carry the bracket in
     * their name.
     */
    private static boolean isOperator(String spelling) {
        return spelling.startsWith(OPERATOR)
                && (spelling.length() == OPERATOR.length()
                        || !Character.isJavaIdentifierPart(spelling.charAt(OPERATOR.length())));
    }

    /**
     * Overloads share an address, so the key adds the parameter spellings.
     */
    @Override
    public String key() {
        String parameterTypes = parameters().stream()
                .map(p -> p.type() == null ? "" : p.type().spelling())
                .collect(Collectors.joining(",", "(", ")"));
        return address() + parameterTypes;
    }

    public List<DataMember> parameters() {
        List<DataMember> parameters = new ArrayList<>();
        for (Cursor child : cursor.children()) {
            if (child.kind() == CursorKind.PARM_DECL) {
                parameters.add(new DataMember(child, unit));
            }
        }
        return parameters;
    }

    /**
     * Index of the first parameter carrying a default value, or the parameter count.
     */
    public int firstDefaultedParameter() {
        List<DataMember> parameters = parameters();
        for (int i = 0; i < parameters.size(); i++) {
            if (parameters.get(i).cursor().hasDefaultValue()) {
                return i;
            }
        }
        return parameters.size();
    }

    /**
     * Static methods are marked when rendered inside an instance body.
     */
    public boolean isStaticMethod() {
        return cursor.kind() != CursorKind.FUNCTION_DECL && cursor.isStatic();
    }

    @Override
    public List<String> lines(RenderContext context) {
        List<DataMember> parameters = parameters();
        List<String> lines = new ArrayList<>();
        for (int arity = firstDefaultedParameter(); arity <= parameters.size(); arity++) {
            lines.add(signature(parameters.subList(0, arity), context));
        }
        return lines;
    }

    /**
     * One declaration covering exactly the given parameters.
     */
    protected String signature(List<DataMember> parameters, RenderContext context) {
        String declarator = name() + templateParameters() + "(" + parameterList(parameters, context) + ")";
        return TypeSpeller.declare(cursor.resultType(), declarator, context, unit) + exceptionSuffix();
    }

    protected String parameterList(List<DataMember> parameters, RenderContext context) {
        List<String> parts = new ArrayList<>();
        for (DataMember parameter : parameters) {
            parts.add(parameter.declaration(context));
        }
        if (cursor.isVariadic()) {
            parts.add("...");
        }
        return String.join(", ", parts);
    }

    protected String templateParameters() {
        List<String> names = new ArrayList<>();
        for (Cursor child : cursor.children()) {
            if (child.kind().isTemplateParameter()) {
                names.add(child.spelling());
            }
        }
        return names.isEmpty() ? "" : "[" + String.join(", ", names) + "]";
    }

    protected String exceptionSuffix() {
        String converted = DialectConverter.convertExceptionSpecification(cursor.exceptionSpecification());
        return converted.isEmpty() ? "" : " " + converted;
    }

    @Override
    public Optional<String> unsupportedReason() {
        String spelling = cursor.spelling();
        if (UNSUPPORTED_OPERATORS.contains(spelling.replace(" ", ""))) {
            return Optional.of("operator '" + spelling + "'");
        }
        if (spelling.startsWith(LITERAL_OPERATOR)) {
            return Optional.of("user-defined literal '" + spelling + "'");
        }
        return super.unsupportedReason();
    }

    @Override
    protected List<TypeDescriptor> referencedTypes() {
        List<TypeDescriptor> types = new ArrayList<>();
        if (cursor.resultType() != null) {
            types.add(cursor.resultType());
        }
        for (DataMember parameter : parameters()) {
            if (parameter.type() != null) {
                types.add(parameter.type());
            }
        }
        return types;
    }
}
