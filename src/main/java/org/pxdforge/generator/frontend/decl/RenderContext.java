package org.pxdforge.generator.frontend.decl;

import java.util.List;
import java.util.Optional;

/**
 * Callbacks a declaration uses while rendering itself.
 *
 * <p>Implementations know the scope being rendered: they turn referenced declarations
 * into the token valid at the use site (recording imports as a side effect), hand out
 * names for anonymous aggregates and lay out aggregate bodies.</p>
 */
public interface RenderContext {

    /**
     * The token under which a declared type is referenced from the current scope.
     *
     * @param declaration The referenced declaration.
     * @return The token, or empty for an anonymous aggregate that has no name here.
     */
    Optional<String> nameOf(Declaration declaration);

    /**
     * The token for a type the AST only spells, without a declaration behind it.
     *
     * @param qualifiedName The C++ qualified name, template arguments removed.
     * @return The token to emit.
     */
    String nameOf(String qualifiedName);

    /**
     * Renders an aggregate including the anonymous aggregates its body depends on.
     *
     * @param aggregate The aggregate to render.
     * @return Unindented header line followed by the indented body.
     */
    List<String> aggregate(Aggregate aggregate);

    /**
     * Renders the members of an aggregate body, one indentation level deep.
     *
     * @param owner   The aggregate whose body is rendered.
     * @param members Members in AST order.
     * @return Indented lines, never empty.
     */
    List<String> body(Aggregate owner, List<Declaration> members);
}
