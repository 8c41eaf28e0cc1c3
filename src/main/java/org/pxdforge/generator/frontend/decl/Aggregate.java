package org.pxdforge.generator.frontend.decl;

import java.util.List;

/**
 * Struct, class, union and enum declarations: the declarations with a body that may be
 * anonymous or forward declared.
 */
public sealed interface Aggregate permits EnumDecl, UnionDecl, StructDecl {

    /**
     * @param name        The name to declare, synthetic for anonymous aggregates.
     * @param typedefForm Whether to declare through {@code ctypedef}.
     * @return The header line ending in a colon.
     */
    String header(String name, boolean typedefForm);

    /**
     * Body lines, indented one level. Never empty: an empty body is {@code pass}.
     */
    List<String> body(RenderContext context);

    /**
     * Members in AST order, anonymous nested aggregates included.
     */
    List<Declaration> members();

    /**
     * The aggregate as a declaration.
     */
    Declaration declaration();
}
