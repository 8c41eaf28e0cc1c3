package org.pxdforge.generator.backend.render;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.pxdforge.generator.diagnostics.DiagnosticsEngine;
import org.pxdforge.generator.frontend.decl.Aggregate;
import org.pxdforge.generator.frontend.decl.Declaration;
import org.pxdforge.generator.frontend.decl.QualifiedNames;
import org.pxdforge.generator.frontend.decl.TypedefDecl;
import org.pxdforge.generator.frontend.scope.Scope;
import org.pxdforge.generator.frontend.semantics.ReferenceSite;
import org.pxdforge.generator.frontend.semantics.TypeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a scope as one {@code cdef extern from} block.
 *
 * <p>The body is laid out as follows:</p>
 * <ol>
 *   <li>in restricted mode, empty stubs for referenced types declared in other headers,
 *       sorted by qualified name;</li>
 *   <li>forward declarations that have no definition, as empty aggregates;</li>
 *   <li>the remaining declarations in AST order. An anonymous aggregate is declared right
 *       before the first declaration referring to it, under a synthetic
 *       {@code anon_<scope>_<n>} name, unless a typedef of the scope names it; then the
 *       first such typedef declares it in {@code ctypedef} form;</li>
 *   <li>{@code pass} if nothing else was written. Commented-out declarations count as
 *       written.</li>
 * </ol>
 * <p>Every type reference goes through the {@link TypeResolver}, which collects the
 * imports of the output unit as a side effect.</p>
 */
public class DeclarationRenderer {

    private static final Logger log = LoggerFactory.getLogger(DeclarationRenderer.class);

    private static final String GLOBAL_SCOPE_NAME = "toplevel";

    private final TypeResolver resolver;
    private final DiagnosticsEngine diagnostics;

    public DeclarationRenderer(TypeResolver resolver, DiagnosticsEngine diagnostics) {
        this.resolver = resolver;
        this.diagnostics = diagnostics;
    }

    /**
     * Renders a scope.
     *
     * @param scope  The scope; must have declarations.
     * @param site   The module and namespace the block is written to.
     * @param header The header as spelled in the extern line, e.g. {@code "foo/bar.h"}
     *               or {@code <foo/bar.h>}.
     * @return The block's lines.
     */
    public List<String> render(Scope scope, ReferenceSite site, String header) {
        ScopeRenderContext context = new ScopeRenderContext(resolver, site, diagnostics);
        BlockWriter writer = new BlockWriter();
        writer.write(externLine(scope, header));
        writer.indent();

        if (scope.restricted()) {
            for (Declaration stub : ForwardDeclarations.outOfOrigin(scope)) {
                if (site.importAll() && resolver.isKnown(stub.address())) {
                    // imported instead
                    continue;
                }
                writer.writeAll(ForwardDeclarations.stub(stub));
            }
        }
        for (Declaration child : scope.children()) {
            if (child.isForwardDeclaration() && child instanceof Aggregate forward && !child.isAnonymous()) {
                writer.writeAll(context.aggregate(forward));
            }
        }

        Map<String, TypedefDecl> namingTypedefs = nameAnonymousAggregates(scope, context);
        Set<String> referenced = referencedAnonymous(scope);
        Set<String> emitted = new HashSet<>();

        for (Declaration child : scope.children()) {
            if (child.isForwardDeclaration() && child instanceof Aggregate && !child.isAnonymous()) {
                continue;
            }
            if (child.isAnonymous()) {
                boolean deferred = namingTypedefs.containsKey(child.key()) || referenced.contains(child.key());
                if (!deferred && child instanceof Aggregate aggregate && emitted.add(child.key())) {
                    writer.writeAll(context.aggregate(aggregate));
                }
                continue;
            }
            if (child instanceof TypedefDecl typedef) {
                Optional<Aggregate> aliased = typedef.aliasedAggregate();
                if (aliased.isPresent() && namingTypedefs.get(aliased.get().declaration().key()) == typedef
                        && emitted.add(aliased.get().declaration().key())) {
                    writer.writeAll(context.aggregate(aliased.get(), typedef.name(), true));
                    continue;
                }
            }
            for (Declaration dependency : child.associatedTypes()) {
                if (dependency.isAnonymous() && referenced.contains(dependency.key())
                        && !namingTypedefs.containsKey(dependency.key())
                        && dependency instanceof Aggregate aggregate && emitted.add(dependency.key())) {
                    writer.writeAll(context.aggregate(aggregate));
                }
            }
            context.emit(child, writer, false);
        }

        if (writer.size() == 1) {
            writer.write("pass");
        }
        log.debug("Rendered scope '{}' into {} line(s)", scope.path(), writer.size());
        return writer.lines();
    }

    /**
     * Names the anonymous aggregates declared directly in the scope. A typedef naming one
     * supplies its name, the first typedef winning; all others get a synthetic name.
     *
     * @return The naming typedef per anonymous aggregate key.
     */
    private Map<String, TypedefDecl> nameAnonymousAggregates(Scope scope, ScopeRenderContext context) {
        Set<String> anonymous = new HashSet<>();
        for (Declaration child : scope.children()) {
            if (child.isAnonymous()) {
                anonymous.add(child.key());
            }
        }
        Map<String, TypedefDecl> namingTypedefs = new LinkedHashMap<>();
        for (Declaration child : scope.children()) {
            if (child instanceof TypedefDecl typedef) {
                typedef.aliasedAggregate()
                        .map(Aggregate::declaration)
                        .filter(d -> anonymous.contains(d.key()) && !namingTypedefs.containsKey(d.key()))
                        .ifPresent(d -> {
                            namingTypedefs.put(d.key(), typedef);
                            context.name(d, typedef.name());
                        });
            }
        }
        String scopeName = scope.isGlobal() ? GLOBAL_SCOPE_NAME : QualifiedNames.flatten(scope.path());
        for (Declaration child : scope.children()) {
            if (child.isAnonymous()) {
                context.nameSynthetic(child, scopeName);
            }
        }
        return namingTypedefs;
    }

    /**
     * Keys of the scope's own anonymous aggregates that another declaration of the scope
     * refers to.
     */
    private static Set<String> referencedAnonymous(Scope scope) {
        Set<String> anonymous = new HashSet<>();
        for (Declaration child : scope.children()) {
            if (child.isAnonymous()) {
                anonymous.add(child.key());
            }
        }
        Set<String> referenced = new HashSet<>();
        for (Declaration child : scope.children()) {
            if (child.isAnonymous()) {
                continue;
            }
            for (Declaration dependency : child.associatedTypes()) {
                if (anonymous.contains(dependency.key())) {
                    referenced.add(dependency.key());
                }
            }
        }
        return referenced;
    }

    private static String externLine(Scope scope, String header) {
        String namespace = scope.isGlobal() ? "" : " namespace \"" + scope.path() + "\"";
        return "cdef extern from \"" + header + "\"" + namespace + ":";
    }
}
