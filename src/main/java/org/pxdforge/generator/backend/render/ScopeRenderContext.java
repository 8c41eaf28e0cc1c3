package org.pxdforge.generator.backend.render;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.pxdforge.generator.diagnostics.DiagnosticsEngine;
import org.pxdforge.generator.frontend.decl.Aggregate;
import org.pxdforge.generator.frontend.decl.Declaration;
import org.pxdforge.generator.frontend.decl.FunctionDecl;
import org.pxdforge.generator.frontend.decl.QualifiedNames;
import org.pxdforge.generator.frontend.decl.RenderContext;
import org.pxdforge.generator.frontend.decl.TypedefDecl;
import org.pxdforge.generator.frontend.semantics.ReferenceSite;
import org.pxdforge.generator.frontend.semantics.TypeResolver;

/**
 * Rendering state of one scope: the use site for type references and the names handed
 * out to anonymous aggregates.
 */
public class ScopeRenderContext implements RenderContext {

    static final String COMMENT = "#  ";
    static final String STATIC_MARKER = "@staticmethod";

    private final TypeResolver resolver;
    private final ReferenceSite site;
    private final DiagnosticsEngine diagnostics;
    private final Map<String, String> anonymousNames = new HashMap<>();
    /** Key of the typedef declaring an anonymous member, per anonymous member key. */
    private final Map<String, String> namingTypedefs = new HashMap<>();
    private final Map<String, Integer> ordinals = new HashMap<>();

    public ScopeRenderContext(TypeResolver resolver, ReferenceSite site, DiagnosticsEngine diagnostics) {
        this.resolver = resolver;
        this.site = site;
        this.diagnostics = diagnostics;
    }

    @Override
    public Optional<String> nameOf(Declaration declaration) {
        if (declaration.isAnonymous()) {
            return Optional.ofNullable(anonymousNames.get(declaration.key()));
        }
        return Optional.of(resolver.reference(site, declaration.address(), declaration));
    }

    @Override
    public String nameOf(String qualifiedName) {
        return resolver.reference(site, qualifiedName, null);
    }

    /**
     * Assigns the name an anonymous aggregate is declared and referenced under.
     *
     * @return Whether the name was assigned; the first assignment sticks.
     */
    boolean name(Declaration anonymous, String name) {
        return anonymousNames.putIfAbsent(anonymous.key(), name) == null;
    }

    private boolean isNamed(Declaration anonymous) {
        return anonymousNames.containsKey(anonymous.key());
    }

    /**
     * Names an anonymous aggregate {@code anon_<owner>_<ordinal>} unless it already has a
     * name. Ordinals count per owner name over the whole scope, so owners flattening to
     * the same name, such as the global scope and a struct named {@code toplevel}, never
     * share a synthetic name.
     *
     * @return The name of the aggregate.
     */
    String nameSynthetic(Declaration anonymous, String owner) {
        if (!isNamed(anonymous)) {
            int ordinal = ordinals.merge(owner, 1, Integer::sum) - 1;
            name(anonymous, "anon_" + owner + "_" + ordinal);
        }
        return anonymousNames.get(anonymous.key());
    }

    @Override
    public List<String> aggregate(Aggregate aggregate) {
        Declaration declaration = aggregate.declaration();
        String name = declaration.isAnonymous()
                ? anonymousNames.getOrDefault(declaration.key(), declaration.name())
                : declaration.name();
        return aggregate(aggregate, name, false);
    }

    /**
     * Renders an aggregate under the given name. An anonymous member aliased by a typedef
     * of the body takes the typedef's name and is declared at the typedef's position. The
     * other anonymous members are named {@code anon_<owner>_<ordinal>} and declared before
     * the header.
     */
    List<String> aggregate(Aggregate aggregate, String name, boolean typedefForm) {
        Declaration declaration = aggregate.declaration();
        String owner = declaration.isAnonymous() ? name : QualifiedNames.flatten(declaration.address());
        nameByTypedefs(aggregate.members());
        List<String> lines = new ArrayList<>();
        for (Declaration member : aggregate.members()) {
            if (member.isAnonymous() && member instanceof Aggregate nested && !namingTypedefs.containsKey(member.key())) {
                lines.addAll(aggregate(nested, nameSynthetic(member, owner), false));
            }
        }
        lines.add(aggregate.header(name, typedefForm));
        lines.addAll(aggregate.body(this));
        return lines;
    }

    private void nameByTypedefs(List<Declaration> members) {
        Set<String> anonymous = members.stream()
                .filter(Declaration::isAnonymous)
                .map(Declaration::key)
                .collect(Collectors.toSet());
        for (Declaration member : members) {
            if (member instanceof TypedefDecl typedef) {
                typedef.aliasedAggregate()
                        .map(Aggregate::declaration)
                        .filter(d -> anonymous.contains(d.key()) && !namingTypedefs.containsKey(d.key()))
                        .ifPresent(d -> {
                            namingTypedefs.put(d.key(), typedef.key());
                            name(d, typedef.name());
                        });
            }
        }
    }

    private Optional<Aggregate> declaredBy(TypedefDecl typedef) {
        return typedef.aliasedAggregate()
                .filter(a -> typedef.key().equals(namingTypedefs.get(a.declaration().key())));
    }

    @Override
    public List<String> body(Aggregate owner, List<Declaration> members) {
        BlockWriter writer = new BlockWriter().indent();
        for (Declaration member : members) {
            if (member.isForwardDeclaration() && member instanceof Aggregate forward) {
                writer.writeAll(aggregate(forward));
            }
        }
        for (Declaration member : members) {
            if (member.isAnonymous() || (member.isForwardDeclaration() && member instanceof Aggregate)) {
                continue;
            }
            if (member instanceof TypedefDecl typedef) {
                Optional<Aggregate> declared = declaredBy(typedef);
                if (declared.isPresent()) {
                    writer.writeAll(aggregate(declared.get(), typedef.name(), true));
                    continue;
                }
            }
            emit(member, writer, true);
        }
        if (writer.isEmpty()) {
            writer.write("pass");
        }
        return writer.lines();
    }

    /**
     * Writes one declaration. Unsupported declarations are written commented out and
     * reported; static methods in an instance body get the static marker.
     */
    void emit(Declaration declaration, BlockWriter writer, boolean instanceScope) {
        Optional<String> unsupported = declaration.unsupportedReason();
        unsupported.ifPresent(reason -> diagnostics.reportWarning(
                "Unsupported declaration '" + declaration.address() + "': " + reason,
                declaration.file(), declaration.cursor().line()));
        String prefix = unsupported.isPresent() ? COMMENT : "";
        boolean markStatic = instanceScope && declaration instanceof FunctionDecl function && function.isStaticMethod();
        for (String line : declaration.lines(this)) {
            if (markStatic) {
                writer.write(prefix + STATIC_MARKER);
            }
            writer.write(prefix + line);
        }
    }

    public ReferenceSite site() {
        return site;
    }
}
