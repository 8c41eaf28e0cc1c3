package org.pxdforge.generator.frontend.scope;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.decl.Declaration;
import org.pxdforge.generator.frontend.decl.DeclarationKind;
import org.pxdforge.generator.frontend.decl.Declarations;
import org.pxdforge.generator.frontend.decl.MacroDecl;
import org.pxdforge.generator.frontend.decl.QualifiedNames;
import org.pxdforge.generator.frontend.decl.StructDecl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link Scope}s from the roots {@link ScopeFinder} grouped under one path.
 *
 * <p>A child of any root is kept only if it is visible, belongs in this kind of scope
 * (instance members live in the class body, not in the class scope), is not a forward
 * declaration shadowed by a definition, and, in restricted mode, comes from one of the
 * origin files. Kinds without a rendering are dropped, as are macros unless enabled.</p>
 */
public class ScopeAggregator {

    private static final Logger log = LoggerFactory.getLogger(ScopeAggregator.class);

    private final TranslationUnit unit;
    private final boolean recursive;
    private final Set<String> originFiles;
    private final boolean includeMacros;

    /**
     * @param unit          The unit the roots belong to.
     * @param recursive     Whether declarations from included headers are kept.
     * @param originFiles   Files whose declarations are always kept.
     * @param includeMacros Whether macro definitions are declared as constants.
     */
    public ScopeAggregator(TranslationUnit unit, boolean recursive, Set<String> originFiles, boolean includeMacros) {
        this.unit = unit;
        this.recursive = recursive;
        this.originFiles = Set.copyOf(originFiles);
        this.includeMacros = includeMacros;
    }

    /**
     * Aggregates the scope of one qualified path.
     *
     * @param path  The qualified path.
     * @param roots The cursors opening it, in AST order.
     * @return The filtered scope; possibly without declarations.
     */
    public Scope aggregate(String path, List<Cursor> roots) {
        boolean classSpace = !roots.isEmpty() && roots.stream().allMatch(r -> r.kind().isCppClass());
        String namespace = classSpace ? QualifiedNames.namespace(roots.get(0)) : path;
        Map<String, Declaration> children = new LinkedHashMap<>();
        for (Cursor root : roots) {
            for (Cursor child : root.children()) {
                if (accept(child, classSpace)) {
                    Declaration declaration = Declarations.specialize(child, unit);
                    if (keep(declaration)) {
                        children.putIfAbsent(declaration.key(), declaration);
                    }
                }
            }
        }
        log.debug("Scope '{}' keeps {} declaration(s) from {} root(s)", path, children.size(), roots.size());
        return new Scope(path, namespace, new ArrayList<>(children.values()), originFiles, classSpace, !recursive, unit.mainFile());
    }

    /**
     * Aggregates every scope {@link ScopeFinder} reports for the unit.
     */
    public List<Scope> aggregateAll() {
        List<Scope> scopes = new ArrayList<>();
        for (Map.Entry<String, List<Cursor>> entry : ScopeFinder.find(unit).entrySet()) {
            scopes.add(aggregate(entry.getKey(), entry.getValue()));
        }
        return scopes;
    }

    private boolean accept(Cursor child, boolean classSpace) {
        if (!child.access().isVisible()) {
            return false;
        }
        if (classSpace && StructDecl.INSTANCE_KINDS.contains(child.kind())) {
            return false;
        }
        if (unit.isShadowedForwardDeclaration(child)) {
            return false;
        }
        if (child.file() == null) {
            return false;
        }
        return recursive || originFiles.contains(child.file());
    }

    private boolean keep(Declaration declaration) {
        DeclarationKind kind = declaration.kind();
        if (kind == DeclarationKind.OPAQUE) {
            return false;
        }
        if (declaration instanceof MacroDecl macro) {
            return includeMacros && !macro.isEmpty();
        }
        return !declaration.name().isEmpty() || declaration.isAnonymous();
    }
}
