package org.pxdforge.generator.frontend.semantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

import org.pxdforge.generator.diagnostics.DiagnosticsEngine;
import org.pxdforge.generator.frontend.decl.Declaration;
import org.pxdforge.generator.frontend.decl.QualifiedNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The symbol table of one generator run.
 *
 * <p>Declared types are registered once per qualified name, referenced types are looked
 * up and recorded as unknown until a later registration resolves them. For every use
 * site the resolver decides the token to emit and the import it needs. Imports
 * accumulate until the output unit drains them.</p>
 *
 * <p>Instances are not thread-safe; one resolver serves one sequential run.</p>
 */
public class TypeResolver {

    private static final Logger log = LoggerFactory.getLogger(TypeResolver.class);

    private final DiagnosticsEngine diagnostics;
    private final Map<String, ResolvedType> known = new LinkedHashMap<>();
    private final Map<String, ResolvedType> unknown = new LinkedHashMap<>();
    private final Map<String, ImportStatement> imports = new TreeMap<>();
    private final TreeSet<String> unresolved = new TreeSet<>();

    public TypeResolver(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Registers a global type written to no particular module.
     */
    public void registerDeclared(String qualifiedName) {
        registerDeclared(qualifiedName, "", "", null, true);
    }

    /**
     * Marks a qualified name as declared by the generated output.
     *
     * <p>The first registration wins, except that a definition replaces an earlier
     * forward declaration.</p>
     *
     * @param qualifiedName The C++ qualified name.
     * @param namespace     Its enclosing namespaces.
     * @param modulePath    The module it is written to.
     * @param file          The declaring header.
     * @param definition    Whether the declaration is a definition.
     */
    public void registerDeclared(String qualifiedName, String namespace, String modulePath, String file, boolean definition) {
        unknown.remove(qualifiedName);
        ResolvedType existing = known.get(qualifiedName);
        if (existing != null && (existing.definition() || !definition)) {
            return;
        }
        known.put(qualifiedName, new ResolvedType(qualifiedName, namespace, modulePath, file, definition));
        log.debug("Registered '{}' in module '{}'", qualifiedName, modulePath);
    }

    public boolean isKnown(String qualifiedName) {
        return known.containsKey(qualifiedName);
    }

    public Optional<ResolvedType> lookup(String qualifiedName) {
        return Optional.ofNullable(known.get(qualifiedName));
    }

    /**
     * Checks a referenced type name: directly, then relative to each enclosing namespace
     * from the innermost outwards, then against builtins and standard types. Anything
     * else is recorded as unknown.
     *
     * @param typeString       The referenced name.
     * @param currentNamespace The namespace the reference appears in.
     * @return Whether the name resolved.
     */
    public boolean processReference(String typeString, String currentNamespace) {
        if (StandardTypes.isBuiltin(typeString) || known.containsKey(typeString)) {
            return true;
        }
        String namespace = currentNamespace == null ? "" : currentNamespace;
        while (!namespace.isEmpty()) {
            if (known.containsKey(QualifiedNames.qualify(namespace, typeString))) {
                return true;
            }
            int separator = namespace.lastIndexOf(QualifiedNames.SEPARATOR);
            namespace = separator < 0 ? "" : namespace.substring(0, separator);
        }
        if (StandardTypes.moduleOf(typeString).isPresent()) {
            return true;
        }
        unknown.putIfAbsent(typeString, ResolvedType.pending(typeString));
        return false;
    }

    /**
     * Decides how a type is written at a use site.
     *
     * @param site          The referencing scope.
     * @param qualifiedName The referenced type's qualified name.
     * @param declaration   The referenced declaration, {@code null} for types the AST
     *                      only spells.
     * @return The token and its import, or empty if the type is not known.
     */
    public Optional<TypeReference> importFor(ReferenceSite site, String qualifiedName, Declaration declaration) {
        if (StandardTypes.isBuiltin(qualifiedName)) {
            return Optional.of(TypeReference.local(qualifiedName));
        }
        Optional<String> standardModule = StandardTypes.moduleOf(qualifiedName);
        if (standardModule.isPresent()) {
            return Optional.of(standardReference(qualifiedName, standardModule.get()));
        }
        if (declaration != null && site.restricted() && !site.isOrigin(declaration.file())
                && !(site.importAll() && known.containsKey(qualifiedName))) {
            return Optional.of(TypeReference.local(declaration.name()));
        }
        ResolvedType resolved = known.get(qualifiedName);
        if (resolved == null) {
            return Optional.empty();
        }
        if (resolved.modulePath().equals(site.modulePath())) {
            return Optional.of(TypeReference.local(resolved.localPath()));
        }
        if (!resolved.namespace().isEmpty() && QualifiedNames.isSameOrEnclosing(resolved.namespace(), site.namespace())) {
            return Optional.of(enclosingReference(site, resolved));
        }
        String flat = QualifiedNames.flatten(resolved.namespace());
        if (flat.isEmpty()) {
            return Optional.of(new TypeReference(resolved.localPath(),
                    new ImportStatement(resolved.modulePath(), resolved.topLevelSymbol(), null)));
        }
        return Optional.of(new TypeReference(flat + "_" + resolved.localPath(),
                new ImportStatement(resolved.modulePath(), resolved.topLevelSymbol(), flat + "_" + resolved.topLevelSymbol())));
    }

    private TypeReference standardReference(String qualifiedName, String module) {
        String basename = QualifiedNames.basename(qualifiedName);
        if (StandardTypes.RESPELL_ONLY.equals(module)) {
            return TypeReference.local(basename);
        }
        String alias = QualifiedNames.flatten(qualifiedName);
        return new TypeReference(alias, new ImportStatement(module, basename, alias));
    }

    private TypeReference enclosingReference(ReferenceSite site, ResolvedType resolved) {
        if (site.layout() == ModuleLayout.NAMESPACE) {
            return TypeReference.local(resolved.localPath());
        }
        if (site.importAll()) {
            return new TypeReference(resolved.localPath(),
                    new ImportStatement(resolved.modulePath(), resolved.topLevelSymbol(), null));
        }
        diagnostics.reportWarning("'" + resolved.qualifiedName() + "' is declared in module '" + resolved.modulePath()
                + "' and referenced from '" + site.modulePath() + "' without an import", resolved.file(), 0);
        return TypeReference.local(resolved.localPath());
    }

    /**
     * Resolves a use site and records the import it needs. Types that do not resolve
     * are written as their dotted path relative to the current namespace and recorded
     * as unresolved.
     *
     * @return The token to emit.
     */
    public String reference(ReferenceSite site, String qualifiedName, Declaration declaration) {
        Optional<TypeReference> reference = importFor(site, qualifiedName, declaration);
        if (reference.isPresent()) {
            reference.get().imported().ifPresent(this::addImport);
            return reference.get().token();
        }
        String fallback = QualifiedNames.dotted(QualifiedNames.relativeTo(qualifiedName, site.namespace()));
        unknown.putIfAbsent(qualifiedName, ResolvedType.pending(qualifiedName));
        unresolved.add(fallback);
        return fallback;
    }

    private void addImport(ImportStatement statement) {
        // One binding per symbol and module; the first alias wins.
        imports.putIfAbsent(statement.module() + " " + statement.symbol(), statement);
    }

    /**
     * Returns and clears the accumulated imports, sorted.
     */
    public List<ImportStatement> drainImports() {
        List<ImportStatement> drained = new ArrayList<>(new TreeSet<>(imports.values()));
        imports.clear();
        return drained;
    }

    /**
     * Returns and clears the tokens emitted for unresolved types since the last call.
     */
    public List<String> drainUnresolved() {
        List<String> drained = new ArrayList<>(unresolved);
        unresolved.clear();
        return drained;
    }

    /**
     * Reports every type still unknown. Called once after the last unit.
     *
     * @return The number of unknown types.
     */
    public int warnUnresolved() {
        for (String name : unknown.keySet()) {
            diagnostics.reportWarning("Unresolved type '" + name + "'", null, 0);
        }
        return unknown.size();
    }

    public Map<String, ResolvedType> unknownTypes() {
        return Collections.unmodifiableMap(unknown);
    }

    public Map<String, ResolvedType> knownTypes() {
        return Collections.unmodifiableMap(known);
    }
}
