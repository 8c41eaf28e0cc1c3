package org.pxdforge.generator.frontend.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The parsed form of one main header together with everything it includes.
 *
 * <p>Building a unit links parents, propagates originating files and indexes every
 * cursor that carries an id. Redeclarations sharing an id are reconciled by
 * {@link #canonical(String)}: a definition always wins over a forward declaration, and
 * among equals the lexicographically smallest (file, line) wins, so the outcome does
 * not depend on traversal order.</p>
 */
public final class TranslationUnit {

    private static final Comparator<Cursor> CANONICAL_ORDER = Comparator
            .comparing((Cursor c) -> !c.isDefinition())
            .thenComparing(c -> c.file() == null ? "\uffff" : c.file())
            .thenComparingInt(Cursor::line);

    private final String mainFile;
    private final Cursor root;
    private final List<UpstreamDiagnostic> diagnostics;
    private final Map<String, List<Cursor>> cursorsById = new HashMap<>();

    private TranslationUnit(String mainFile, Cursor root, List<UpstreamDiagnostic> diagnostics) {
        this.mainFile = mainFile;
        this.root = root;
        this.diagnostics = List.copyOf(diagnostics);
        linkAndIndex();
    }

    /**
     * Creates a unit from the top-level cursors of a main header.
     *
     * @param mainFile    Absolute path of the main header.
     * @param topLevel    The translation unit's direct children.
     * @param diagnostics Front-end diagnostics reported while parsing.
     * @return The linked unit.
     */
    public static TranslationUnit of(String mainFile, List<Cursor> topLevel, List<UpstreamDiagnostic> diagnostics) {
        Cursor root = Cursor.builder(CursorKind.TRANSLATION_UNIT, mainFile)
                .file(mainFile)
                .children(topLevel)
                .build();
        return new TranslationUnit(mainFile, root, diagnostics);
    }

    public static TranslationUnit of(String mainFile, List<Cursor> topLevel) {
        return of(mainFile, topLevel, List.of());
    }

    private void linkAndIndex() {
        Deque<Cursor> stack = new ArrayDeque<>();
        root.link(null);
        stack.push(root);
        while (!stack.isEmpty()) {
            Cursor current = stack.pop();
            if (current.id() != null) {
                cursorsById.computeIfAbsent(current.id(), k -> new ArrayList<>()).add(current);
            }
            for (Cursor child : current.children()) {
                child.link(current);
                stack.push(child);
            }
        }
        for (List<Cursor> redeclarations : cursorsById.values()) {
            redeclarations.sort(CANONICAL_ORDER);
        }
    }

    public String mainFile() {
        return mainFile;
    }

    public Cursor root() {
        return root;
    }

    public List<UpstreamDiagnostic> diagnostics() {
        return diagnostics;
    }

    /**
     * The declaration that stands for every cursor sharing the given id.
     *
     * @param id The declaration id.
     * @return The canonical cursor, or empty if the id is unknown.
     */
    public Optional<Cursor> canonical(String id) {
        if (id == null) {
            return Optional.empty();
        }
        List<Cursor> redeclarations = cursorsById.get(id);
        return redeclarations == null ? Optional.empty() : Optional.of(redeclarations.get(0));
    }

    /**
     * All cursors sharing an id, canonical one first.
     */
    public List<Cursor> redeclarations(String id) {
        List<Cursor> redeclarations = cursorsById.get(id);
        return redeclarations == null ? List.of() : List.copyOf(redeclarations);
    }

    /**
     * Resolves the declaration a named type refers to.
     *
     * @param type A base type descriptor.
     * @return The canonical declaring cursor, if the provider recorded one.
     */
    public Optional<Cursor> declarationOf(TypeDescriptor type) {
        return type == null ? Optional.empty() : canonical(type.declarationId());
    }

    /**
     * Whether the cursor is a forward declaration shadowed by a definition somewhere in
     * this unit.
     */
    public boolean isShadowedForwardDeclaration(Cursor cursor) {
        if (cursor.isDefinition() || cursor.id() == null || !cursor.kind().isAggregate()) {
            return false;
        }
        return canonical(cursor.id()).map(c -> c != cursor && c.isDefinition()).orElse(false);
    }
}
