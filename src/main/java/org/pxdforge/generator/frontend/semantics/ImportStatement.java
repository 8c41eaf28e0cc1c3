package org.pxdforge.generator.frontend.semantics;

import java.util.Comparator;
import java.util.Objects;

/**
 * One {@code from <module> cimport <symbol> [as <alias>]} line.
 *
 * @param module The dotted module path.
 * @param symbol The imported top-level name.
 * @param alias  The local name, {@code null} when the symbol keeps its own name.
 */
public record ImportStatement(String module, String symbol, String alias) implements Comparable<ImportStatement> {

    private static final Comparator<ImportStatement> ORDER = Comparator
            .comparing(ImportStatement::module)
            .thenComparing(ImportStatement::symbol)
            .thenComparing(i -> i.alias() == null ? "" : i.alias());

    public ImportStatement {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(symbol, "symbol");
        if (alias != null && (alias.isEmpty() || alias.equals(symbol))) {
            alias = null;
        }
    }

    @Override
    public int compareTo(ImportStatement other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "from " + module + " cimport " + symbol + (alias != null ? " as " + alias : "");
    }
}
