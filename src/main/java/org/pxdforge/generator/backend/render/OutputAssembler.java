package org.pxdforge.generator.backend.render;

import java.util.List;
import java.util.regex.Pattern;

import org.pxdforge.generator.frontend.semantics.ImportStatement;

/**
 * Joins the parts of one output unit: imports, the auto-defined block for unresolved
 * types and the rendered extern blocks.
 */
public class OutputAssembler {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");

    private final boolean writeImports;
    private final boolean autodefine;

    /**
     * @param writeImports Whether the import list is written.
     * @param autodefine   Whether unresolved types are declared as opaque structs.
     */
    public OutputAssembler(boolean writeImports, boolean autodefine) {
        this.writeImports = writeImports;
        this.autodefine = autodefine;
    }

    /**
     * @param imports    Sorted, deduplicated imports of the unit.
     * @param unresolved Tokens emitted for types that never resolved.
     * @param blocks     Rendered extern blocks, in scope order.
     * @return The module text, ending in a newline.
     */
    public String assemble(List<ImportStatement> imports, List<String> unresolved, List<List<String>> blocks) {
        BlockWriter writer = new BlockWriter();
        if (writeImports && !imports.isEmpty()) {
            for (ImportStatement statement : imports) {
                writer.write(statement.toString());
            }
            writer.write("");
        }
        if (autodefine && unresolved.stream().anyMatch(n -> IDENTIFIER.matcher(n).matches())) {
            writer.write("cdef extern from *:");
            writer.indent();
            for (String name : unresolved) {
                if (!IDENTIFIER.matcher(name).matches()) {
                    continue;
                }
                writer.write("ctypedef struct " + name + ":");
                writer.indent().write("pass").unindent();
            }
            writer.unindent();
            writer.write("");
        }
        for (List<String> block : blocks) {
            writer.writeAll(block);
            writer.write("");
        }
        StringBuilder text = new StringBuilder();
        List<String> lines = writer.lines();
        int end = lines.size();
        while (end > 0 && lines.get(end - 1).isEmpty()) {
            end--;
        }
        for (int i = 0; i < end; i++) {
            text.append(lines.get(i)).append('\n');
        }
        return text.toString();
    }
}
