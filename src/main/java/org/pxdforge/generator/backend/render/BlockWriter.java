package org.pxdforge.generator.backend.render;

import java.util.ArrayList;
import java.util.List;

import org.pxdforge.generator.frontend.decl.Declarations;

/**
 * Accumulates lines at a current indentation level.
 */
public class BlockWriter {

    private final List<String> lines = new ArrayList<>();
    private int depth;

    public BlockWriter write(String line) {
        lines.add(line.isEmpty() ? line : Declarations.INDENT.repeat(depth) + line);
        return this;
    }

    public BlockWriter writeAll(List<String> block) {
        for (String line : block) {
            write(line);
        }
        return this;
    }

    public BlockWriter indent() {
        depth++;
        return this;
    }

    public BlockWriter unindent() {
        if (depth > 0) {
            depth--;
        }
        return this;
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public int size() {
        return lines.size();
    }

    public List<String> lines() {
        return new ArrayList<>(lines);
    }

    @Override
    public String toString() {
        return String.join("\n", lines);
    }
}
