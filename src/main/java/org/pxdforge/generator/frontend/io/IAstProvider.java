package org.pxdforge.generator.frontend.io;

import java.io.IOException;
import java.nio.file.Path;

import org.pxdforge.generator.frontend.ast.TranslationUnit;

/**
 * Supplies parsed translation units. The native front end producing them stays outside
 * this process.
 */
public interface IAstProvider {

    /**
     * Loads one translation unit.
     *
     * @param source The dump describing the unit.
     * @return The linked unit.
     * @throws IOException If the dump cannot be read or is malformed.
     */
    TranslationUnit load(Path source) throws IOException;
}
