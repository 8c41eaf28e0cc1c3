package org.pxdforge.generator.api;

import java.io.IOException;

/**
 * Receives generated modules.
 */
public interface IOutputSink {

    /**
     * Writes one module.
     *
     * @param relativePath The module's file path below the output root, as laid out by
     *                     {@link PackageLayout}.
     * @param text         The module text.
     * @throws IOException if the text cannot be written.
     */
    void write(String relativePath, String text) throws IOException;
}
