package org.pxdforge.generator.frontend.ast;

/**
 * A diagnostic emitted by the native front end while parsing the translation unit.
 *
 * @param severity 1 (note) to 4 (fatal), as reported by the front end.
 * @param message  The diagnostic text.
 * @param file     The file the diagnostic points at, or {@code null}.
 * @param line     The line number, 0 when unknown.
 */
public record UpstreamDiagnostic(int severity, String message, String file, int line) {
}
