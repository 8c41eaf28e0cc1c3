package org.pxdforge.generator.diagnostics;

/**
 * A single recorded diagnostic.
 *
 * @param severity The severity.
 * @param message  Human-readable text.
 * @param file     The file the diagnostic refers to, or {@code null}.
 * @param line     Line number, 0 when unknown.
 */
public record Diagnostic(Severity severity, String message, String file, int line) {

    @Override
    public String toString() {
        String location = file == null ? "" : file + (line > 0 ? ":" + line : "") + ": ";
        return "[" + severity + "] " + location + message;
    }
}
