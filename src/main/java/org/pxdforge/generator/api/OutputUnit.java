package org.pxdforge.generator.api;

/**
 * The generated text of one module.
 *
 * @param modulePath Dotted module path, e.g. {@code A.B} or {@code include.foo}.
 * @param text       The module text, newline-terminated.
 */
public record OutputUnit(String modulePath, String text) {
}
