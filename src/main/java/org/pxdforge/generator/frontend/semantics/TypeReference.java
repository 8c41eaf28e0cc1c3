package org.pxdforge.generator.frontend.semantics;

import java.util.Optional;

/**
 * How a referenced type is written at one use site.
 *
 * @param token           The text to emit in place of the type name.
 * @param importStatement The import the token depends on, {@code null} if none.
 */
public record TypeReference(String token, ImportStatement importStatement) {

    public static TypeReference local(String token) {
        return new TypeReference(token, null);
    }

    public Optional<ImportStatement> imported() {
        return Optional.ofNullable(importStatement);
    }
}
