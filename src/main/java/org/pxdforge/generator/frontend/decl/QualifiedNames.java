package org.pxdforge.generator.frontend.decl;

import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.CursorKind;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Computes qualified addresses by walking lexical ancestors.
 * Inline namespaces are transparent, so {@code std::__1::vector} is addressed as
 * {@code std::vector}.
 */
public final class QualifiedNames {

    public static final String SEPARATOR = "::";

    private QualifiedNames() {
    }

    /**
     * Enclosing namespaces and classes of a cursor, e.g. {@code Foo::A} for a member of
     * class {@code A} in namespace {@code Foo}.
     */
    public static String location(Cursor cursor) {
        return join(cursor, false);
    }

    /**
     * Enclosing namespaces only.
     */
    public static String namespace(Cursor cursor) {
        return join(cursor, true);
    }

    /**
     * The fully scoped name of a cursor.
     */
    public static String address(Cursor cursor) {
        return qualify(location(cursor), cursor.spelling());
    }

    /**
     * The qualified path a namespace or class cursor opens as a scope.
     */
    public static String scopePath(Cursor cursor) {
        if (cursor.kind() == CursorKind.TRANSLATION_UNIT) {
            return "";
        }
        if (cursor.kind() == CursorKind.NAMESPACE && (cursor.isInlineNamespace() || cursor.spelling().isEmpty())) {
            return location(cursor);
        }
        return address(cursor);
    }

    public static String qualify(String prefix, String name) {
        if (prefix == null || prefix.isEmpty()) {
            return name;
        }
        if (name == null || name.isEmpty()) {
            return prefix;
        }
        return prefix + SEPARATOR + name;
    }

    /**
     * The last segment of a qualified name.
     */
    public static String basename(String qualifiedName) {
        int index = qualifiedName.lastIndexOf(SEPARATOR);
        return index < 0 ? qualifiedName : qualifiedName.substring(index + SEPARATOR.length());
    }

    /**
     * Replaces namespace separators with underscores: {@code Foo::Bar} becomes {@code Foo_Bar}.
     */
    public static String flatten(String qualifiedName) {
        return qualifiedName.replace(SEPARATOR, "_");
    }

    /**
     * Replaces namespace separators with dots: {@code Foo::Bar} becomes {@code Foo.Bar}.
     */
    public static String dotted(String qualifiedName) {
        return qualifiedName.replace(SEPARATOR, ".");
    }

    /**
     * Strips a namespace prefix from a qualified name if present.
     *
     * @param qualifiedName The name to shorten.
     * @param namespace     The prefix to remove, may be empty.
     * @return The remainder, or the input when it does not start with the prefix.
     */
    public static String relativeTo(String qualifiedName, String namespace) {
        if (namespace == null || namespace.isEmpty()) {
            return qualifiedName;
        }
        String prefix = namespace + SEPARATOR;
        return qualifiedName.startsWith(prefix) ? qualifiedName.substring(prefix.length()) : qualifiedName;
    }

    /**
     * Whether {@code ancestor} equals {@code namespace} or encloses it.
     */
    public static boolean isSameOrEnclosing(String ancestor, String namespace) {
        if (ancestor.isEmpty()) {
            return true;
        }
        return namespace.equals(ancestor) || namespace.startsWith(ancestor + SEPARATOR);
    }

    private static String join(Cursor cursor, boolean namespacesOnly) {
        Deque<String> segments = new ArrayDeque<>();
        for (Cursor p = cursor.parent(); p != null && p.kind() != CursorKind.TRANSLATION_UNIT; p = p.parent()) {
            boolean isNamespace = p.kind() == CursorKind.NAMESPACE;
            if (isNamespace && p.isInlineNamespace()) {
                continue;
            }
            if (!isNamespace && (namespacesOnly || !p.kind().isAggregate())) {
                continue;
            }
            if (!p.spelling().isEmpty()) {
                segments.push(p.spelling());
            }
        }
        return String.join(SEPARATOR, segments);
    }
}
