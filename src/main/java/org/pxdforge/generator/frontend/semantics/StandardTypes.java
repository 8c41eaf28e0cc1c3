package org.pxdforge.generator.frontend.semantics;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Types that never need a generated declaration: machine scalars and the C/C++
 * standard library types Cython ships declarations for.
 */
public final class StandardTypes {

    /** Module marker for names that are only respelled, never imported. */
    public static final String RESPELL_ONLY = "$";

    private static final Set<String> BUILTINS = Set.of(
            "void", "_Bool", "bool", "char", "short", "int", "long", "long long",
            "float", "double", "long double", "size_t", "ssize_t",
            "signed char", "unsigned char", "signed short", "unsigned short",
            "signed int", "unsigned int", "unsigned", "signed",
            "signed long", "unsigned long", "signed long long", "unsigned long long",
            "short int", "unsigned short int", "long int", "unsigned long int",
            "long long int", "unsigned long long int");

    private static final Map<String, String> MODULES = Map.ofEntries(
            Map.entry("int8_t", "libc.stdint"),
            Map.entry("int16_t", "libc.stdint"),
            Map.entry("int32_t", "libc.stdint"),
            Map.entry("int64_t", "libc.stdint"),
            Map.entry("uint8_t", "libc.stdint"),
            Map.entry("uint16_t", "libc.stdint"),
            Map.entry("uint32_t", "libc.stdint"),
            Map.entry("uint64_t", "libc.stdint"),
            Map.entry("intptr_t", "libc.stdint"),
            Map.entry("uintptr_t", "libc.stdint"),
            Map.entry("intmax_t", "libc.stdint"),
            Map.entry("uintmax_t", "libc.stdint"),
            Map.entry("FILE", "libc.stdio"),
            Map.entry("fpos_t", "libc.stdio"),
            Map.entry("clock_t", "libc.time"),
            Map.entry("time_t", "libc.time"),
            Map.entry("std::complex", "libcpp.complex"),
            Map.entry("std::deque", "libcpp.deque"),
            Map.entry("std::list", "libcpp.list"),
            Map.entry("std::map", "libcpp.map"),
            Map.entry("std::unique_ptr", "libcpp.memory"),
            Map.entry("std::shared_ptr", "libcpp.memory"),
            Map.entry("std::weak_ptr", "libcpp.memory"),
            Map.entry("std::queue", "libcpp.queue"),
            Map.entry("std::priority_queue", "libcpp.queue"),
            Map.entry("std::set", "libcpp.set"),
            Map.entry("std::multiset", "libcpp.multiset"),
            Map.entry("std::stack", "libcpp.stack"),
            Map.entry("std::string", "libcpp.string"),
            Map.entry("std::unordered_map", "libcpp.unordered_map"),
            Map.entry("std::unordered_set", "libcpp.unordered_set"),
            Map.entry("std::unordered_multiset", "libcpp.unordered_set"),
            Map.entry("std::pair", "libcpp.pair"),
            Map.entry("std::vector", "libcpp.vector"),
            Map.entry("std::size_t", RESPELL_ONLY));

    private StandardTypes() {
    }

    public static boolean isBuiltin(String name) {
        return BUILTINS.contains(name);
    }

    /**
     * The Cython module declaring a standard type.
     *
     * @param qualifiedName The C++ qualified name, e.g. {@code std::vector}.
     * @return The module, {@link #RESPELL_ONLY} for names that need no import, or empty
     *         for non-standard types.
     */
    public static Optional<String> moduleOf(String qualifiedName) {
        return Optional.ofNullable(MODULES.get(qualifiedName));
    }

    public static boolean isStandard(String qualifiedName) {
        return isBuiltin(qualifiedName) || MODULES.containsKey(qualifiedName);
    }
}
