package org.pxdforge.generator.api;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class PackageLayoutTest {

    @Test
    void filesOf_writesPackagesAsInitModules() {
        Map<String, String> files = PackageLayout.filesOf(List.of("test", "A", "A.B", "A.B.C", "AB"));

        assertThat(files).containsExactly(
                Map.entry("test", "test.pxd"),
                Map.entry("A", "A/__init__.pxd"),
                Map.entry("A.B", "A/B/__init__.pxd"),
                Map.entry("A.B.C", "A/B/C.pxd"),
                Map.entry("AB", "AB.pxd"));
    }

    @Test
    void filesOf_headerModulesMirrorDirectories() {
        assertThat(PackageLayout.filesOf(List.of("lib.a", "lib.sub.c")))
                .containsEntry("lib.a", "lib/a.pxd")
                .containsEntry("lib.sub.c", "lib/sub/c.pxd");
    }
}
