package org.pxdforge.generator.frontend.semantics;

import java.util.Set;

/**
 * Where a type is referenced from.
 *
 * @param namespace   Namespace of the referencing scope.
 * @param modulePath  Module the referencing scope is written to.
 * @param originFiles Files of the current unit whose declarations are generated.
 * @param restricted  Whether declarations outside the origin files were filtered out.
 * @param importAll   Whether types of sibling headers are imported rather than assumed.
 * @param layout      How modules are assigned.
 */
public record ReferenceSite(String namespace,
                            String modulePath,
                            Set<String> originFiles,
                            boolean restricted,
                            boolean importAll,
                            ModuleLayout layout) {

    public ReferenceSite {
        originFiles = Set.copyOf(originFiles);
    }

    public boolean isOrigin(String file) {
        return file != null && originFiles.contains(file);
    }
}
