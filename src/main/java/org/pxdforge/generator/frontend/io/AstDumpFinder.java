package org.pxdforge.generator.frontend.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Locates AST dumps below a directory.
 */
public final class AstDumpFinder {

    public static final String DUMP_SUFFIX = ".ast.json";

    private AstDumpFinder() {
    }

    /**
     * @param directory The directory to walk.
     * @return Every regular {@code *.ast.json} file, sorted by path.
     * @throws IOException If the directory cannot be walked.
     */
    public static List<Path> find(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Not a directory: " + directory);
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(DUMP_SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
