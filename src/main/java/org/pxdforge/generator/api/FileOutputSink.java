package org.pxdforge.generator.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes modules below an output directory, creating package directories as needed.
 */
public class FileOutputSink implements IOutputSink {

    private static final Logger log = LoggerFactory.getLogger(FileOutputSink.class);

    private final Path root;

    public FileOutputSink(Path root) {
        this.root = root;
    }

    @Override
    public void write(String relativePath, String text) throws IOException {
        Path target = root.resolve(relativePath).normalize();
        if (!target.startsWith(root.normalize())) {
            throw new IOException("Refusing to write outside " + root + ": " + relativePath);
        }
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, text, StandardCharsets.UTF_8);
        log.info("Wrote {}", target);
    }
}
