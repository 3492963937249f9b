package ai.hclindex.scan;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Finds configuration files below a directory:
 * - *.tf
 * - *.tf.json
 * Skips provider caches and VCS/tooling directories.
 */
public final class ConfigFileFinder {

    public static final Set<String> IGNORED_DIRS = Set.of(".terraform", ".git", "node_modules", "__pycache__");

    private final Path root;

    public ConfigFileFinder(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public List<Path> findAll() throws IOException {
        final List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return files;
        }

        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                final String name = dir.getFileName() != null ? dir.getFileName().toString() : "";
                if (!dir.equals(root) && IGNORED_DIRS.contains(name)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && isConfigFile(file)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });

        Collections.sort(files);
        return files;
    }

    public static boolean isConfigFile(Path file) {
        final String name = file.getFileName() != null ? file.getFileName().toString() : "";
        return name.endsWith(".tf") || name.endsWith(".tf.json");
    }

    public static boolean isJsonConfig(Path file) {
        final String name = file.getFileName() != null ? file.getFileName().toString() : "";
        return name.endsWith(".tf.json");
    }
}
