package work.snakeunit.shared;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collection;
import java.util.Comparator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Copies pipeline files and directories into synthesized workspaces, preserving their
 * relative layout.
 */
public final class ContentStager {
    private ContentStager() {}

    /**
     * Copies every relative path in {@code contents} from {@code sourcePrefix} to the same
     * relative location under {@code targetPrefix}.
     *
     * @param label rule or category name used in error messages
     */
    public static void copyContents(Collection<Path> contents, Path sourcePrefix, Path targetPrefix, String label) {
        for (Path relative : contents) {
            if (relative.isAbsolute()) {
                throw new IllegalArgumentException(
                    "for \"" + label + "\", cannot stage absolute path \"" + relative + "\""
                );
            }
            Path source = sourcePrefix.resolve(relative);
            Path target = targetPrefix.resolve(relative);
            try {
                if (Files.isDirectory(source)) {
                    copyDirectory(source, target);
                } else if (Files.isRegularFile(source)) {
                    copyFile(source, target);
                } else {
                    throw new IllegalStateException(
                        "for \"" + label + "\", cannot find file or directory \"" + source + "\" to stage"
                    );
                }
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to copy \"" + source + "\" to \"" + target + "\"", ex);
            }
        }
    }

    public static void copyFile(Path source, Path target) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
    }

    public static void copyDirectory(Path source, Path target) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(target.resolve(source.relativize(dir)));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(
                    file,
                    target.resolve(source.relativize(file)),
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.COPY_ATTRIBUTES
                );
                return FileVisitResult.CONTINUE;
            }
        });
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.delete(path);
            }
        }
    }
}
