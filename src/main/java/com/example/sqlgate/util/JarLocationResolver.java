package com.example.sqlgate.util;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.Optional;

/**
 * Locates files next to the packaged jar. Runs before logging is configured, so it must not log.
 */
public final class JarLocationResolver {

    private JarLocationResolver() {
    }

    /**
     * Directory holding the jar (or class directory) that {@code referenceClass} was loaded from.
     */
    public static Optional<Path> codeDirectory(Class<?> referenceClass) {
        CodeSource codeSource = referenceClass.getProtectionDomain().getCodeSource();
        URL location = codeSource == null ? null : codeSource.getLocation();
        if (location == null) {
            return Optional.empty();
        }
        Path path;
        try {
            path = Path.of(location.toURI());
        } catch (URISyntaxException | IllegalArgumentException | FileSystemNotFoundException e) {
            // nested or non-file code source
            return Optional.empty();
        }
        if (Files.isRegularFile(path)) {
            return Optional.ofNullable(path.getParent());
        }
        return Files.isDirectory(path) ? Optional.of(path) : Optional.empty();
    }

    /**
     * Path of {@code fileName} next to the jar holding {@code referenceClass}, or relative to the
     * working directory when the jar location cannot be determined.
     */
    public static Path resolveBesideJar(Class<?> referenceClass, String fileName) {
        return codeDirectory(referenceClass)
                .map(directory -> directory.resolve(fileName))
                .orElseGet(() -> Path.of(fileName));
    }
}
