package com.chemked.data.testing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class TestResources {

    private TestResources() {}

    private static final Path CLASSPATH_CACHE_DIR = initClasspathCacheDir();

    /**
     * Extract a class path resource to a file. Resources of the same directory land in the same
     * directory, so documents can refer to their sibling history files.
     */
    public static Path resolveResource(String resourceName) throws IOException {
        String normalized = resourceName.startsWith("/") ? resourceName.substring(1) : resourceName;
        return copyResource(normalized, CLASSPATH_CACHE_DIR.resolve(normalized).normalize());
    }

    /** Copy a class path resource into {@code directory}, keeping only its file name. */
    public static Path copyToDirectory(String resourceName, Path directory) throws IOException {
        String fileName = resourceName.substring(resourceName.lastIndexOf('/') + 1);
        return copyResource(resourceName, directory.resolve(fileName));
    }

    public static String readResource(String resourceName) throws IOException {
        try (InputStream in = open(resourceName)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static Path initClasspathCacheDir() {
        try {
            Path dir = Files.createTempDirectory("chemked_test_resources");
            dir.toFile().deleteOnExit();
            return dir;
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to create classpath cache directory", ex);
        }
    }

    private static Path copyResource(String resourceName, Path target) throws IOException {
        try (InputStream in = open(resourceName)) {
            Files.createDirectories(target.getParent());
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            target.toFile().deleteOnExit();
            return target;
        }
    }

    private static InputStream open(String resourceName) throws IOException {
        InputStream in = TestResources.class.getClassLoader().getResourceAsStream(resourceName);
        if (in == null) {
            throw new IOException("Missing classpath resource: " + resourceName);
        }
        return in;
    }
}
