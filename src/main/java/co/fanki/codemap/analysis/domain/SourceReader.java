package co.fanki.codemap.analysis.domain;

import co.fanki.codemap.shared.Preconditions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads source files from disk.
 *
 * <p>Content is decoded as UTF-8; undecodable bytes are replaced with the
 * Unicode replacement character instead of failing the read.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SourceReader {

    private SourceReader() {
    }

    /**
     * Reads a file that lives under a project root.
     *
     * @param file the file to read
     * @param projectRoot the root the file path is made relative to
     * @return the source file
     * @throws IOException if the file cannot be read
     */
    public static SourceFile read(final Path file, final Path projectRoot)
            throws IOException {
        Preconditions.requireNonNull(file, "File is required");
        Preconditions.requireNonNull(projectRoot, "Project root is required");

        final byte[] bytes = Files.readAllBytes(file);
        return new SourceFile(relativePath(file, projectRoot),
                new String(bytes, StandardCharsets.UTF_8));
    }

    /**
     * Computes the forward-slash path of a file relative to a root.
     *
     * @param file the file
     * @param projectRoot the root
     * @return the relative path, e.g. {@code app/routes/orders.py}
     */
    public static String relativePath(final Path file, final Path projectRoot) {
        final Path normalizedRoot = projectRoot.toAbsolutePath().normalize();
        final Path normalizedFile = file.toAbsolutePath().normalize();
        Preconditions.require(normalizedFile.startsWith(normalizedRoot),
                "File " + file + " is not under " + projectRoot);
        return normalizedRoot.relativize(normalizedFile).toString()
                .replace('\\', '/');
    }

}
