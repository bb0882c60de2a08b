package org.minihttp.content;

import org.minihttp.interfaces.ContentSource;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Serves files below a document root. A directory, or any path ending in '/', is
 * served through its {@code index.html}.
 * <p>
 * Files are read on every lookup; nothing is cached, so concurrent lookups share no
 * mutable state.
 */
public final class FileSystemContentSource implements ContentSource {

    public static final String INDEX_FILE = "index.html";

    private final Path root;

    /**
     * @param root existing directory; stored as its real path
     * @throws NotDirectoryException if {@code root} is not a directory
     */
    public FileSystemContentSource(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new NotDirectoryException(root.toString());
        }
        this.root = root.toRealPath();
    }

    public Path root() { return root; }

    @Override
    public Optional<Content> lookup(String normalizedPath) throws IOException {
        Path candidate;
        try {
            String relative = normalizedPath.startsWith("/") ? normalizedPath.substring(1) : normalizedPath;
            candidate = relative.isEmpty() ? root : root.resolve(relative).normalize();
        } catch (InvalidPathException e) {
            // names this file system cannot represent cannot exist under the root
            return Optional.empty();
        }
        if (!candidate.startsWith(root)) {
            throw new AccessDeniedException(normalizedPath, null, "outside document root");
        }
        if (normalizedPath.endsWith("/") || Files.isDirectory(candidate)) {
            candidate = candidate.resolve(INDEX_FILE);
        }
        if (!Files.isRegularFile(candidate)) {
            return Optional.empty();
        }

        try {
            Path real = candidate.toRealPath();
            if (!real.startsWith(root)) {
                throw new AccessDeniedException(normalizedPath, null, "link leads outside document root");
            }
            return Optional.of(new Content(candidate.getFileName().toString(), Files.readAllBytes(real)));
        } catch (NoSuchFileException e) {
            // removed between the check and the read
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return "FileSystemContentSource{" + root + "}";
    }
}
