package org.minihttp.interfaces;

import org.minihttp.content.Content;

import java.io.IOException;
import java.util.Optional;

/**
 * Read-only provider of static content keyed by normalized request path.
 * Implementations are shared by all connection threads and must allow concurrent lookups.
 */
public interface ContentSource {

    /**
     * @param normalizedPath a path starting with '/', free of dot segments
     * @return the content, or empty if nothing is stored under that path
     * @throws java.nio.file.AccessDeniedException if the path leads outside the source's root
     * @throws IOException if the content exists but cannot be read
     */
    Optional<Content> lookup(String normalizedPath) throws IOException;
}
