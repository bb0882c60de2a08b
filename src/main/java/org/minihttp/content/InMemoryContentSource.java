package org.minihttp.content;

import org.minihttp.interfaces.ContentSource;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed set of resources held in memory, keyed by normalized path. Immutable after
 * construction, so safe for any number of reader threads.
 */
public final class InMemoryContentSource implements ContentSource {

    private final Map<String, byte[]> resources;

    public InMemoryContentSource(Map<String, byte[]> resources) {
        Map<String, byte[]> copy = new HashMap<>();
        for (Map.Entry<String, byte[]> e : resources.entrySet()) {
            String key = e.getKey().startsWith("/") ? e.getKey() : "/" + e.getKey();
            copy.put(key, e.getValue().clone());
        }
        this.resources = Map.copyOf(copy);
    }

    @Override
    public Optional<Content> lookup(String normalizedPath) {
        String key = normalizedPath.endsWith("/")
                ? normalizedPath + FileSystemContentSource.INDEX_FILE
                : normalizedPath;
        byte[] bytes = resources.get(key);
        if (bytes == null && !normalizedPath.endsWith("/")) {
            key = normalizedPath + "/" + FileSystemContentSource.INDEX_FILE;
            bytes = resources.get(key);
        }
        if (bytes == null) return Optional.empty();
        return Optional.of(new Content(key.substring(key.lastIndexOf('/') + 1), bytes.clone()));
    }

    public int size() { return resources.size(); }
}
