package org.minihttp.content;

import java.util.Objects;

/**
 * Bytes found by a content source.
 *
 * @param name  file name actually served (e.g. {@code index.html} for a directory); drives the content type
 * @param bytes the stored bytes
 */
public record Content(String name, byte[] bytes) {

    public Content {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(bytes, "bytes");
    }

    public int length() { return bytes.length; }
}
