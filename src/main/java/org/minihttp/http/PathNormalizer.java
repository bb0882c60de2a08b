package org.minihttp.http;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Turns the path part of a request target into the key content sources are looked
 * up by: percent-decoded, without {@code .} and {@code ..} segments, never above the root.
 */
public final class PathNormalizer {

    private PathNormalizer() {}

    /**
     * Decodes {@code %XX} escapes as UTF-8. A '+' is left alone (it only means space in
     * form-encoded queries, not in paths).
     *
     * @throws IllegalArgumentException on a truncated or non-hex escape, or a decoded NUL
     */
    public static String decode(String raw) {
        if (raw.indexOf('%') < 0) {
            if (raw.indexOf('\0') >= 0) throw new IllegalArgumentException("NUL in path");
            return raw;
        }
        ByteArrayOutputStream buf = new ByteArrayOutputStream(raw.length());
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c == '%') {
                if (i + 2 >= raw.length()) {
                    throw new IllegalArgumentException("truncated escape at " + i);
                }
                int hi = Character.digit(raw.charAt(i + 1), 16);
                int lo = Character.digit(raw.charAt(i + 2), 16);
                if (hi < 0 || lo < 0) throw new IllegalArgumentException("bad escape at " + i);
                int b = (hi << 4) | lo;
                if (b == 0) throw new IllegalArgumentException("NUL in path");
                buf.write(b);
                i += 3;
            } else {
                int cp = raw.codePointAt(i);
                if (cp == 0) throw new IllegalArgumentException("NUL in path");
                byte[] enc = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8);
                buf.write(enc, 0, enc.length);
                i += Character.charCount(cp);
            }
        }
        return buf.toString(StandardCharsets.UTF_8);
    }

    /**
     * Removes empty, {@code .} and {@code ..} segments. {@code ..} at the root stays at
     * the root. A trailing slash survives, and a path ending in a dot segment gets one
     * ({@code /a/b/..} becomes {@code /a/}).
     */
    public static String normalize(String decodedPath) {
        Deque<String> segments = new ArrayDeque<>();
        String[] parts = decodedPath.split("/", -1);
        boolean directory = false;
        for (String s : parts) {
            if (s.isEmpty() || ".".equals(s)) {
                directory = true;
                continue;
            }
            if ("..".equals(s)) {
                segments.pollLast();
                directory = true;
                continue;
            }
            segments.addLast(s);
            directory = false;
        }
        if (segments.isEmpty()) return "/";
        String joined = "/" + String.join("/", segments);
        return directory ? joined + "/" : joined;
    }
}
