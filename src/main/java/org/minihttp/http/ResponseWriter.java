package org.minihttp.http;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Serializes a {@link HttpResponse} to HTTP/1.1 wire format.
 * <p>
 * Every response carries {@code Content-Length} and a {@code Connection} header that
 * reflects the keep-alive decision; nothing is chunked.
 */
public final class ResponseWriter {

    private ResponseWriter() {}

    /**
     * Writes status line, headers in insertion order, a blank line and the body.
     * <p>
     * A {@code Content-Length} already on the response is kept (a HEAD response declares
     * the length of the body it omits); otherwise the body length is used. A
     * {@code Connection} header on the response has its value replaced in place,
     * otherwise one is appended.
     *
     * @return number of bytes written
     * @throws IOException if the stream fails; the caller should drop the connection
     */
    public static long write(HttpResponse res, boolean keepAlive, OutputStream out) throws IOException {
        byte[] head = head(res, keepAlive);
        byte[] body = res.body();
        out.write(head);
        out.write(body);
        out.flush();
        return (long) head.length + body.length;
    }

    /** @return status line and header block, including the terminating blank line. */
    static byte[] head(HttpResponse res, boolean keepAlive) {
        String connection = keepAlive ? "keep-alive" : "close";
        StringBuilder sb = new StringBuilder(256);
        sb.append(HttpVersion.HTTP_1_1.token()).append(' ')
          .append(res.status().code()).append(' ')
          .append(res.status().reason()).append("\r\n");

        boolean sawLength = false;
        boolean sawConnection = false;
        for (Map.Entry<String, String> e : res.headers()) {
            String value = e.getValue();
            if ("Content-Length".equalsIgnoreCase(e.getKey())) {
                sawLength = true;
            } else if ("Connection".equalsIgnoreCase(e.getKey())) {
                sawConnection = true;
                value = connection;
            }
            sb.append(e.getKey()).append(": ").append(value).append("\r\n");
        }
        if (!sawLength) sb.append("Content-Length: ").append(res.bodyLength()).append("\r\n");
        if (!sawConnection) sb.append("Connection: ").append(connection).append("\r\n");
        sb.append("\r\n");
        return sb.toString().getBytes(StandardCharsets.ISO_8859_1);
    }
}
