package org.minihttp.http;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads one {@code Content-Length} framed HTTP/1.x response from a stream, leaving the
 * stream positioned at the next response. Used to read back what {@link ResponseWriter}
 * produced, e.g. by test clients on a kept-alive connection.
 */
public final class ResponseParser {

    private static final int MAX_HEAD_BYTES = 64 * 1024;

    private ResponseParser() {}

    public static HttpResponse parse(InputStream in) throws IOException, ParseException {
        return parse(in, false);
    }

    /**
     * @param bodyless true when the response answers a HEAD request, so its
     *                 {@code Content-Length} describes a body that is not sent
     * @throws EOFException if the stream ends before the response is complete
     */
    public static HttpResponse parse(InputStream in, boolean bodyless) throws IOException, ParseException {
        byte[] head = readHead(in);
        List<String> lines = HeaderLines.split(head, 0, head.length);

        String statusLine = lines.get(0);
        String[] parts = statusLine.split(" ", 3);
        if (parts.length < 2 || HttpVersion.fromToken(parts[0]) == null) {
            throw new ParseException(ParseException.Kind.MALFORMED_LINE, "bad status line: '" + statusLine + "'");
        }
        HttpStatus status;
        try {
            status = HttpStatus.fromCode(Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            status = null;
        }
        if (status == null) {
            throw new ParseException(ParseException.Kind.MALFORMED_LINE, "unsupported status: '" + parts[1] + "'");
        }

        HttpResponse.Builder b = HttpResponse.builder(status);
        Headers headers = new Headers();
        for (int i = 1; i < lines.size(); i++) {
            HeaderLines.parseField(lines.get(i), headers, DuplicateHeaderPolicy.JOIN);
        }
        for (var e : headers) {
            b.header(e.getKey(), e.getValue());
        }

        long length = bodyless ? 0 : HeaderLines.contentLength(headers);
        if (length > Integer.MAX_VALUE) {
            throw new ParseException(ParseException.Kind.TOO_LARGE, "response body too large: " + length);
        }
        byte[] body = in.readNBytes((int) length);
        if (body.length < length) {
            throw new EOFException("body truncated: got " + body.length + " of " + length + " bytes");
        }
        return b.body(body).build();
    }

    private static byte[] readHead(InputStream in) throws IOException, ParseException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(256);
        int prev = -1;
        int prevPrev = -1;
        int b;
        while ((b = in.read()) != -1) {
            buf.write(b);
            // "\n\n" or "\n\r\n" closes the head
            if (b == '\n' && (prev == '\n' || (prev == '\r' && prevPrev == '\n'))) {
                return buf.toByteArray();
            }
            if (buf.size() > MAX_HEAD_BYTES) {
                throw new ParseException(ParseException.Kind.TOO_LARGE, "response head exceeds " + MAX_HEAD_BYTES + " bytes");
            }
            prevPrev = prev;
            prev = b;
        }
        throw new EOFException(buf.size() == 0 ? "no response" : "response head truncated");
    }
}
