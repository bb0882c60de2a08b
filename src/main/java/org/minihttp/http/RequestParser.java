package org.minihttp.http;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Incremental HTTP/1.x request parser.
 * <p>
 * Bytes are handed in with {@link #feed(byte[], int, int)} as they arrive; {@link #next()}
 * returns a request once its head and {@code Content-Length} body are complete. Bytes past
 * the end of a request stay buffered for the following call. One instance belongs to one
 * connection and is not thread-safe.
 */
public final class RequestParser {

    public static final int DEFAULT_MAX_HEAD_BYTES = 8192;
    public static final long DEFAULT_MAX_BODY_BYTES = 1L << 20;

    private final int maxHeadBytes;
    private final long maxBodyBytes;
    private final DuplicateHeaderPolicy duplicatePolicy;

    private byte[] buf = new byte[1024];
    private int start;
    private int end;

    // request line checked as soon as it is complete, before the headers arrive
    private RequestLine requestLine;
    // head already parsed, waiting for the body bytes
    private PendingHead pending;

    private record RequestLine(HttpMethod method, String target, String path, String query, HttpVersion version) {}

    private record PendingHead(RequestLine line, Headers headers, int contentLength) {}

    public RequestParser() {
        this(DEFAULT_MAX_HEAD_BYTES, DEFAULT_MAX_BODY_BYTES, DuplicateHeaderPolicy.JOIN);
    }

    public RequestParser(int maxHeadBytes, long maxBodyBytes, DuplicateHeaderPolicy duplicatePolicy) {
        if (maxHeadBytes <= 0) throw new IllegalArgumentException("maxHeadBytes must be > 0");
        if (maxBodyBytes < 0) throw new IllegalArgumentException("maxBodyBytes must be >= 0");
        this.maxHeadBytes = maxHeadBytes;
        this.maxBodyBytes = Math.min(maxBodyBytes, Integer.MAX_VALUE - 8);
        this.duplicatePolicy = duplicatePolicy;
    }

    /** Appends received bytes. */
    public void feed(byte[] data, int off, int len) {
        if (len <= 0) return;
        if (end + len > buf.length) {
            if (start > 0) {
                System.arraycopy(buf, start, buf, 0, end - start);
                end -= start;
                start = 0;
            }
            if (end + len > buf.length) {
                buf = Arrays.copyOf(buf, Math.max(buf.length * 2, end + len));
            }
        }
        System.arraycopy(data, off, buf, end, len);
        end += len;
    }

    public void feed(byte[] data) {
        feed(data, 0, data.length);
    }

    /** @return bytes received but not yet consumed by a returned request. */
    public int buffered() {
        return end - start;
    }

    /** @return true when no partial request is held, i.e. the connection is between requests. */
    public boolean isIdle() {
        return pending == null && start == end;
    }

    /**
     * @return the next complete request, or {@code null} if more bytes are needed
     * @throws ParseException if the buffered bytes cannot be a valid request; the parser
     *                        should not be used afterwards
     */
    public HttpRequest next() throws ParseException {
        if (pending == null) {
            if (requestLine == null) {
                skipLeadingEmptyLines();
                int lf = indexOf('\n', start, end);
                if (lf >= 0) {
                    requestLine = parseRequestLine(HeaderLines.split(buf, start, lf + 1).get(0));
                } else if (end - start > maxHeadBytes) {
                    throw new ParseException(ParseException.Kind.TOO_LARGE,
                            "request line exceeds " + maxHeadBytes + " bytes");
                }
            }
            int headEnd = HeaderLines.findHeadEnd(buf, start, end);
            if (headEnd < 0) {
                if (end - start > maxHeadBytes) {
                    throw new ParseException(ParseException.Kind.TOO_LARGE,
                            "request head exceeds " + maxHeadBytes + " bytes");
                }
                return null;
            }
            if (headEnd - start > maxHeadBytes) {
                throw new ParseException(ParseException.Kind.TOO_LARGE,
                        "request head exceeds " + maxHeadBytes + " bytes");
            }
            pending = parseHead(requestLine, HeaderLines.split(buf, start, headEnd));
            requestLine = null;
            start = headEnd;
        }

        if (end - start < pending.contentLength()) return null;

        byte[] body = Arrays.copyOfRange(buf, start, start + pending.contentLength());
        start += pending.contentLength();
        if (start == end) {
            start = 0;
            end = 0;
        }
        PendingHead h = pending;
        pending = null;
        RequestLine l = h.line();
        return new HttpRequest(l.method(), l.target(), l.path(), l.query(), l.version(), h.headers(), body);
    }

    // a client may send a stray CRLF after a body; empty lines before a request line are ignored
    private void skipLeadingEmptyLines() {
        while (start < end && (buf[start] == '\r' || buf[start] == '\n')) start++;
        if (start == end) {
            start = 0;
            end = 0;
        }
    }

    private static RequestLine parseRequestLine(String raw) throws ParseException {
        // re-read as UTF-8 so raw non-ASCII path bytes survive
        String requestLine = new String(raw.getBytes(StandardCharsets.ISO_8859_1), StandardCharsets.UTF_8);
        String[] tokens = requestLine.split(" ", -1);
        if (tokens.length != 3 || tokens[0].isEmpty() || tokens[1].isEmpty() || tokens[2].isEmpty()) {
            throw malformedLine("expected 'METHOD target VERSION', got '" + requestLine + "'");
        }
        HttpMethod method = HttpMethod.fromToken(tokens[0]);
        if (method == null) throw malformedLine("unknown method '" + tokens[0] + "'");
        HttpVersion version = HttpVersion.fromToken(tokens[2]);
        if (version == null) throw malformedLine("unsupported version '" + tokens[2] + "'");

        String target = tokens[1];
        String rawPath = originForm(target);
        String query = "";
        int hash = rawPath.indexOf('#');
        if (hash >= 0) rawPath = rawPath.substring(0, hash);
        int q = rawPath.indexOf('?');
        if (q >= 0) {
            query = rawPath.substring(q + 1);
            rawPath = rawPath.substring(0, q);
        }
        String path;
        try {
            path = PathNormalizer.normalize(PathNormalizer.decode(rawPath));
        } catch (IllegalArgumentException e) {
            throw malformedLine("bad request target '" + target + "': " + e.getMessage());
        }
        return new RequestLine(method, target, path, query, version);
    }

    private PendingHead parseHead(RequestLine line, List<String> lines) throws ParseException {
        Headers headers = new Headers();
        for (int i = 1; i < lines.size(); i++) {
            HeaderLines.parseField(lines.get(i), headers, duplicatePolicy);
        }
        if (headers.contains("Transfer-Encoding")) {
            throw new ParseException(ParseException.Kind.MALFORMED_HEADER,
                    "Transfer-Encoding request bodies are not supported");
        }
        long contentLength = HeaderLines.contentLength(headers);
        if (contentLength > maxBodyBytes) {
            throw new ParseException(ParseException.Kind.TOO_LARGE, HttpStatus.PAYLOAD_TOO_LARGE,
                    "body of " + contentLength + " bytes exceeds " + maxBodyBytes);
        }
        return new PendingHead(line, headers, (int) contentLength);
    }

    private int indexOf(char c, int from, int to) {
        for (int i = from; i < to; i++) {
            if (buf[i] == c) return i;
        }
        return -1;
    }

    /** Strips scheme and authority from an absolute-form target; origin form passes through. */
    private static String originForm(String target) throws ParseException {
        if (target.startsWith("/")) return target;
        int scheme = target.indexOf("://");
        if (scheme > 0) {
            String s = target.substring(0, scheme).toLowerCase(Locale.ROOT);
            if (s.equals("http") || s.equals("https")) {
                int i = scheme + 3;
                while (i < target.length() && target.charAt(i) != '/' && target.charAt(i) != '?') i++;
                String rest = target.substring(i);
                return rest.startsWith("/") ? rest : "/" + rest;
            }
        }
        throw malformedLine("request target must be a path or an http URL: '" + target + "'");
    }

    private static ParseException malformedLine(String message) {
        return new ParseException(ParseException.Kind.MALFORMED_LINE, message);
    }
}
