package org.minihttp.http;

import java.util.Arrays;
import java.util.Objects;

/**
 * A parsed request. Immutable: headers are a read-only snapshot and the body is
 * copied in and out.
 */
public final class HttpRequest {
    private final HttpMethod method;
    private final String target;
    private final String path;
    private final String query;
    private final HttpVersion version;
    private final Headers headers;
    private final byte[] body;

    public HttpRequest(HttpMethod method, String target, String path, String query,
                       HttpVersion version, Headers headers, byte[] body) {
        this.method = Objects.requireNonNull(method, "method");
        this.target = Objects.requireNonNull(target, "target");
        this.path = Objects.requireNonNull(path, "path");
        this.query = query == null ? "" : query;
        this.version = Objects.requireNonNull(version, "version");
        this.headers = headers == null ? new Headers().readOnly() : headers.readOnly();
        this.body = body == null ? new byte[0] : body.clone();
    }

    public HttpMethod method() { return method; }

    /** The request target exactly as it appeared on the request line. */
    public String target() { return target; }

    /** Percent-decoded, dot-segment free path; always starts with '/'. */
    public String path() { return path; }

    /** Text after '?' in the target, still encoded; empty when absent. */
    public String query() { return query; }

    public HttpVersion version() { return version; }

    public Headers headers() { return headers; }

    public String header(String name) { return headers.get(name); }

    public byte[] body() { return body.clone(); }

    public int bodyLength() { return body.length; }

    /**
     * Whether the client asked for the connection to stay open after this exchange.
     * HTTP/1.1 stays open unless {@code Connection: close}; HTTP/1.0 closes unless
     * {@code Connection: keep-alive}.
     */
    public boolean wantsKeepAlive() {
        if (version.keepAliveByDefault()) {
            return !headers.hasToken("Connection", "close");
        }
        return headers.hasToken("Connection", "keep-alive");
    }

    /** @return the request line as received, e.g. {@code GET /index.html HTTP/1.1}. */
    public String requestLine() {
        return method + " " + target + " " + version;
    }

    @Override
    public String toString() {
        return "HttpRequest{" + requestLine() + ", headers=" + headers + ", body=" + body.length + "B}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HttpRequest)) return false;
        HttpRequest r = (HttpRequest) o;
        return method == r.method && target.equals(r.target) && path.equals(r.path)
                && query.equals(r.query) && version == r.version
                && headers.equals(r.headers) && Arrays.equals(body, r.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, target, version, headers) * 31 + Arrays.hashCode(body);
    }
}
