package org.minihttp.http;

/**
 * Request methods the parser recognizes. Anything else on the request line is a
 * malformed line; recognized methods the resolver does not serve get a 405.
 */
public enum HttpMethod {
    GET, HEAD, POST, PUT, DELETE, OPTIONS, TRACE, PATCH, CONNECT;

    /** @return the method for an exact (case-sensitive) token, or {@code null}. */
    public static HttpMethod fromToken(String token) {
        for (HttpMethod m : values()) {
            if (m.name().equals(token)) return m;
        }
        return null;
    }
}
