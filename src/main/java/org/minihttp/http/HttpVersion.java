package org.minihttp.http;

public enum HttpVersion {
    HTTP_1_0("HTTP/1.0", false),
    HTTP_1_1("HTTP/1.1", true);

    private final String token;
    private final boolean keepAliveByDefault;

    HttpVersion(String token, boolean keepAliveByDefault) {
        this.token = token;
        this.keepAliveByDefault = keepAliveByDefault;
    }

    public String token() { return token; }

    /** HTTP/1.1 connections are persistent unless closed explicitly; HTTP/1.0 ones are not. */
    public boolean keepAliveByDefault() { return keepAliveByDefault; }

    /** @return the version for a protocol token such as {@code HTTP/1.1}, or {@code null}. */
    public static HttpVersion fromToken(String token) {
        for (HttpVersion v : values()) {
            if (v.token.equals(token)) return v;
        }
        return null;
    }

    @Override
    public String toString() { return token; }
}
