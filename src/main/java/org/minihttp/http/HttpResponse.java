package org.minihttp.http;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A response ready for the {@link ResponseWriter}. Built once through {@link Builder}
 * and not changed afterwards.
 */
public final class HttpResponse {
    private final HttpStatus status;
    private final Headers headers;
    private final byte[] body;

    private HttpResponse(HttpStatus status, Headers headers, byte[] body) {
        this.status = status;
        this.headers = headers.readOnly();
        this.body = body;
    }

    public HttpStatus status() { return status; }
    public Headers headers() { return headers; }
    public String header(String name) { return headers.get(name); }
    public byte[] body() { return body.clone(); }
    public int bodyLength() { return body.length; }

    /** Body as UTF-8 text; convenient for diagnostics and tests. */
    public String bodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public static Builder builder(HttpStatus status) {
        return new Builder(status);
    }

    /** Copies status, headers and body into a new builder. */
    public Builder toBuilder() {
        Builder b = new Builder(status);
        b.headers = headers.copy();
        b.body = body;
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HttpResponse)) return false;
        HttpResponse r = (HttpResponse) o;
        return status == r.status && headers.equals(r.headers) && Arrays.equals(body, r.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, headers) * 31 + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "HttpResponse{" + status + ", headers=" + headers + ", body=" + body.length + "B}";
    }

    public static final class Builder {
        private HttpStatus status;
        private Headers headers = new Headers();
        private byte[] body = new byte[0];

        private Builder(HttpStatus status) {
            this.status = Objects.requireNonNull(status, "status");
        }

        public Builder status(HttpStatus status) {
            this.status = Objects.requireNonNull(status, "status");
            return this;
        }

        public Builder header(String name, String value) {
            headers.set(name, value);
            return this;
        }

        public Builder removeHeader(String name) {
            headers.remove(name);
            return this;
        }

        public Builder body(byte[] bytes) {
            this.body = bytes == null ? new byte[0] : bytes.clone();
            return this;
        }

        public Builder body(String text) {
            this.body = text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
            return this;
        }

        public HttpResponse build() {
            return new HttpResponse(status, headers, body);
        }
    }
}
