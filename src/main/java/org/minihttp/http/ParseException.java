package org.minihttp.http;

/**
 * Raised when bytes on the wire do not form an acceptable HTTP message.
 * The connection that produced it is answered with {@link #status()} and closed.
 */
public class ParseException extends Exception {

    public enum Kind {
        MALFORMED_LINE,
        MALFORMED_HEADER,
        TOO_LARGE
    }

    private final Kind kind;
    private final HttpStatus status;

    public ParseException(Kind kind, String message) {
        this(kind, kind == Kind.TOO_LARGE ? HttpStatus.REQUEST_HEADER_FIELDS_TOO_LARGE : HttpStatus.BAD_REQUEST, message);
    }

    public ParseException(Kind kind, HttpStatus status, String message) {
        super(message);
        this.kind = kind;
        this.status = status;
    }

    public Kind kind() { return kind; }

    /** Status to answer the offending request with. */
    public HttpStatus status() { return status; }
}
