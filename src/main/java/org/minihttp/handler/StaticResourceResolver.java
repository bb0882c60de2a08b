package org.minihttp.handler;

import org.minihttp.content.Content;
import org.minihttp.content.MimeTypes;
import org.minihttp.http.HttpMethod;
import org.minihttp.http.HttpRequest;
import org.minihttp.http.HttpResponse;
import org.minihttp.http.HttpStatus;
import org.minihttp.interfaces.ContentSource;
import org.minihttp.interfaces.ResourceResolver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Answers GET and HEAD from a {@link ContentSource}.
 * <ul>
 *   <li>found: 200 with {@code Content-Length} and {@code Content-Type}</li>
 *   <li>missing: 404, outside the root: 403, other methods: 405 with {@code Allow}</li>
 *   <li>any failure of the source or of this class: 500</li>
 * </ul>
 * A HEAD request gets the headers its GET would get and an empty body. Nothing is retried.
 */
public final class StaticResourceResolver implements ResourceResolver {

    static final String ALLOWED_METHODS = "GET, HEAD";

    private static final DateTimeFormatter HTTP_DATE =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US);

    private final ContentSource source;
    private final String serverName;
    private final Clock clock;

    public StaticResourceResolver(ContentSource source, String serverName) {
        this(source, serverName, Clock.systemUTC());
    }

    public StaticResourceResolver(ContentSource source, String serverName, Clock clock) {
        this.source = Objects.requireNonNull(source, "source");
        this.serverName = Objects.requireNonNull(serverName, "serverName");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public HttpResponse resolve(HttpRequest req) {
        HttpResponse res;
        try {
            res = dispatch(req);
        } catch (RuntimeException e) {
            System.err.println("[Resolver] failed on " + req.requestLine() + ": " + e);
            res = error(HttpStatus.INTERNAL_SERVER_ERROR, "500 Internal Server Error");
        }
        return req.method() == HttpMethod.HEAD ? withoutBody(res) : res;
    }

    private HttpResponse dispatch(HttpRequest req) {
        if (req.method() != HttpMethod.GET && req.method() != HttpMethod.HEAD) {
            return error(HttpStatus.METHOD_NOT_ALLOWED, "405 Method Not Allowed: " + req.method())
                    .toBuilder()
                    .header("Allow", ALLOWED_METHODS)
                    .build();
        }

        Optional<Content> found;
        try {
            found = source.lookup(req.path());
        } catch (AccessDeniedException e) {
            System.err.println("[Resolver] denied " + req.path() + ": " + e.getReason());
            return error(HttpStatus.FORBIDDEN, "403 Forbidden: " + req.path());
        } catch (IOException e) {
            System.err.println("[Resolver] lookup failed for " + req.path() + ": " + e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "500 Internal Server Error");
        }
        if (found.isEmpty()) {
            return error(HttpStatus.NOT_FOUND, "404 Not Found: " + req.path());
        }

        Content content = found.get();
        return baseHeaders(HttpStatus.OK)
                .header("Content-Length", String.valueOf(content.length()))
                .header("Content-Type", MimeTypes.forName(content.name()))
                .body(content.bytes())
                .build();
    }

    private HttpResponse error(HttpStatus status, String text) {
        byte[] body = (text + "\n").getBytes(StandardCharsets.UTF_8);
        return baseHeaders(status)
                .header("Content-Length", String.valueOf(body.length))
                .header("Content-Type", "text/plain; charset=utf-8")
                .body(body)
                .build();
    }

    private HttpResponse.Builder baseHeaders(HttpStatus status) {
        return HttpResponse.builder(status)
                .header("Server", serverName)
                .header("Date", HTTP_DATE.format(ZonedDateTime.now(clock).withZoneSameInstant(ZoneOffset.UTC)));
    }

    /** Drops the body but keeps the length the body would have had. */
    private static HttpResponse withoutBody(HttpResponse res) {
        return res.toBuilder()
                .header("Content-Length", String.valueOf(res.bodyLength()))
                .body(new byte[0])
                .build();
    }
}
