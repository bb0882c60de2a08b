package org.minihttp;

import org.minihttp.content.InMemoryContentSource;
import org.minihttp.handler.StaticResourceResolver;
import org.minihttp.http.HttpRequest;
import org.minihttp.http.HttpResponse;
import org.minihttp.http.HttpStatus;
import org.minihttp.http.ParseException;
import org.minihttp.http.RequestParser;
import org.minihttp.interfaces.ContentSource;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StaticResourceResolverTest {

    private static final byte[] INDEX = "<html><body>hello</body></html>".getBytes(StandardCharsets.UTF_8);
    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-01-02T03:04:05Z"), ZoneOffset.UTC);

    private final ContentSource content = new InMemoryContentSource(Map.of(
            "/index.html", INDEX,
            "/docs/index.html", INDEX,
            "/data.bin", new byte[]{1, 2, 3},
            "/style.css", "body{}".getBytes(StandardCharsets.UTF_8)));

    private final StaticResourceResolver resolver = new StaticResourceResolver(content, "minihttp-test", FIXED);

    private static HttpRequest request(String raw) throws ParseException {
        RequestParser p = new RequestParser();
        p.feed(raw.getBytes(StandardCharsets.ISO_8859_1));
        return p.next();
    }

    private HttpResponse resolve(String method, String path) throws ParseException {
        return resolver.resolve(request(method + " " + path + " HTTP/1.1\r\nHost: x\r\n\r\n"));
    }

    private static List<String> headerNames(HttpResponse res) {
        return res.headers().entries().stream().map(Map.Entry::getKey).collect(Collectors.toList());
    }

    @Test
    void getKnownPathReturnsStoredBytes() throws ParseException {
        HttpResponse res = resolve("GET", "/index.html");
        assertEquals(HttpStatus.OK, res.status());
        assertArrayEquals(INDEX, res.body());
        assertEquals(String.valueOf(INDEX.length), res.header("Content-Length"));
        assertEquals("text/html", res.header("Content-Type"));
        assertEquals("minihttp-test", res.header("Server"));
        assertEquals("Tue, 02 Jan 2024 03:04:05 GMT", res.header("Date"));
        assertEquals(List.of("Server", "Date", "Content-Length", "Content-Type"), headerNames(res));
    }

    @Test
    void headGetsGetHeadersAndNoBody() throws ParseException {
        HttpResponse get = resolve("GET", "/style.css");
        HttpResponse head = resolve("HEAD", "/style.css");
        assertEquals(HttpStatus.OK, head.status());
        assertEquals(get.headers(), head.headers());
        assertEquals(0, head.bodyLength());
        assertEquals("text/css", head.header("Content-Type"));
    }

    @Test
    void unknownPathIs404WithDiagnosticBody() throws ParseException {
        HttpResponse res = resolve("GET", "/missing");
        assertEquals(HttpStatus.NOT_FOUND, res.status());
        assertTrue(res.bodyLength() > 0);
        assertEquals(String.valueOf(res.bodyLength()), res.header("Content-Length"));
        assertTrue(res.bodyText().contains("/missing"), res.bodyText());
    }

    @Test
    void headOfUnknownPathHasLengthButNoBody() throws ParseException {
        HttpResponse get = resolve("GET", "/missing");
        HttpResponse head = resolve("HEAD", "/missing");
        assertEquals(HttpStatus.NOT_FOUND, head.status());
        assertEquals(0, head.bodyLength());
        assertEquals(String.valueOf(get.bodyLength()), head.header("Content-Length"));
    }

    @Test
    void unsupportedMethodsAre405() throws ParseException {
        for (String method : List.of("DELETE", "POST", "PUT", "OPTIONS", "PATCH")) {
            HttpResponse res = resolve(method, "/index.html");
            assertEquals(HttpStatus.METHOD_NOT_ALLOWED, res.status(), method);
            assertEquals("GET, HEAD", res.header("Allow"));
            assertEquals(String.valueOf(res.bodyLength()), res.header("Content-Length"));
        }
    }

    @Test
    void directoryPathServesIndex() throws ParseException {
        HttpResponse slash = resolve("GET", "/docs/");
        assertEquals(HttpStatus.OK, slash.status());
        assertEquals("text/html", slash.header("Content-Type"));
        assertArrayEquals(INDEX, slash.body());

        assertEquals(HttpStatus.OK, resolve("GET", "/docs").status());
        assertEquals(HttpStatus.OK, resolve("GET", "/").status());
    }

    @Test
    void unknownExtensionIsOctetStream() throws ParseException {
        assertEquals("application/octet-stream", resolve("GET", "/data.bin").header("Content-Type"));
    }

    @Test
    void sourceFailuresMapToStatuses() throws ParseException {
        ContentSource failing = path -> { throw new IOException("disk on fire"); };
        ContentSource denying = path -> { throw new AccessDeniedException(path); };
        ContentSource buggy = path -> { throw new IllegalStateException("bug"); };

        HttpRequest req = request("GET /x HTTP/1.1\r\n\r\n");
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, new StaticResourceResolver(failing, "t").resolve(req).status());
        assertEquals(HttpStatus.FORBIDDEN, new StaticResourceResolver(denying, "t").resolve(req).status());
        HttpResponse res = new StaticResourceResolver(buggy, "t").resolve(req);
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, res.status());
        assertFalse(res.bodyText().contains("bug"), "internal detail leaked: " + res.bodyText());
    }

    @Test
    void storedBytesComeBackUnchangedForManyResources() throws ParseException {
        Random rnd = new Random(42);
        Map<String, byte[]> stored = new java.util.HashMap<>();
        for (int i = 0; i < 50; i++) {
            byte[] b = new byte[rnd.nextInt(4096)];
            rnd.nextBytes(b);
            stored.put("/r" + i + ".dat", b);
        }
        StaticResourceResolver r = new StaticResourceResolver(new InMemoryContentSource(stored), "t", FIXED);
        for (Map.Entry<String, byte[]> e : stored.entrySet()) {
            HttpResponse res = r.resolve(request("GET " + e.getKey() + " HTTP/1.1\r\n\r\n"));
            assertEquals(HttpStatus.OK, res.status());
            assertArrayEquals(e.getValue(), res.body(), e.getKey());
            assertEquals(String.valueOf(e.getValue().length), res.header("Content-Length"));
        }
    }
}
