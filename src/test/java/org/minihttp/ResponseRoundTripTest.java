package org.minihttp;

import org.minihttp.content.InMemoryContentSource;
import org.minihttp.handler.StaticResourceResolver;
import org.minihttp.http.HttpResponse;
import org.minihttp.http.HttpStatus;
import org.minihttp.http.ParseException;
import org.minihttp.http.RequestParser;
import org.minihttp.http.ResponseParser;
import org.minihttp.http.ResponseWriter;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResponseRoundTripTest {

    private static byte[] wire(HttpResponse res, boolean keepAlive) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ResponseWriter.write(res, keepAlive, out);
        return out.toByteArray();
    }

    @Test
    void writtenResponseParsesBackIdentical() throws Exception {
        byte[] body = new byte[300];
        for (int i = 0; i < body.length; i++) body[i] = (byte) (i * 7);
        HttpResponse original = HttpResponse.builder(HttpStatus.OK)
                .header("Server", "minihttp")
                .header("Content-Length", String.valueOf(body.length))
                .header("Content-Type", "application/octet-stream")
                .header("Connection", "keep-alive")
                .body(body)
                .build();

        HttpResponse parsed = ResponseParser.parse(new ByteArrayInputStream(wire(original, true)));
        assertEquals(original, parsed);
    }

    @Test
    void resolverResponseSurvivesRoundTripApartFromConnection() throws Exception {
        StaticResourceResolver resolver = new StaticResourceResolver(
                new InMemoryContentSource(Map.of("/a.txt", "alpha".getBytes(StandardCharsets.UTF_8))), "t");
        RequestParser p = new RequestParser();
        p.feed("GET /nope HTTP/1.1\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
        HttpResponse notFound = resolver.resolve(p.next());

        HttpResponse parsed = ResponseParser.parse(new ByteArrayInputStream(wire(notFound, false)));
        assertEquals("close", parsed.header("Connection"));
        assertEquals(notFound, parsed.toBuilder().removeHeader("Connection").build());
    }

    @Test
    void consecutiveResponsesOnOneStream() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ResponseWriter.write(HttpResponse.builder(HttpStatus.OK).body("one").build(), true, out);
        ResponseWriter.write(HttpResponse.builder(HttpStatus.NOT_FOUND).body("two!").build(), false, out);

        ByteArrayInputStream in = new ByteArrayInputStream(out.toByteArray());
        HttpResponse first = ResponseParser.parse(in);
        HttpResponse second = ResponseParser.parse(in);
        assertEquals(HttpStatus.OK, first.status());
        assertEquals("one", first.bodyText());
        assertEquals(HttpStatus.NOT_FOUND, second.status());
        assertEquals("two!", second.bodyText());
        assertEquals(-1, in.read());
    }

    @Test
    void headResponseParsedWithoutBody() throws Exception {
        HttpResponse head = HttpResponse.builder(HttpStatus.OK).header("Content-Length", "5").build();
        HttpResponse parsed = ResponseParser.parse(new ByteArrayInputStream(wire(head, true)), true);
        assertEquals("5", parsed.header("Content-Length"));
        assertEquals(0, parsed.bodyLength());
    }

    @Test
    void truncatedInputReported() throws Exception {
        byte[] full = wire(HttpResponse.builder(HttpStatus.OK).body("complete").build(), true);
        byte[] cut = java.util.Arrays.copyOf(full, full.length - 3);
        assertThrows(EOFException.class, () -> ResponseParser.parse(new ByteArrayInputStream(cut)));
        assertThrows(EOFException.class, () -> ResponseParser.parse(new ByteArrayInputStream(new byte[0])));
    }

    @Test
    void garbageStatusLineRejected() {
        byte[] junk = "HTTX 200 OK\r\n\r\n".getBytes(StandardCharsets.US_ASCII);
        assertThrows(ParseException.class, () -> ResponseParser.parse(new ByteArrayInputStream(junk)));
        byte[] weird = "HTTP/1.1 299 Odd\r\n\r\n".getBytes(StandardCharsets.US_ASCII);
        assertThrows(ParseException.class, () -> ResponseParser.parse(new ByteArrayInputStream(weird)));
    }
}
