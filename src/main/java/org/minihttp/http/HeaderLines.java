package org.minihttp.http;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Line splitting and header-field parsing shared by the request and response parsers.
 */
final class HeaderLines {

    private HeaderLines() {}

    /**
     * Splits {@code buf[from, to)} into lines on LF, dropping one trailing CR per line.
     * The empty line that terminates a head is not returned.
     */
    static List<String> split(byte[] buf, int from, int to) {
        List<String> lines = new ArrayList<>();
        int lineStart = from;
        for (int i = from; i < to; i++) {
            if (buf[i] != '\n') continue;
            int lineEnd = i;
            if (lineEnd > lineStart && buf[lineEnd - 1] == '\r') lineEnd--;
            lines.add(new String(buf, lineStart, lineEnd - lineStart, StandardCharsets.ISO_8859_1));
            lineStart = i + 1;
        }
        if (lineStart < to) {
            lines.add(new String(buf, lineStart, to - lineStart, StandardCharsets.ISO_8859_1));
        }
        // drop the terminating blank line(s) of the head
        while (lines.size() > 1 && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    /**
     * @return offset just past the blank line ending the head that starts at {@code from},
     *         or -1 if it has not arrived yet. An empty first line ends the head at once.
     */
    static int findHeadEnd(byte[] buf, int from, int to) {
        int lineStart = from;
        for (int i = from; i < to; i++) {
            if (buf[i] != '\n') continue;
            int len = i - lineStart;
            if (len == 0 || (len == 1 && buf[lineStart] == '\r')) return i + 1;
            lineStart = i + 1;
        }
        return -1;
    }

    /** Parses one {@code Name: value} line into {@code into}. */
    static void parseField(String line, Headers into, DuplicateHeaderPolicy policy) throws ParseException {
        if (line.startsWith(" ") || line.startsWith("\t")) {
            throw new ParseException(ParseException.Kind.MALFORMED_HEADER, "folded header line: " + line);
        }
        int colon = line.indexOf(':');
        if (colon < 0) {
            throw new ParseException(ParseException.Kind.MALFORMED_HEADER, "header line without ':': " + line);
        }
        String name = line.substring(0, colon);
        if (name.isEmpty() || !isToken(name)) {
            throw new ParseException(ParseException.Kind.MALFORMED_HEADER, "bad header name: '" + name + "'");
        }
        String value = line.substring(colon + 1).trim();

        if ("content-length".equalsIgnoreCase(name)) {
            String seen = into.get(name);
            if (seen != null && !seen.equals(value)) {
                throw new ParseException(ParseException.Kind.MALFORMED_HEADER,
                        "conflicting Content-Length values: " + seen + " / " + value);
            }
            into.set(name, value);
            return;
        }
        into.add(name, value, policy);
    }

    /**
     * @return the declared body length, 0 when absent
     * @throws ParseException if the value is not a non-negative decimal number
     */
    static long contentLength(Headers headers) throws ParseException {
        String v = headers.get("Content-Length");
        if (v == null) return 0L;
        if (v.isEmpty() || v.length() > 18) {
            throw new ParseException(ParseException.Kind.MALFORMED_HEADER, "bad Content-Length: '" + v + "'");
        }
        for (int i = 0; i < v.length(); i++) {
            if (v.charAt(i) < '0' || v.charAt(i) > '9') {
                throw new ParseException(ParseException.Kind.MALFORMED_HEADER, "bad Content-Length: '" + v + "'");
            }
        }
        return Long.parseLong(v);
    }

    private static boolean isToken(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c <= ' ' || c >= 127 || "()<>@,;:\\\"/[]?={}".indexOf(c) >= 0) return false;
        }
        return true;
    }
}
