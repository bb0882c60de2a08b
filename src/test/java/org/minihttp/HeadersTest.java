package org.minihttp;

import org.minihttp.http.DuplicateHeaderPolicy;
import org.minihttp.http.Headers;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HeadersTest {

    @Test
    void lookupIgnoresCaseAndOrderIsInsertionOrder() {
        Headers h = new Headers()
                .set("Server", "s")
                .set("Date", "d")
                .set("content-type", "text/plain");

        assertEquals("text/plain", h.get("Content-Type"));
        assertTrue(h.contains("SERVER"));
        assertNull(h.get("missing"));
        assertNull(h.get(null));

        List<Map.Entry<String, String>> entries = h.entries();
        assertEquals("Server", entries.get(0).getKey());
        assertEquals("Date", entries.get(1).getKey());
        assertEquals("content-type", entries.get(2).getKey());
    }

    @Test
    void setKeepsPositionAndFirstSpelling() {
        Headers h = new Headers().set("Content-Length", "1").set("X", "y");
        h.set("CONTENT-LENGTH", "2");
        assertEquals("Content-Length", h.entries().get(0).getKey());
        assertEquals("2", h.entries().get(0).getValue());
    }

    @Test
    void addAppliesDuplicatePolicy() {
        Headers joined = new Headers()
                .add("Via", "a", DuplicateHeaderPolicy.JOIN)
                .add("via", "b", DuplicateHeaderPolicy.JOIN);
        assertEquals("a, b", joined.get("Via"));

        Headers last = new Headers()
                .add("Via", "a", DuplicateHeaderPolicy.LAST_WINS)
                .add("via", "b", DuplicateHeaderPolicy.LAST_WINS);
        assertEquals("b", last.get("Via"));
    }

    @Test
    void readOnlySnapshotIsDetached() {
        Headers h = new Headers().set("A", "1");
        Headers ro = h.readOnly();
        h.set("B", "2");

        assertEquals(1, ro.size());
        assertThrows(UnsupportedOperationException.class, () -> ro.set("C", "3"));
        assertThrows(UnsupportedOperationException.class, () -> ro.remove("A"));

        Headers copy = ro.copy().set("C", "3");
        assertEquals(2, copy.size());
    }

    @Test
    void hasTokenSplitsCommaSeparatedValues() {
        Headers h = new Headers().set("Connection", "Keep-Alive, Upgrade");
        assertTrue(h.hasToken("connection", "keep-alive"));
        assertTrue(h.hasToken("Connection", "upgrade"));
        assertFalse(h.hasToken("Connection", "close"));
        assertFalse(h.hasToken("Missing", "close"));
    }
}
