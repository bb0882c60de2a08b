package org.minihttp.server;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide counters shared by the listener and all connection workers.
 * <p>
 * Each counter is an {@link AtomicLong} changed by a single atomic operation at one
 * place: accepts by the listener, the rest by workers as they write responses, hit
 * parse errors, lose their socket, or exit. Readers see each counter on its own; a
 * {@link #snapshot()} is not an atomic cut across counters.
 */
public final class ServerStats {

    private static final Gson gson = new GsonBuilder().create();

    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong active = new AtomicLong();
    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong parseErrors = new AtomicLong();
    private final AtomicLong ioErrors = new AtomicLong();

    void connectionOpened() {
        accepted.incrementAndGet();
        active.incrementAndGet();
    }

    void connectionClosed() { active.decrementAndGet(); }

    void requestServed() { requests.incrementAndGet(); }

    void parseError() { parseErrors.incrementAndGet(); }

    void ioError() { ioErrors.incrementAndGet(); }

    public long connectionsAccepted() { return accepted.get(); }
    public long activeConnections() { return active.get(); }
    public long requestsServed() { return requests.get(); }
    public long parseErrors() { return parseErrors.get(); }
    public long ioErrors() { return ioErrors.get(); }

    public Map<String, Long> snapshot() {
        Map<String, Long> m = new LinkedHashMap<>();
        m.put("connectionsAccepted", accepted.get());
        m.put("activeConnections", active.get());
        m.put("requestsServed", requests.get());
        m.put("parseErrors", parseErrors.get());
        m.put("ioErrors", ioErrors.get());
        return m;
    }

    /** @return {@link #snapshot()} as a JSON object */
    public String toJson() {
        return gson.toJson(snapshot());
    }

    @Override
    public String toString() { return toJson(); }
}
