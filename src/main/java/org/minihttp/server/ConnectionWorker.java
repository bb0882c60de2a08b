package org.minihttp.server;

import org.minihttp.config.ServerConfig;
import org.minihttp.http.HttpRequest;
import org.minihttp.http.HttpResponse;
import org.minihttp.http.HttpStatus;
import org.minihttp.http.ParseException;
import org.minihttp.interfaces.ResourceResolver;

import java.io.IOException;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Serves one accepted connection until it ends: read, parse, resolve, write, repeat
 * while keep-alive allows.
 * <p>
 * <b>Failure handling:</b>
 * <ul>
 *   <li>Malformed request: the parse error's status is sent with {@code Connection: close}
 *       and the connection is closed.</li>
 *   <li>Resolver failures arrive as error responses; the connection stays open if the
 *       request allows keep-alive.</li>
 *   <li>I/O failure, read timeout or end of stream: the socket is closed, nothing is sent.</li>
 * </ul>
 * Nothing escapes {@link #run()}, so one bad connection never affects another.
 */
public final class ConnectionWorker implements Runnable {

    private final Socket socket;
    private final ServerConfig config;
    private final ResourceResolver resolver;
    private final ServerStats stats;
    private final String tag;

    public ConnectionWorker(long id, Socket socket, ServerConfig config,
                            ResourceResolver resolver, ServerStats stats) {
        this.socket = socket;
        this.config = config;
        this.resolver = resolver;
        this.stats = stats;
        this.tag = "[Conn-" + id + "]";
    }

    @Override
    public void run() {
        Connection conn = null;
        try {
            conn = new Connection(socket, config);
            serve(conn);
        } catch (SocketTimeoutException e) {
            stats.ioError();
            if (config.isVerbose()) {
                boolean idle = conn != null && conn.betweenRequests();
                System.out.println(tag + " read timeout " + (idle ? "while idle" : "mid-request") + ", closing");
            }
        } catch (IOException e) {
            stats.ioError();
            if (!isExpectedDisconnect(e)) {
                System.err.println(tag + " I/O error: " + e.getMessage());
            }
        } catch (RuntimeException e) {
            System.err.println(tag + " unexpected failure: " + e);
        } finally {
            closeSocket();
            if (config.isVerbose() && conn != null) {
                System.out.println(tag + " closed after " + conn.requestsServed() + " request(s), "
                        + conn.bytesRead() + " B in, " + conn.bytesWritten() + " B out");
            }
            stats.connectionClosed();
        }
    }

    private void serve(Connection conn) throws IOException {
        while (true) {
            HttpRequest req;
            try {
                req = conn.nextRequest();
            } catch (ParseException e) {
                stats.parseError();
                if (config.isVerbose()) {
                    System.out.println(tag + " " + conn.remote() + " rejected (" + e.kind() + "): " + e.getMessage());
                }
                conn.send(errorResponse(e.status(), e.getMessage()), false);
                conn.lingeringClose();
                return;
            }

            if (req == null) {
                if (!conn.fill()) return; // peer closed
                continue;
            }

            HttpResponse res = resolve(req);
            boolean keepAlive = config.isKeepAlive() && req.wantsKeepAlive();
            long written = conn.send(res, keepAlive);
            stats.requestServed();
            if (config.isVerbose()) {
                System.out.println(tag + " " + conn.remote() + " \"" + req.requestLine() + "\" "
                        + res.status().code() + " " + written);
            }
            if (!keepAlive) {
                conn.lingeringClose();
                return;
            }
        }
    }

    private HttpResponse resolve(HttpRequest req) {
        try {
            return resolver.resolve(req);
        } catch (RuntimeException e) {
            System.err.println(tag + " resolver failed on \"" + req.requestLine() + "\": " + e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "unexpected server error");
        }
    }

    private HttpResponse errorResponse(HttpStatus status, String detail) {
        byte[] body = (status + ": " + detail + "\n").getBytes(StandardCharsets.UTF_8);
        return HttpResponse.builder(status)
                .header("Server", config.getServerName())
                .header("Content-Length", String.valueOf(body.length))
                .header("Content-Type", "text/plain; charset=utf-8")
                .body(body)
                .build();
    }

    private void closeSocket() {
        try {
            socket.close();
        } catch (IOException e) {
            System.err.println(tag + " close failed: " + e.getMessage());
        }
    }

    /** Peers going away mid-exchange are routine under load and not worth reporting. */
    static boolean isExpectedDisconnect(IOException e) {
        if (!(e instanceof SocketException)) return false;
        String msg = String.valueOf(e.getMessage()).toLowerCase(Locale.ROOT);
        return msg.contains("connection reset") || msg.contains("broken pipe")
                || msg.contains("socket write error") || msg.contains("software caused connection abort")
                || msg.contains("socket closed");
    }
}
