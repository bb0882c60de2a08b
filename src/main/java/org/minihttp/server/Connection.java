package org.minihttp.server;

import org.minihttp.config.ServerConfig;
import org.minihttp.http.HttpRequest;
import org.minihttp.http.HttpResponse;
import org.minihttp.http.ParseException;
import org.minihttp.http.RequestParser;
import org.minihttp.http.ResponseWriter;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;

/**
 * One accepted socket and the state of the exchange on it. Owned by a single
 * {@link ConnectionWorker}; never touched by another thread.
 */
final class Connection {

    // how long a closing connection keeps reading so the peer sees our last response
    private static final int LINGER_MS = 1000;

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final RequestParser parser;
    private final byte[] readBuf;
    private final int readTimeoutMs;

    private long bytesRead;
    private long bytesWritten;
    private int requestsServed;

    Connection(Socket socket, ServerConfig config) throws IOException {
        this.socket = socket;
        this.readTimeoutMs = config.getReadTimeoutMs();
        socket.setSoTimeout(readTimeoutMs);
        socket.setTcpNoDelay(true);
        this.in = socket.getInputStream();
        this.out = new BufferedOutputStream(socket.getOutputStream(), 8192);
        this.parser = new RequestParser(config.getMaxHeadBytes(), config.getMaxBodyBytes(), config.getDuplicateHeaders());
        this.readBuf = new byte[config.getReadBufferSize()];
    }

    SocketAddress remote() { return socket.getRemoteSocketAddress(); }

    long bytesRead() { return bytesRead; }

    long bytesWritten() { return bytesWritten; }

    int requestsServed() { return requestsServed; }

    /** @return true while no partial request is buffered. */
    boolean betweenRequests() { return parser.isIdle(); }

    /** @return the next buffered request, or null if more bytes must be read first. */
    HttpRequest nextRequest() throws ParseException {
        return parser.next();
    }

    /**
     * Blocks for the next bytes from the peer.
     *
     * @return false on end of stream
     * @throws java.net.SocketTimeoutException when the read timeout expires
     */
    boolean fill() throws IOException {
        int n = in.read(readBuf);
        if (n < 0) return false;
        bytesRead += n;
        parser.feed(readBuf, 0, n);
        return true;
    }

    long send(HttpResponse res, boolean keepAlive) throws IOException {
        long n = ResponseWriter.write(res, keepAlive, out);
        bytesWritten += n;
        requestsServed++;
        return n;
    }

    /**
     * Half-closes the socket and drains what the peer still sends, so closing does not
     * reset the connection before the peer has read our final response.
     */
    void lingeringClose() throws IOException {
        if (socket.isClosed()) return;
        socket.shutdownOutput();
        socket.setSoTimeout(Math.min(LINGER_MS, readTimeoutMs));
        long deadline = System.currentTimeMillis() + LINGER_MS;
        try {
            while (System.currentTimeMillis() < deadline && in.read(readBuf) >= 0) {
                // discard
            }
        } catch (SocketTimeoutException e) {
            // peer neither sent nor closed within the linger time; close anyway
            return;
        }
    }
}
