package org.minihttp.server;

import org.minihttp.config.ServerConfig;
import org.minihttp.interfaces.HttpServer;
import org.minihttp.interfaces.ResourceResolver;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accept loop that starts one {@link ConnectionWorker} thread per accepted socket.
 * <p>
 * <b>Design notes:</b>
 * <ul>
 *   <li>No pool and no queue: the thread count grows with the number of open
 *       connections. Under heavy load this shows up as slow accepts, read timeouts and
 *       socket errors; it is not throttled here.</li>
 *   <li>Workers share only the read-only resolver and the atomic {@link ServerStats}.</li>
 *   <li>A failed accept is logged and the loop continues; a failed bind is fatal.</li>
 * </ul>
 */
public final class ThreadPerConnectionServer implements HttpServer {

    private final ServerConfig config;
    private final ResourceResolver resolver;
    private final ServerStats stats = new ServerStats();
    private final AtomicLong connectionIds = new AtomicLong();

    private volatile ServerSocket serverSocket;
    private volatile boolean closed;

    /** @throws IllegalArgumentException if the configuration does not {@link ServerConfig#validate() validate} */
    public ThreadPerConnectionServer(ServerConfig config, ResourceResolver resolver) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /** Serves on the address and port from the configuration. */
    public void serve() throws IOException {
        serve(config.getBindAddress(), config.getPort());
    }

    @Override
    public void serve(String bindAddress, int port) throws IOException {
        ServerSocket ss = new ServerSocket();
        try {
            ss.setReuseAddress(config.isReuseAddress());
            ss.bind(new InetSocketAddress(bindAddress, port), config.getBacklog());
        } catch (IOException e) {
            ss.close();
            throw e;
        }
        serverSocket = ss;
        if (closed) {
            ss.close();
            return;
        }
        System.out.println("[Server] listening on " + ss.getLocalSocketAddress());

        try (ss) {
            while (!closed) {
                Socket client;
                try {
                    client = ss.accept();
                } catch (IOException e) {
                    if (closed || ss.isClosed()) break;
                    System.err.println("[Server] accept failed: " + e.getMessage());
                    continue;
                }
                dispatch(client);
            }
        } finally {
            System.out.println("[Server] stopped " + stats.toJson());
        }
    }

    private void dispatch(Socket client) {
        long id = connectionIds.incrementAndGet();
        stats.connectionOpened();
        Thread worker = new Thread(new ConnectionWorker(id, client, config, resolver, stats), "conn-" + id);
        worker.setDaemon(true);
        try {
            worker.start();
        } catch (OutOfMemoryError | RuntimeException e) {
            // typically "unable to create native thread": drop this client, keep accepting
            stats.connectionClosed();
            System.err.println("[Server] cannot start worker for " + client.getRemoteSocketAddress() + ": " + e);
            try {
                client.close();
            } catch (IOException ce) {
                System.err.println("[Server] close failed: " + ce.getMessage());
            }
        }
    }

    /** @return the bound port, or -1 before {@link #serve} has bound. */
    public int localPort() {
        ServerSocket ss = serverSocket;
        return ss == null ? -1 : ss.getLocalPort();
    }

    public ServerStats stats() { return stats; }

    /** Stops accepting. Connections already handed to workers run to their own end. */
    @Override
    public void close() throws IOException {
        closed = true;
        ServerSocket ss = serverSocket;
        if (ss != null) ss.close();
    }
}
