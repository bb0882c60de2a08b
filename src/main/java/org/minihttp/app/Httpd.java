package org.minihttp.app;

import org.minihttp.config.ConfigLoader;
import org.minihttp.config.ServerConfig;
import org.minihttp.content.FileSystemContentSource;
import org.minihttp.handler.StaticResourceResolver;
import org.minihttp.server.ThreadPerConnectionServer;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Command line entry point: serves the files under a document root.
 * <pre>
 *   Httpd [-c config.json] [-b address] [-p port] [-r root] [-t readTimeoutMs] [-w backlog] [-v] [--no-keep-alive]
 * </pre>
 */
public final class Httpd {

    static final int EXIT_USAGE = 2;
    static final int EXIT_BIND = 1;

    private Httpd() {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /** Runs the server; returns only when it stops or cannot start. */
    public static int run(String... args) {
        ServerConfig cfg;
        FileSystemContentSource content;
        try {
            cfg = ConfigLoader.load(args);
            content = new FileSystemContentSource(Path.of(cfg.getDocumentRoot()));
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            System.err.println("[Config] " + e.getClass().getSimpleName() + ": " + e.getMessage());
            return EXIT_USAGE;
        }
        System.out.println("[Server] " + cfg + ", serving " + content.root());

        ThreadPerConnectionServer server =
                new ThreadPerConnectionServer(cfg, new StaticResourceResolver(content, cfg.getServerName()));
        Thread hook = new Thread(() -> {
            try {
                server.close();
            } catch (IOException e) {
                System.err.println("[Server] shutdown failed: " + e.getMessage());
            }
        }, "shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            server.serve();
            return 0;
        } catch (IOException e) {
            System.err.println("[Server] cannot bind " + cfg.getBindAddress() + ":" + cfg.getPort() + ": " + e.getMessage());
            return EXIT_BIND;
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                // already shutting down; the hook is running
                System.out.println("[Server] shutting down");
            }
        }
    }
}
