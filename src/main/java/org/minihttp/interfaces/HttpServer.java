package org.minihttp.interfaces;

import java.io.IOException;

/*
AutoCloseable so a server can live in try-with-resources; close() stops the accept loop
 */
public interface HttpServer extends AutoCloseable {

    /**
     * Binds and serves until {@link #close()} is called.
     *
     * @throws IOException if the address cannot be bound
     */
    void serve(String bindAddress, int port) throws IOException;

    @Override void close() throws IOException;
}
