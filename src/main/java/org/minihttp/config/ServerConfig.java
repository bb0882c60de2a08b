package org.minihttp.config;

import org.minihttp.http.DuplicateHeaderPolicy;

/**
 * Server settings. Field names double as the keys of the JSON configuration file,
 * which Gson binds directly; a missing key keeps the default below.
 */
public final class ServerConfig {

    private String bindAddress = "0.0.0.0";
    private int port = 8080;
    private String documentRoot = ".";

    /** How long a worker waits for bytes before dropping the connection. */
    private int readTimeoutMs = 5000;

    /** Upper bound on request line plus headers. */
    private int maxHeadBytes = 8192;
    private long maxBodyBytes = 1L << 20;
    private int readBufferSize = 2048;

    /** Listen queue length handed to the server socket. */
    private int backlog = 50;
    private boolean reuseAddress = true;
    private boolean keepAlive = true;
    private DuplicateHeaderPolicy duplicateHeaders = DuplicateHeaderPolicy.JOIN;
    private String serverName = "minihttp";

    /** Prints one access line per request. */
    private boolean verbose = false;

    public String getBindAddress() { return bindAddress; }
    public int getPort() { return port; }
    public String getDocumentRoot() { return documentRoot; }
    public int getReadTimeoutMs() { return readTimeoutMs; }
    public int getMaxHeadBytes() { return maxHeadBytes; }
    public long getMaxBodyBytes() { return maxBodyBytes; }
    public int getReadBufferSize() { return readBufferSize; }
    public int getBacklog() { return backlog; }
    public boolean isReuseAddress() { return reuseAddress; }
    public boolean isKeepAlive() { return keepAlive; }
    public DuplicateHeaderPolicy getDuplicateHeaders() { return duplicateHeaders; }
    public String getServerName() { return serverName; }
    public boolean isVerbose() { return verbose; }

    public ServerConfig setBindAddress(String bindAddress) { this.bindAddress = bindAddress; return this; }
    public ServerConfig setPort(int port) { this.port = port; return this; }
    public ServerConfig setDocumentRoot(String documentRoot) { this.documentRoot = documentRoot; return this; }
    public ServerConfig setReadTimeoutMs(int readTimeoutMs) { this.readTimeoutMs = readTimeoutMs; return this; }
    public ServerConfig setMaxHeadBytes(int maxHeadBytes) { this.maxHeadBytes = maxHeadBytes; return this; }
    public ServerConfig setMaxBodyBytes(long maxBodyBytes) { this.maxBodyBytes = maxBodyBytes; return this; }
    public ServerConfig setReadBufferSize(int readBufferSize) { this.readBufferSize = readBufferSize; return this; }
    public ServerConfig setBacklog(int backlog) { this.backlog = backlog; return this; }
    public ServerConfig setReuseAddress(boolean reuseAddress) { this.reuseAddress = reuseAddress; return this; }
    public ServerConfig setKeepAlive(boolean keepAlive) { this.keepAlive = keepAlive; return this; }
    public ServerConfig setDuplicateHeaders(DuplicateHeaderPolicy duplicateHeaders) { this.duplicateHeaders = duplicateHeaders; return this; }
    public ServerConfig setServerName(String serverName) { this.serverName = serverName; return this; }
    public ServerConfig setVerbose(boolean verbose) { this.verbose = verbose; return this; }

    /**
     * Checks ranges and required values.
     *
     * @return this, for chaining
     * @throws IllegalArgumentException naming the first bad setting
     */
    public ServerConfig validate() {
        require(bindAddress != null && !bindAddress.isBlank(), "bindAddress must not be empty");
        require(port >= 0 && port <= 65535, "port must be in 0..65535, got " + port);
        require(documentRoot != null && !documentRoot.isBlank(), "documentRoot must not be empty");
        require(readTimeoutMs > 0, "readTimeoutMs must be > 0, got " + readTimeoutMs);
        require(maxHeadBytes > 0, "maxHeadBytes must be > 0, got " + maxHeadBytes);
        require(maxBodyBytes >= 0, "maxBodyBytes must be >= 0, got " + maxBodyBytes);
        require(readBufferSize > 0, "readBufferSize must be > 0, got " + readBufferSize);
        require(backlog > 0, "backlog must be > 0, got " + backlog);
        require(duplicateHeaders != null, "duplicateHeaders must be JOIN or LAST_WINS");
        require(serverName != null && !serverName.isBlank(), "serverName must not be empty");
        return this;
    }

    private static void require(boolean ok, String message) {
        if (!ok) throw new IllegalArgumentException(message);
    }

    @Override
    public String toString() {
        return "ServerConfig{bind=" + bindAddress + ":" + port
                + ", root=" + documentRoot
                + ", readTimeoutMs=" + readTimeoutMs
                + ", maxHeadBytes=" + maxHeadBytes
                + ", maxBodyBytes=" + maxBodyBytes
                + ", backlog=" + backlog
                + ", keepAlive=" + keepAlive
                + ", duplicateHeaders=" + duplicateHeaders + "}";
    }
}
