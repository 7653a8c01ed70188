package lark.server.resp.config;

import com.typesafe.config.Config;

public class ServerConfig {
    public final String host;
    public final int port;
    public final int workerThreads;
    public final int maxFrameBytes;

    public ServerConfig(Config config) {
        this(
                config.getString("host"),
                config.getInt("port"),
                config.getInt("worker-threads"),
                config.getBytes("max-frame-bytes"));
    }

    public ServerConfig(String host, int port, int workerThreads, long maxFrameBytes) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        if (workerThreads < 0) {
            throw new IllegalArgumentException("worker-threads cannot be negative: " + workerThreads);
        }
        if (maxFrameBytes <= 0 || maxFrameBytes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("max-frame-bytes must be between 1 and " + Integer.MAX_VALUE + ": " + maxFrameBytes);
        }
        this.host = host;
        this.port = port;
        this.workerThreads = workerThreads;
        this.maxFrameBytes = (int) maxFrameBytes;
    }

    /**
     * Number of event-loop threads serving connections; 0 in the configuration
     * means twice the number of available processors.
     */
    public int effectiveWorkerThreads() {
        return workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors() * 2;
    }
}
