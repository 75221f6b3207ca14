package no.cantara.ucca.mcp;

import io.modelcontextprotocol.json.McpJsonDefaults;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Serves the refinements of a ucca.yaml workspace over MCP stdio.
 *
 * <pre>
 * Usage: ucca-mcp [ucca.yaml] [--show-pruned] [--no-warnings]
 * </pre>
 *
 * Refinement runs once at startup and its summary goes to stderr; stdout carries the protocol.
 */
public class UccaMcpCli {

    static final String USAGE = "Usage: ucca-mcp [ucca.yaml] [--show-pruned] [--no-warnings]";

    record Options(Path workspacePath, boolean showPruned, boolean warnOnValidation) {}

    /**
     * @throws IllegalArgumentException on an unknown flag or a second workspace path
     */
    static Options parseArgs(String[] args) {
        Path workspacePath = null;
        boolean showPruned = false;
        boolean warnOnValidation = true;
        for (String arg : args) {
            if (arg.equals("--show-pruned")) {
                showPruned = true;
            } else if (arg.equals("--no-warnings")) {
                warnOnValidation = false;
            } else if (arg.startsWith("-")) {
                throw new IllegalArgumentException("unknown option " + arg);
            } else if (workspacePath != null) {
                throw new IllegalArgumentException("more than one workspace given: " + workspacePath + ", " + arg);
            } else {
                workspacePath = Path.of(arg);
            }
        }
        return new Options(workspacePath != null ? workspacePath : Path.of("ucca.yaml"), showPruned, warnOnValidation);
    }

    public static void main(String[] args) {
        Options options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("[ucca-mcp] " + e.getMessage());
            System.err.println(USAGE);
            System.exit(1);
            return;
        }
        if (!Files.isRegularFile(options.workspacePath())) {
            System.err.println("[ucca-mcp] Error: workspace not found at " + options.workspacePath());
            System.exit(1);
            return;
        }

        McpSyncServer server;
        try {
            server = UccaServer.createServer(options.workspacePath(),
                new StdioServerTransportProvider(McpJsonDefaults.getMapper()),
                options.showPruned(), options.warnOnValidation());
        } catch (Exception e) {
            System.err.println("[ucca-mcp] Startup error: " + e.getMessage());
            System.exit(1);
            return;
        }
        awaitShutdown(server);
    }

    /** Blocks until the JVM shuts down, closing the server first. */
    private static void awaitShutdown(McpSyncServer server) {
        CountDownLatch closed = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.close();
            closed.countDown();
        }, "ucca-mcp-shutdown"));
        try {
            closed.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
