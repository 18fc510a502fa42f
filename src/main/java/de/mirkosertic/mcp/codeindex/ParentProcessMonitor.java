package de.mirkosertic.mcp.codeindex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a callback when the process that launched this server exits, so that the server does
 * not outlive the MCP client that owns its STDIO pipes.
 */
public class ParentProcessMonitor {

    private static final Logger logger = LoggerFactory.getLogger(ParentProcessMonitor.class);

    private final Optional<ProcessHandle> parent;
    private final Runnable onParentExit;

    public ParentProcessMonitor(final Runnable onParentExit) {
        this(ProcessHandle.current().parent(), onParentExit);
    }

    ParentProcessMonitor(final Optional<ProcessHandle> parent, final Runnable onParentExit) {
        this.parent = parent;
        this.onParentExit = onParentExit;
    }

    /**
     * @return the future completing after the callback ran, or empty if there is no parent to watch
     */
    public Optional<CompletableFuture<Void>> start() {
        if (parent.isEmpty()) {
            logger.info("[MCP Server] No parent process found, parent monitoring disabled");
            return Optional.empty();
        }
        final ProcessHandle handle = parent.get();
        final CompletableFuture<Void> watch = handle.onExit().thenRun(() -> {
            logger.info("[MCP Server] Parent process {} terminated, shutting down...", handle.pid());
            onParentExit.run();
        });
        logger.info("[MCP Server] Monitoring parent process PID: {}", handle.pid());
        return Optional.of(watch);
    }
}
