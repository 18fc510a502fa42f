package de.mirkosertic.mcp.codeindex;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.codeindex.config.ApplicationConfig;
import de.mirkosertic.mcp.codeindex.config.BuildInfo;
import de.mirkosertic.mcp.codeindex.config.LoggingConfigurator;
import de.mirkosertic.mcp.codeindex.mcp.ProtocolVersionStdioServerTransportProvider;
import de.mirkosertic.mcp.codeindex.store.JsonFileDocumentStore;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Main entry point of the MCP code index server.
 * Loads the document store, builds the index and serves the tools over STDIO.
 */
public class CodeIndexApplication {

    private static final Logger logger = LoggerFactory.getLogger(CodeIndexApplication.class);

    private final JsonFileDocumentStore documentStore;
    private final CodeIndexService indexService;
    private final CodeSearchTools searchTools;
    private McpSyncServer mcpServer;

    public CodeIndexApplication(final ApplicationConfig config) {
        this.documentStore = new JsonFileDocumentStore(Path.of(config.getStorePath()));
        // No semantic backend ships with the server; the fuzzy source falls back to trigrams
        this.indexService = new CodeIndexService(config, documentStore, Map.of());
        this.searchTools = new CodeSearchTools(indexService);
    }

    /**
     * Load the stored documents and build the index.
     */
    public void init() throws IOException {
        logger.info("Initializing MCP code index server...");

        documentStore.init();
        indexService.init();

        logger.info("All services initialized successfully");
    }

    /**
     * Start the MCP server and block until shutdown.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                "MCP Code Index Server",
                BuildInfo.getVersion()
        );

        final JacksonMcpJsonMapper jsonMapper = new JacksonMcpJsonMapper(new ObjectMapper());

        final ProtocolVersionStdioServerTransportProvider transportProvider =
                new ProtocolVersionStdioServerTransportProvider(jsonMapper);

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(searchTools.getToolSpecifications())
                .build();

        logger.info("MCP server started successfully ({})", BuildInfo.describe());

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        new ParentProcessMonitor(() -> System.exit(0)).start();

        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }

        logger.info("Main thread finished, shutting down...");
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down MCP code index server...");

        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }

        try {
            indexService.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down index service", e);
        }

        logger.info("MCP code index server shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Logging first: in deployed mode stdout belongs to the protocol
            final boolean deployedMode = "deployed".equals(System.getProperty("profile"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();

            if (!deployedMode) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Store path: {}", config.getStorePath());
            }

            final CodeIndexApplication app = new CodeIndexApplication(config);
            app.init();
            app.start();

            logger.info("MCP code index server finished.");

        } catch (final Exception e) {
            System.err.println("Failed to start MCP code index server: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
