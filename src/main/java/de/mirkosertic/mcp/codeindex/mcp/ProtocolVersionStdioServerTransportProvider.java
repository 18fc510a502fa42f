package de.mirkosertic.mcp.codeindex.mcp;

import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.ProtocolVersions;

import java.util.List;

/**
 * STDIO transport that negotiates a configurable list of protocol versions instead of the
 * SDK's single default.
 */
public class ProtocolVersionStdioServerTransportProvider extends StdioServerTransportProvider {

    /**
     * Newest first.
     */
    public static final List<String> LATEST_PROTOCOL_VERSIONS = List.of(
            ProtocolVersions.MCP_2025_06_18,
            ProtocolVersions.MCP_2025_03_26,
            ProtocolVersions.MCP_2024_11_05
    );

    private final List<String> protocolVersions;

    public ProtocolVersionStdioServerTransportProvider(final McpJsonMapper jsonMapper,
                                                       final List<String> protocolVersions) {
        super(jsonMapper);
        if (protocolVersions.isEmpty()) {
            throw new IllegalArgumentException("At least one protocol version is required");
        }
        this.protocolVersions = List.copyOf(protocolVersions);
    }

    public ProtocolVersionStdioServerTransportProvider(final McpJsonMapper jsonMapper) {
        this(jsonMapper, LATEST_PROTOCOL_VERSIONS);
    }

    @Override
    public List<String> protocolVersions() {
        return protocolVersions;
    }
}
