package de.mirkosertic.mcp.codeindex.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.spec.ProtocolVersions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProtocolVersionStdioServerTransportProviderTest {

    private final JacksonMcpJsonMapper jsonMapper = new JacksonMcpJsonMapper(new ObjectMapper());

    @Test
    void testAdvertisesNewestVersionFirst() {
        final ProtocolVersionStdioServerTransportProvider provider =
                new ProtocolVersionStdioServerTransportProvider(jsonMapper);

        assertThat(provider.protocolVersions()).first().isEqualTo(ProtocolVersions.MCP_2025_06_18);
        assertThat(provider.protocolVersions()).contains(ProtocolVersions.MCP_2024_11_05);
    }

    @Test
    void testCustomVersions() {
        final ProtocolVersionStdioServerTransportProvider provider =
                new ProtocolVersionStdioServerTransportProvider(jsonMapper, List.of(ProtocolVersions.MCP_2024_11_05));

        assertThat(provider.protocolVersions()).containsExactly(ProtocolVersions.MCP_2024_11_05);
    }

    @Test
    void testEmptyVersionListIsRejected() {
        assertThatThrownBy(() -> new ProtocolVersionStdioServerTransportProvider(jsonMapper, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
