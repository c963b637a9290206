package dev.agentlink.server.tools;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import dev.agentlink.protocol.ErrorCode;
import dev.agentlink.protocol.Json;
import dev.agentlink.protocol.McpException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DemoToolsTests {

    private final DemoTools tools = new DemoTools(Clock.fixed(Instant.parse("2025-07-13T10:15:30Z"), ZoneOffset.UTC));

    @Test
    void echoPrefixesTheText() throws Exception {
        assertThat(tools.echo(Json.object().put("text", "hi"))).isEqualTo("Echo: hi");
    }

    @Test
    void echoRequiresText() {
        assertThatThrownBy(() -> tools.echo(Json.object()))
            .isInstanceOfSatisfying(McpException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INVALID_PARAMS));
    }

    @Test
    void timeHonoursTheRequestedFormat() {
        assertThat(tools.currentTime(Json.object())).isEqualTo("2025-07-13 10:15:30");
        assertThat(tools.currentTime(Json.object().put("format", "iso"))).isEqualTo("2025-07-13T10:15:30");
        assertThat(tools.currentTime(Json.object().put("format", "timestamp"))).isEqualTo("1752401730");
    }

    @Test
    void echoSchemaRequiresText() {
        assertThat(tools.echoTool().inputSchema().path("required").get(0).asText()).isEqualTo("text");
        assertThat(tools.timeTool().inputSchema().has("required")).isFalse();
    }

}
