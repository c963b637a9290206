package dev.agentlink.client;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.agentlink.protocol.Capability;
import dev.agentlink.protocol.Envelope;
import dev.agentlink.protocol.ErrorCode;
import dev.agentlink.protocol.Json;
import dev.agentlink.protocol.McpException;
import dev.agentlink.protocol.model.Content;
import dev.agentlink.protocol.model.PeerInfo;
import dev.agentlink.protocol.model.Prompt;
import dev.agentlink.protocol.model.PromptMessage;
import dev.agentlink.protocol.model.PromptResult;
import dev.agentlink.protocol.model.ReadResourceResult;
import dev.agentlink.protocol.model.Resource;
import dev.agentlink.protocol.model.ResourceContents;
import dev.agentlink.protocol.model.Tool;
import dev.agentlink.protocol.model.ToolResult;
import dev.agentlink.transport.TransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@Timeout(20)
class McpClientTests {

    private static final ServerConfig CONFIG = ServerConfig.tcp("mock", 1)
        .withConnectTimeout(Duration.ofSeconds(2))
        .withRequestTimeout(Duration.ofSeconds(2));

    private final Map<String, Function<MockTransport, ScriptedServer>> scripts = new ConcurrentHashMap<>();

    private final Map<String, List<MockTransport>> opened = new ConcurrentHashMap<>();

    private final McpClient client = new McpClient(new PeerInfo("test-client", "1.0"), (name, config) -> {
        Function<MockTransport, ScriptedServer> script = scripts.get(name);
        if (script == null) {
            throw new TransportException("No route to " + name, null, true);
        }
        MockTransport transport = new MockTransport(name);
        script.apply(transport);
        opened.computeIfAbsent(name, key -> new CopyOnWriteArrayList<>()).add(transport);
        return transport;
    });

    private final ExecutorService callers = Executors.newFixedThreadPool(4);

    @AfterEach
    void shutdown() {
        client.shutdown();
        callers.shutdownNow();
    }

    @Test
    void callsAToolOnTheServerThatOffersIt() throws Exception {
        scripts.put("fs", transport -> new ScriptedServer(transport, "fs", EnumSet.of(Capability.TOOLS))
            .tools(ScriptedServer.tool("read_file"))
            .result("tools/call", request -> Json.tree(ToolResult.text("hello"))));
        client.connectServer("fs", CONFIG);

        assertThat(client.listTools()).extracting(CatalogEntry::qualifiedName).containsExactly("fs:read_file");

        ToolResult result = client.callTool("read_file", Json.object().put("path", "/tmp/x"));

        assertThat(result.content().get(0).text()).isEqualTo("hello");
        assertThat(result.isError()).isFalse();
        Envelope call = transport("fs").sent("tools/call").get(0);
        ObjectNode expected = Json.object().put("name", "read_file");
        expected.putObject("arguments").put("path", "/tmp/x");
        assertThat(call.params()).isEqualTo(expected);
    }

    @Test
    void unknownToolFailsWithoutTouchingTheNetwork() throws Exception {
        scripts.put("fs", transport -> new ScriptedServer(transport, "fs", EnumSet.of(Capability.TOOLS))
            .tools(ScriptedServer.tool("read_file")));
        client.connectServer("fs", CONFIG);
        int sentBefore = transport("fs").sent().size();

        assertThatThrownBy(() -> client.callTool("write_file", Json.object()))
            .isInstanceOf(McpException.class)
            .satisfies(e -> assertThat(((McpException) e).getErrorCode()).isEqualTo(ErrorCode.TOOL_NOT_FOUND));
        assertThat(transport("fs").sent()).hasSize(sentBefore);
    }

    @Test
    void firstServerWinsANameCollisionUntilItLeaves() throws Exception {
        scripts.put("alpha", transport -> new ScriptedServer(transport, "alpha", EnumSet.of(Capability.TOOLS))
            .tools(ScriptedServer.tool("search"))
            .result("tools/call", request -> Json.tree(ToolResult.text("from alpha"))));
        scripts.put("beta", transport -> new ScriptedServer(transport, "beta", EnumSet.of(Capability.TOOLS))
            .tools(ScriptedServer.tool("search"))
            .result("tools/call", request -> Json.tree(ToolResult.text("from beta"))));
        client.connectServer("alpha", CONFIG);
        client.connectServer("beta", CONFIG);

        assertThat(client.listTools()).extracting(CatalogEntry::qualifiedName)
            .containsExactly("alpha:search", "beta:search");
        assertThat(client.callTool("search", null).content().get(0).text()).isEqualTo("from alpha");

        assertThat(client.disconnectServer("alpha")).isTrue();

        assertThat(client.listTools()).extracting(CatalogEntry::qualifiedName).containsExactly("beta:search");
        assertThat(client.callTool("search", null).content().get(0).text()).isEqualTo("from beta");
    }

    @Test
    void reconnectingReplacesThePreviousConnection() throws Exception {
        scripts.put("fs", transport -> new ScriptedServer(transport, "fs", EnumSet.of(Capability.TOOLS))
            .tools(ScriptedServer.tool("read_file")));
        client.connectServer("fs", CONFIG);
        client.connectServer("fs", CONFIG);

        List<MockTransport> transports = opened.get("fs");
        assertThat(transports).hasSize(2);
        assertThat(transports.get(0).isOpen()).isFalse();
        assertThat(transports.get(1).isOpen()).isTrue();
        assertThat(client.listConnectedServers()).containsExactly("fs");
        assertThat(client.listTools()).hasSize(1);
        assertThat(client.connectionState("fs")).contains(ConnectionState.READY);
    }

    @Test
    void failedConnectRegistersNothing() {
        scripts.put("broken", transport -> new ScriptedServer(transport, "broken", EnumSet.of(Capability.TOOLS))
            .error("initialize", ErrorCode.INTERNAL_ERROR, "boom"));

        assertThatThrownBy(() -> client.connectServer("broken", CONFIG))
            .satisfies(e -> assertThat(((McpException) e).getErrorCode()).isEqualTo(ErrorCode.CONNECT_FAILED));
        assertThatThrownBy(() -> client.connectServer("nowhere", CONFIG))
            .satisfies(e -> assertThat(((McpException) e).getErrorCode()).isEqualTo(ErrorCode.CONNECT_FAILED));

        assertThat(client.listConnectedServers()).isEmpty();
        assertThat(client.listTools()).isEmpty();
    }

    @Test
    void serverThatGoesAwayIsPurged() throws Exception {
        scripts.put("fs", transport -> new ScriptedServer(transport, "fs", EnumSet.of(Capability.TOOLS))
            .tools(ScriptedServer.tool("read_file")));
        scripts.put("db", transport -> new ScriptedServer(transport, "db", EnumSet.of(Capability.TOOLS))
            .tools(ScriptedServer.tool("query")));
        client.connectServer("fs", CONFIG);
        client.connectServer("db", CONFIG);

        transport("fs").peerCloses();

        await().atMost(Duration.ofSeconds(5)).until(() -> client.listConnectedServers().equals(List.of("db")));
        assertThat(client.listTools()).extracting(CatalogEntry::qualifiedName).containsExactly("db:query");
        assertThatThrownBy(() -> client.callTool("read_file", null))
            .satisfies(e -> assertThat(((McpException) e).getErrorCode()).isEqualTo(ErrorCode.TOOL_NOT_FOUND));
    }

    @Test
    void readsResourcesByUriAndRendersPrompts() throws Exception {
        scripts.put("docs", transport -> new ScriptedServer(transport, "docs",
                EnumSet.of(Capability.RESOURCES, Capability.PROMPTS))
            .resources(new Resource("docs://readme", "readme", null, "text/markdown"))
            .prompts(new Prompt("review", "Review a document", null))
            .result("resources/read", request -> Json.tree(new ReadResourceResult(List.of(
                new ResourceContents(request.params().path("uri").asText(), "text/markdown", "# Hello")))))
            .result("prompts/get", request -> Json.tree(new PromptResult("Review", List.of(new PromptMessage("user",
                Content.text("Review " + request.params().path("arguments").path("doc").asText())))))));
        client.connectServer("docs", CONFIG);

        ReadResourceResult read = client.readResource("docs://readme");
        PromptResult prompt = client.getPrompt("review", Json.object().put("doc", "readme"));

        assertThat(read.contents()).singleElement().satisfies(contents -> {
            assertThat(contents.uri()).isEqualTo("docs://readme");
            assertThat(contents.text()).isEqualTo("# Hello");
        });
        assertThat(prompt.messages().get(0).content().text()).isEqualTo("Review readme");
        assertThat(client.listResources()).extracting(CatalogEntry::qualifiedName).containsExactly("docs:docs://readme");
        assertThatThrownBy(() -> client.readResource("docs://missing"))
            .satisfies(e -> assertThat(((McpException) e).getErrorCode()).isEqualTo(ErrorCode.RESOURCE_NOT_FOUND));
        assertThatThrownBy(() -> client.getPrompt("missing", null))
            .satisfies(e -> assertThat(((McpException) e).getErrorCode()).isEqualTo(ErrorCode.PROMPT_NOT_FOUND));
    }

    @Test
    void callWithoutTimeoutUsesTheServersRequestTimeout() throws Exception {
        scripts.put("slow", transport -> new ScriptedServer(transport, "slow", EnumSet.of(Capability.TOOLS))
            .tools(ScriptedServer.tool("wait"))
            .hold("tools/call"));
        client.connectServer("slow", CONFIG.withRequestTimeout(Duration.ofMillis(150)));

        assertThatThrownBy(() -> client.callTool("wait", null))
            .satisfies(e -> assertThat(((McpException) e).getErrorCode()).isEqualTo(ErrorCode.TIMEOUT));
        assertThat(client.connectionState("slow")).contains(ConnectionState.READY);
    }

    @Test
    void routesNotificationsWithTheServerName() throws Exception {
        scripts.put("fs", transport -> new ScriptedServer(transport, "fs", EnumSet.noneOf(Capability.class)));
        BlockingQueue<String> received = new LinkedBlockingQueue<>();
        client.onNotification("notifications/message", (server, params) -> received.add(server + ":" + params.path("data").asText()));
        client.connectServer("fs", CONFIG);

        transport("fs").push(Envelope.notification("notifications/message", Json.object().put("data", "indexed")));

        assertThat(received.poll(5, TimeUnit.SECONDS)).isEqualTo("fs:indexed");
    }

    @Test
    void answersServerRequestsWithRegisteredHandlers() throws Exception {
        scripts.put("fs", transport -> new ScriptedServer(transport, "fs", EnumSet.noneOf(Capability.class)));
        client.onRequest("roots/list", (server, params) -> Json.object().set("roots", Json.array()));
        client.connectServer("fs", CONFIG);

        transport("fs").push(Envelope.request(7L, "roots/list", null));

        await().atMost(Duration.ofSeconds(5)).until(() -> transport("fs").sent().stream().anyMatch(Envelope::isResponse));
        Envelope response = transport("fs").sent().stream().filter(Envelope::isResponse).findFirst().orElseThrow();
        assertThat(response.id()).isEqualTo(7L);
        assertThat(response.result().path("roots").isArray()).isTrue();
    }

    @Test
    void shutdownIsIdempotentAndClosesEverything() throws Exception {
        scripts.put("a", transport -> new ScriptedServer(transport, "a", EnumSet.of(Capability.TOOLS))
            .tools(ScriptedServer.tool("one")));
        scripts.put("b", transport -> new ScriptedServer(transport, "b", EnumSet.of(Capability.TOOLS))
            .tools(ScriptedServer.tool("two")));
        client.connectServer("a", CONFIG);
        client.connectServer("b", CONFIG);
        transport("a").peerCloses();
        await().atMost(Duration.ofSeconds(5)).until(() -> client.listConnectedServers().size() == 1);

        client.shutdown();
        client.shutdown();

        assertThat(client.listConnectedServers()).isEmpty();
        assertThat(client.listTools()).isEmpty();
        assertThat(transport("b").isOpen()).isFalse();
        assertThatThrownBy(() -> client.connectServer("a", CONFIG))
            .satisfies(e -> assertThat(((McpException) e).getErrorCode()).isEqualTo(ErrorCode.CONNECTION_CLOSED));
    }

    @Test
    void pingReachesTheNamedServer() throws Exception {
        scripts.put("fs", transport -> new ScriptedServer(transport, "fs", EnumSet.noneOf(Capability.class))
            .result("ping", request -> Json.object()));
        client.connectServer("fs", CONFIG);

        client.ping("fs", Duration.ofSeconds(2));

        assertThat(transport("fs").sent("ping")).hasSize(1);
        assertThatThrownBy(() -> client.ping("other", Duration.ofSeconds(1)))
            .satisfies(e -> assertThat(((McpException) e).getErrorCode()).isEqualTo(ErrorCode.CONNECTION_CLOSED));
    }

    @Test
    void healthCheckReportsEachServerWithoutFailingOnAStuckOne() throws Exception {
        scripts.put("up", transport -> new ScriptedServer(transport, "up", EnumSet.of(Capability.TOOLS))
            .tools(ScriptedServer.tool("one"), ScriptedServer.tool("two"))
            .result("ping", request -> Json.object()));
        scripts.put("stuck", transport -> new ScriptedServer(transport, "stuck", EnumSet.of(Capability.TOOLS))
            .tools(ScriptedServer.tool("three"))
            .hold("ping"));
        client.connectServer("up", CONFIG);
        client.connectServer("stuck", CONFIG);

        List<ServerHealth> report = client.healthCheck(Duration.ofMillis(200));

        assertThat(report).extracting(ServerHealth::serverName).containsExactly("stuck", "up");
        ServerHealth stuck = report.get(0);
        assertThat(stuck.healthy()).isFalse();
        assertThat(stuck.error()).contains("timed out");
        assertThat(stuck.state()).isEqualTo(ConnectionState.READY);
        assertThat(stuck.toolCount()).isEqualTo(1);
        assertThat(stuck.responseTime()).isGreaterThanOrEqualTo(Duration.ofMillis(200));
        ServerHealth up = report.get(1);
        assertThat(up.healthy()).isTrue();
        assertThat(up.error()).isNull();
        assertThat(up.state()).isEqualTo(ConnectionState.READY);
        assertThat(up.toolCount()).isEqualTo(2);
        assertThat(client.listConnectedServers()).containsExactly("stuck", "up");
    }

    @Test
    void disconnectFailsEveryCallInFlightAndPurgesTheServer() throws Exception {
        AtomicReference<ScriptedServer> server = new AtomicReference<>();
        scripts.put("x", transport -> {
            ScriptedServer scripted = new ScriptedServer(transport, "x", EnumSet.of(Capability.TOOLS))
                .tools(ScriptedServer.tool("work"))
                .hold("tools/call");
            server.set(scripted);
            return scripted;
        });
        client.connectServer("x", CONFIG);

        List<Future<ToolResult>> calls = List.of(
            callers.submit(() -> client.callTool("work", null)),
            callers.submit(() -> client.callTool("work", null)),
            callers.submit(() -> client.callTool("work", null)));
        await().atMost(Duration.ofSeconds(5)).until(() -> server.get().held().size() == 3);

        assertThat(client.disconnectServer("x")).isTrue();

        for (Future<ToolResult> call : calls) {
            assertThatThrownBy(() -> call.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .satisfies(e -> assertThat(((McpException) e.getCause()).getErrorCode())
                    .isEqualTo(ErrorCode.CONNECTION_CLOSED));
        }
        assertThat(client.listTools()).extracting(CatalogEntry::qualifiedName).noneMatch(name -> name.startsWith("x:"));
        assertThat(client.listConnectedServers()).isEmpty();
    }

    @Test
    void shutdownDuringConnectClosesTheLateConnection() throws Exception {
        AtomicReference<ScriptedServer> server = new AtomicReference<>();
        scripts.put("late", transport -> {
            ScriptedServer scripted = new ScriptedServer(transport, "late", EnumSet.of(Capability.TOOLS))
                .hold("tools/list");
            server.set(scripted);
            return scripted;
        });
        Future<?> connecting = callers.submit(() -> {
            client.connectServer("late", CONFIG);
            return null;
        });
        await().atMost(Duration.ofSeconds(5)).until(() -> server.get() != null && server.get().held().size() == 1);

        client.shutdown();
        server.get().reply(server.get().held().take(),
            Json.object().set("tools", Json.tree(List.<Tool>of(ScriptedServer.tool("work")))));

        assertThatThrownBy(() -> connecting.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .satisfies(e -> assertThat(((McpException) e.getCause()).getErrorCode())
                .isEqualTo(ErrorCode.CONNECTION_CLOSED));
        assertThat(client.listConnectedServers()).isEmpty();
        assertThat(client.listTools()).isEmpty();
        assertThat(transport("late").isOpen()).isFalse();
    }

    private MockTransport transport(String name) {
        List<MockTransport> transports = opened.get(name);
        return transports.get(transports.size() - 1);
    }

}
