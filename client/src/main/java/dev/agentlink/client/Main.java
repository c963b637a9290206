package dev.agentlink.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
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
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class Main {

    private static final String SERVER = "server";

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        List<String> arguments = new ArrayList<>(Arrays.asList(args));
        ServerConfig config;
        try {
            config = parseServer(arguments);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            System.exit(2);
            return;
        }
        if (config == null || arguments.isEmpty()) {
            printUsage();
            return;
        }
        String command = arguments.remove(0);

        try (McpClient client = new McpClient(new PeerInfo("agentlink-cli", "0.1.0"))) {
            client.connectServer(SERVER, config);
            switch (command) {
                case "tools" -> handleTools(client);
                case "resources" -> handleResources(client);
                case "prompts" -> handlePrompts(client);
                case "call" -> handleCall(client, arguments);
                case "read" -> handleRead(client, arguments);
                case "prompt" -> handlePrompt(client, arguments);
                case "ping" -> handlePing(client);
                default -> {
                    System.err.println("Unknown command: " + command);
                    printUsage();
                }
            }
        } catch (McpException e) {
            System.err.println("ERROR " + e.getCode() + ": " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Consumes the transport flag from the front of {@code arguments}.
     *
     * @return the server to connect to, or {@code null} when no flag was given
     */
    static ServerConfig parseServer(List<String> arguments) {
        if (arguments.isEmpty()) {
            return null;
        }
        String flag = arguments.remove(0);
        switch (flag) {
            case "--stdio" -> {
                List<String> command = new ArrayList<>();
                while (!arguments.isEmpty() && !arguments.get(0).equals("--")) {
                    command.add(arguments.remove(0));
                }
                if (!arguments.isEmpty()) {
                    arguments.remove(0);
                }
                if (command.isEmpty()) {
                    throw new IllegalArgumentException("--stdio requires a command");
                }
                return ServerConfig.stdio(command.get(0), command.subList(1, command.size()).toArray(new String[0]));
            }
            case "--tcp" -> {
                String address = requireValue(flag, arguments);
                int colon = address.lastIndexOf(':');
                if (colon <= 0) {
                    throw new IllegalArgumentException("--tcp expects host:port, got " + address);
                }
                try {
                    return ServerConfig.tcp(address.substring(0, colon), Integer.parseInt(address.substring(colon + 1)));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid port in " + address, e);
                }
            }
            case "--ws" -> {
                return ServerConfig.websocket(URI.create(requireValue(flag, arguments)));
            }
            default -> throw new IllegalArgumentException("Unknown transport flag: " + flag);
        }
    }

    static JsonNode parseArguments(List<String> arguments, int index) {
        if (arguments.size() <= index) {
            return Json.object();
        }
        try {
            JsonNode parsed = Json.parse(arguments.get(index));
            if (parsed == null || !parsed.isObject()) {
                throw new IllegalArgumentException("Arguments must be a JSON object");
            }
            return parsed;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Arguments are not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String requireValue(String flag, List<String> arguments) {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return arguments.remove(0);
    }

    private static void handleTools(McpClient client) {
        for (CatalogEntry<Tool> entry : client.listTools()) {
            System.out.println(entry.qualifiedName() + "  " + entry.descriptor().description());
        }
    }

    private static void handleResources(McpClient client) {
        for (CatalogEntry<Resource> entry : client.listResources()) {
            Resource resource = entry.descriptor();
            System.out.println(resource.uri() + "  " + resource.name());
        }
    }

    private static void handlePrompts(McpClient client) {
        for (CatalogEntry<Prompt> entry : client.listPrompts()) {
            System.out.println(entry.qualifiedName() + "  " + entry.descriptor().description());
        }
    }

    private static void handleCall(McpClient client, List<String> arguments) throws McpException {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("call requires a tool name");
        }
        ToolResult result = client.callTool(arguments.get(0), parseArguments(arguments, 1));
        for (Content content : result.content()) {
            System.out.println(content.text() != null ? content.text() : "[" + content.type() + "]");
        }
        if (result.isError()) {
            System.out.println("(tool reported an error)");
        }
    }

    private static void handleRead(McpClient client, List<String> arguments) throws McpException {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("read requires a resource URI");
        }
        ReadResourceResult result = client.readResource(arguments.get(0));
        for (ResourceContents contents : result.contents()) {
            System.out.println(contents.uri() + " (" + contents.mimeType() + "):");
            System.out.println(contents.text());
        }
    }

    private static void handlePrompt(McpClient client, List<String> arguments) throws McpException {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("prompt requires a prompt name");
        }
        PromptResult result = client.getPrompt(arguments.get(0), parseArguments(arguments, 1));
        for (PromptMessage message : result.messages()) {
            System.out.println(message.role() + ": " + message.content().text());
        }
    }

    private static void handlePing(McpClient client) throws McpException {
        long started = System.nanoTime();
        client.ping(SERVER, Duration.ofSeconds(5));
        System.out.println("PONG in " + Duration.ofNanos(System.nanoTime() - started).toMillis() + " ms");
    }

    private static void printUsage() {
        System.out.println("Usage: java -jar agentlink-client.jar <server> <command> [args]\n" +
            "Server:\n" +
            "  --stdio <cmd> [args...] --\n" +
            "  --tcp <host:port>\n" +
            "  --ws <uri>\n" +
            "Commands:\n" +
            "  tools | resources | prompts\n" +
            "  call <tool> [json-args]\n" +
            "  read <uri>\n" +
            "  prompt <name> [json-args]\n" +
            "  ping");
    }
}
