package dev.agentlink.server.tools;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.RequiredArgsConstructor;

import dev.agentlink.protocol.ErrorCode;
import dev.agentlink.protocol.Json;
import dev.agentlink.protocol.McpException;
import dev.agentlink.protocol.model.Prompt;
import dev.agentlink.protocol.model.PromptArgument;
import dev.agentlink.protocol.model.Tool;

/**
 * Built-in tools that make a freshly started server usable without any plugin: {@code echo}
 * and {@code get_time}, plus the {@code summarize} prompt.
 */
@Component
@RequiredArgsConstructor
public class DemoTools {

	private static final Logger logger = LoggerFactory.getLogger(DemoTools.class);

	private static final DateTimeFormatter HUMAN_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

	private final Clock clock;

	/**
	 * Describe the {@code echo} tool.
	 * @return tool descriptor with a required {@code text} argument
	 */
	public Tool echoTool() {
		return new Tool("echo", "Echo back the input text", objectSchema("text", "Text to echo back", true));
	}

	/**
	 * Handle an {@code echo} call.
	 * @param arguments call arguments
	 * @return the echoed text
	 * @throws McpException when {@code text} is missing
	 */
	public String echo(JsonNode arguments) throws McpException {
		JsonNode text = arguments.get("text");
		if (text == null || !text.isTextual()) {
			throw new McpException(ErrorCode.INVALID_PARAMS, "text argument is required");
		}
		logger.debug("Echoing {} characters", text.asText().length());
		return "Echo: " + text.asText();
	}

	public Tool timeTool() {
		return new Tool("get_time", "Get current time and date",
				objectSchema("format", "Time format (iso, timestamp, human)", false));
	}

	/**
	 * Handle a {@code get_time} call.
	 * @param arguments call arguments, {@code format} defaults to {@code human}
	 * @return current time in the requested format
	 */
	public String currentTime(JsonNode arguments) {
		String format = arguments.path("format").asText("human");
		Instant now = this.clock.instant();
		return switch (format) {
			case "iso" -> LocalDateTime.ofInstant(now, this.clock.getZone()).toString();
			case "timestamp" -> Long.toString(now.getEpochSecond());
			default -> HUMAN_FORMAT.format(LocalDateTime.ofInstant(now, this.clock.getZone()));
		};
	}

	public Prompt summarizePrompt() {
		return new Prompt("summarize", "Summarize a piece of text",
				List.of(new PromptArgument("text", "Text to summarize", true)));
	}

	private static ObjectNode objectSchema(String property, String description, boolean required) {
		ObjectNode schema = Json.object().put("type", "object");
		schema.putObject("properties").putObject(property).put("type", "string").put("description", description);
		if (required) {
			schema.putArray("required").add(property);
		}
		return schema;
	}

}
