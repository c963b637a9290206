package dev.agentlink.protocol.model;

import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import dev.agentlink.protocol.Capability;
import dev.agentlink.protocol.Json;

/**
 * Capability set exchanged in {@code initialize}. A category is advertised when its member is
 * present and not {@code null}; the member's content carries optional per-category flags.
 * @param tools tool capability flags
 * @param resources resource capability flags
 * @param prompts prompt capability flags
 * @param logging logging capability flags
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Capabilities(JsonNode tools, JsonNode resources, JsonNode prompts, JsonNode logging) {

	/**
	 * Build a capability set advertising the given categories with empty flag objects.
	 * @param categories categories to advertise
	 * @return capability set
	 */
	public static Capabilities of(Set<Capability> categories) {
		return new Capabilities(flag(categories, Capability.TOOLS), flag(categories, Capability.RESOURCES),
				flag(categories, Capability.PROMPTS), flag(categories, Capability.LOGGING));
	}

	public static Capabilities none() {
		return new Capabilities(null, null, null, null);
	}

	/**
	 * Determine whether a category is advertised.
	 * @param category category to check
	 * @return {@code true} when the category member is present
	 */
	@JsonIgnore
	public boolean supports(Capability category) {
		JsonNode member = switch (category) {
			case TOOLS -> tools;
			case RESOURCES -> resources;
			case PROMPTS -> prompts;
			case LOGGING -> logging;
		};
		return member != null && !member.isNull() && !member.isMissingNode();
	}

	private static JsonNode flag(Set<Capability> categories, Capability category) {
		return categories.contains(category) ? Json.object() : null;
	}

}
