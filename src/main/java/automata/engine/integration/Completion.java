package automata.engine.integration;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param text  first text block of the answer, null for non-text content
 * @param usage token usage as reported by the provider, may be null
 */
public record Completion(String text, String model, JsonNode usage) {
}
