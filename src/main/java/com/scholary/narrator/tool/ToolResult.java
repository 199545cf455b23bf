package com.scholary.narrator.tool;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * Parsed response of a remote tool.
 *
 * @param success whether the tool reported success
 * @param result the tool's payload, may be a string, object or array
 * @param error the tool's error text when it failed
 * @param body the whole response, for tools that return extra top-level fields
 */
public record ToolResult(boolean success, JsonNode result, String error, JsonNode body) {

  /** The payload as text, empty string when absent. */
  public String resultText() {
    if (result == null || result.isNull() || result.isMissingNode()) {
      return "";
    }
    return result.isTextual() ? result.asText() : result.toString();
  }

  /** A string field looked up on the payload first, then on the response body. */
  public Optional<String> textField(String name) {
    if (result != null && result.hasNonNull(name) && result.get(name).isTextual()) {
      return Optional.of(result.get(name).asText());
    }
    if (body != null && body.hasNonNull(name) && body.get(name).isTextual()) {
      return Optional.of(body.get(name).asText());
    }
    return Optional.empty();
  }
}
