package com.scholary.narrator.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the remote processing services.
 *
 * <p>Each call is a single {@code POST {baseUrl}/tools/{toolName}} with a JSON object of arguments.
 * The service answers {@code {"success": bool, "result": any, "error": string}}. Calls are not
 * retried: a stage either gets a successful result or fails the job.
 *
 * <p>The request body is sent as UTF-8 bytes so transcripts with non-ASCII text keep their
 * declared length.
 */
@Component
public class RemoteToolClient implements ToolService {

  private static final Logger LOGGER = LoggerFactory.getLogger(RemoteToolClient.class);

  private final HttpClient httpClient;
  private final ToolServiceProperties properties;
  private final ObjectMapper objectMapper;

  public RemoteToolClient(ToolServiceProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized remote tool client: services={}", properties.services().keySet());
  }

  @Override
  public ToolResult call(String service, String toolName, Map<String, Object> arguments) {
    ToolServiceProperties.Endpoint endpoint = properties.services().get(service);
    if (endpoint == null) {
      throw new ToolInvocationException("No endpoint configured for service: " + service);
    }

    URI uri = URI.create(stripTrailingSlash(endpoint.baseUrl()) + "/tools/" + toolName);
    LOGGER.info("Calling tool: service={}, tool={}", service, toolName);

    byte[] payload;
    try {
      payload = objectMapper.writeValueAsBytes(arguments);
    } catch (JsonProcessingException e) {
      throw new ToolInvocationException("Could not encode arguments for " + toolName, e);
    }

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(uri)
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(BodyPublishers.ofByteArray(payload))
            .build();

    HttpResponse<String> response;
    try {
      response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new ToolInvocationException(
          String.format("Tool %s unreachable at %s: %s", toolName, uri, e.getMessage()), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ToolInvocationException("Tool call interrupted: " + toolName, e);
    }

    if (response.statusCode() / 100 != 2) {
      throw new ToolInvocationException(
          String.format(
              "Tool %s returned status %d: %s", toolName, response.statusCode(), response.body()));
    }

    ToolResult result = parse(toolName, response.body());
    if (!result.success()) {
      String error = result.error();
      throw new ToolInvocationException(
          error == null || error.isBlank() ? "Tool " + toolName + " failed" : error);
    }

    LOGGER.debug("Tool succeeded: service={}, tool={}", service, toolName);
    return result;
  }

  private ToolResult parse(String toolName, String body) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new ToolInvocationException("Tool " + toolName + " returned an unreadable body", e);
    }
    if (root == null || !root.isObject()) {
      throw new ToolInvocationException("Tool " + toolName + " returned a non-object body");
    }
    JsonNode error = root.get("error");
    return new ToolResult(
        root.path("success").asBoolean(false),
        root.get("result"),
        error == null || error.isNull() ? null : error.asText(),
        root);
  }

  private static String stripTrailingSlash(String baseUrl) {
    return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
  }
}
