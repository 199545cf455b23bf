package com.scholary.narrator.tool;

import java.util.Map;

/**
 * Uniform contract for the external processing services.
 *
 * <p>Implementations must throw {@link ToolInvocationException} rather than return a result with
 * {@code success=false}, so stages only ever see successful results.
 */
public interface ToolService {

  /**
   * Call one tool on one service.
   *
   * @param service the configured service kind, e.g. {@code asr}
   * @param toolName the tool to invoke, e.g. {@code transcribe_audio}
   * @param arguments JSON-serializable arguments; null values are sent as JSON null
   * @return the successful result
   * @throws ToolInvocationException if the call fails or the tool reports failure
   */
  ToolResult call(String service, String toolName, Map<String, Object> arguments);
}
