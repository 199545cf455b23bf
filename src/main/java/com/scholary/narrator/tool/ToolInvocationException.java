package com.scholary.narrator.tool;

/**
 * Exception thrown when a remote tool call fails.
 *
 * <p>The message is the collaborator's own error text where it sent one, so it can be shown to
 * users unchanged.
 */
public class ToolInvocationException extends RuntimeException {

  public ToolInvocationException(String message) {
    super(message);
  }

  public ToolInvocationException(String message, Throwable cause) {
    super(message, cause);
  }
}
