package com.assistantmcp.backend.router;

/** Protocol-level failure of a router operation. */
public class RouterException extends RuntimeException {

  public enum Kind {
    TOOL_NOT_FOUND,
    RESOURCE_NOT_FOUND,
    PROMPT_NOT_FOUND,
    INVALID_PARAMETERS,
    EXECUTION_ERROR;

    public boolean isNotFound() {
      return this == TOOL_NOT_FOUND || this == RESOURCE_NOT_FOUND || this == PROMPT_NOT_FOUND;
    }
  }

  private final Kind kind;

  RouterException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public static RouterException toolNotFound(String toolName) {
    return new RouterException(Kind.TOOL_NOT_FOUND, "Tool " + toolName + " not found", null);
  }

  public static RouterException resourceNotFound(String uri) {
    return new RouterException(Kind.RESOURCE_NOT_FOUND, "Resource " + uri + " not found", null);
  }

  public static RouterException promptNotFound(String promptName) {
    return new RouterException(Kind.PROMPT_NOT_FOUND, "Prompt " + promptName + " not found", null);
  }

  public static RouterException invalidParameters(String message) {
    return new RouterException(Kind.INVALID_PARAMETERS, message, null);
  }

  public static RouterException executionError(String message, Throwable cause) {
    return new RouterException(Kind.EXECUTION_ERROR, message, cause);
  }

  public Kind getKind() {
    return kind;
  }
}
