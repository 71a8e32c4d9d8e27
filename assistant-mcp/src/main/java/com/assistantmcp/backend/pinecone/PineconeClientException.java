package com.assistantmcp.backend.pinecone;

/**
 * Failure of a single Pinecone Assistant call. {@link Kind} tells transport problems, missing
 * assistants, other HTTP errors and malformed payloads apart.
 */
public class PineconeClientException extends RuntimeException {

  public enum Kind {
    TRANSPORT,
    NOT_FOUND,
    API,
    DECODE
  }

  private final Kind kind;
  private final Integer status;

  PineconeClientException(Kind kind, Integer status, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.status = status;
  }

  public static PineconeClientException transport(Throwable cause) {
    return new PineconeClientException(
        Kind.TRANSPORT, null, "HTTP request error: " + cause.getMessage(), cause);
  }

  public static PineconeClientException transport(String detail, Throwable cause) {
    return new PineconeClientException(Kind.TRANSPORT, null, "HTTP request error: " + detail, cause);
  }

  public static PineconeClientException notFound(String resource) {
    return new PineconeClientException(
        Kind.NOT_FOUND, 404, "API error: " + resource + " not found", null);
  }

  public static PineconeClientException api(int status, String body) {
    return new PineconeClientException(Kind.API, status, "API error: " + status + " - " + body, null);
  }

  public static PineconeClientException decode(String detail, Throwable cause) {
    return new PineconeClientException(
        Kind.DECODE, null, "JSON deserialization error: " + detail, cause);
  }

  public Kind getKind() {
    return kind;
  }

  /** HTTP status of the failed response, {@code null} when no response was received. */
  public Integer getStatus() {
    return status;
  }
}
