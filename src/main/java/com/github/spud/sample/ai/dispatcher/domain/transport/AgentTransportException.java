package com.github.spud.sample.ai.dispatcher.domain.transport;

/**
 * Transport-level failure of one attempt. The router recovers from it by moving on to the next
 * candidate, so it never reaches the caller directly.
 */
public class AgentTransportException extends RuntimeException {

  public enum Kind {
    TIMEOUT,
    UNREACHABLE,
    PROTOCOL
  }

  private final Kind kind;

  public AgentTransportException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public AgentTransportException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }

  public static AgentTransportException timeout(String message, Throwable cause) {
    return new AgentTransportException(Kind.TIMEOUT, message, cause);
  }

  public static AgentTransportException unreachable(String message, Throwable cause) {
    return new AgentTransportException(Kind.UNREACHABLE, message, cause);
  }

  public static AgentTransportException protocol(String message) {
    return new AgentTransportException(Kind.PROTOCOL, message);
  }

  public static AgentTransportException protocol(String message, Throwable cause) {
    return new AgentTransportException(Kind.PROTOCOL, message, cause);
  }
}
