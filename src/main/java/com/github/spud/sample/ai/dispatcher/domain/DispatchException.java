package com.github.spud.sample.ai.dispatcher.domain;

/**
 * Base type of every caller-visible dispatcher failure. The code is stable and is what the REST
 * layer reports.
 */
public class DispatchException extends RuntimeException {

  private final String code;

  public DispatchException(String code, String message) {
    super(message);
    this.code = code;
  }

  public DispatchException(String code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
