package com.flamingo.ai.lawindex.exception;

/** Exception thrown when the statute dataset cannot be read. */
public class LawSourceException extends RuntimeException {

  private final String source;
  private final String userMessage;

  public LawSourceException(String source, String message) {
    super(message);
    this.source = source;
    this.userMessage = "Failed to load law dataset";
  }

  public LawSourceException(String source, String message, Throwable cause) {
    super(message, cause);
    this.source = source;
    this.userMessage = "Failed to load law dataset";
  }

  public String getSource() {
    return source;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
