package com.flamingo.ai.lawindex.exception;

/** Exception thrown when article records cannot be embedded or stored. */
public class ArticleIndexingException extends RuntimeException {

  private final String userMessage;

  public ArticleIndexingException(String message) {
    super(message);
    this.userMessage = "Indexing is temporarily unavailable. Please try again.";
  }

  public ArticleIndexingException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Indexing is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
