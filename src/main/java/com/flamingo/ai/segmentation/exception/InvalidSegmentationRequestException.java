package com.flamingo.ai.segmentation.exception;

/** Exception thrown when segmentation options are out of range. */
public class InvalidSegmentationRequestException extends RuntimeException {

  private final String userMessage;

  public InvalidSegmentationRequestException(String message) {
    super(message);
    this.userMessage = message;
  }

  public InvalidSegmentationRequestException(String message, String userMessage) {
    super(message);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
