package com.flamingo.ai.tablerag.exception;

/** Exception thrown at startup when no model provider API key is configured. */
public class MissingCredentialException extends RuntimeException {

  public MissingCredentialException(String message) {
    super(message);
  }
}
