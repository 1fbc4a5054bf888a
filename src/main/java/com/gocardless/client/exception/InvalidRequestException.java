package com.gocardless.client.exception;

import java.util.List;

/**
 * Thrown when a request object fails client-side validation before anything is sent.
 * Carries every validation error so they can be reported together.
 */
public class InvalidRequestException extends GoCardlessException {

  private final List<String> errors;

  public InvalidRequestException(List<String> errors) {
    super("Invalid request: " + String.join(", ", errors));
    this.errors = List.copyOf(errors);
  }

  public List<String> getErrors() {
    return errors;
  }
}
