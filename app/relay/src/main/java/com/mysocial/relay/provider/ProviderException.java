/*
 * Where: Relay delivery providers
 * What: Failure of a single provider send
 * Why: The dispatcher retries only retryable reasons and isolates each channel
 */
package com.mysocial.relay.provider;

public class ProviderException extends RuntimeException {

  public enum Reason {
    TIMEOUT(true),
    UNAVAILABLE(true),
    RATE_LIMITED(true),
    UNAUTHORIZED(false),
    REJECTED(false),
    INVALID_DESTINATION(false),
    INVALID_RESPONSE(false),
    MISCONFIGURED(false);

    private final boolean retryable;

    Reason(boolean retryable) {
      this.retryable = retryable;
    }
  }

  private final Reason reason;

  public ProviderException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public ProviderException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  public boolean retryable() {
    return reason.retryable;
  }
}
