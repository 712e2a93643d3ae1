/*
 * Where: Relay delivery providers
 * What: Maps RestClient failures to ProviderException reasons
 * Why: Resend and FCM share the same HTTP failure taxonomy
 */
package com.mysocial.relay.provider;

import java.net.SocketTimeoutException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

final class HttpProviderErrors {

  private HttpProviderErrors() {}

  static ProviderException fromResponse(String provider, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    if (status == 401 || status == 403) {
      return new ProviderException(
          ProviderException.Reason.UNAUTHORIZED, provider + " rejected credentials", ex);
    }
    if (status == 429) {
      return new ProviderException(
          ProviderException.Reason.RATE_LIMITED, provider + " rate limited the request", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new ProviderException(
          ProviderException.Reason.UNAVAILABLE, provider + " server error status=" + status, ex);
    }
    return new ProviderException(
        ProviderException.Reason.REJECTED, provider + " rejected the request status=" + status, ex);
  }

  static ProviderException fromResourceAccess(String provider, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      return new ProviderException(
          ProviderException.Reason.TIMEOUT, provider + " request timeout", ex);
    }
    return new ProviderException(
        ProviderException.Reason.UNAVAILABLE, provider + " connection failed", ex);
  }

  private static boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
