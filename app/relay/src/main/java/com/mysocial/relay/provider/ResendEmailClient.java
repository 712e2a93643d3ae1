/*
 * Where: Relay delivery providers
 * What: Sends notification emails through the Resend HTTP API
 * Why: One client per resolved credential set, so platforms can use their own sender
 */
package com.mysocial.relay.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mysocial.common.event.DeliveryChannel;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.HtmlUtils;

public class ResendEmailClient implements ProviderClient {

  private static final Logger logger = LoggerFactory.getLogger(ResendEmailClient.class);
  private static final String PROVIDER = "resend";
  private static final String HTML_TEMPLATE =
      """
      <!DOCTYPE html>
      <html>
      <head><meta charset="UTF-8"></head>
      <body style="font-family: -apple-system, 'Segoe UI', Roboto, Arial, sans-serif; color: #333;">
        <h1 style="font-size: 24px;">%s</h1>
        <p style="font-size: 16px;">%s</p>
        <p style="font-size: 14px; color: #6c757d;">This is a notification from MySocial.</p>
      </body>
      </html>
      """;

  private final RestClient restClient;
  private final String emailsPath;
  private final String apiKey;
  private final String fromEmail;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  public ResendEmailClient(
      RestClient restClient, String emailsPath, String apiKey, String fromEmail) {
    this.restClient = restClient;
    this.emailsPath = emailsPath;
    this.apiKey = apiKey;
    this.fromEmail = fromEmail;
  }

  @Override
  public DeliveryChannel channel() {
    return DeliveryChannel.EMAIL;
  }

  @Override
  public void send(String destination, DeliveryContent content) {
    if (destination == null || destination.isBlank()) {
      throw new ProviderException(
          ProviderException.Reason.INVALID_DESTINATION, "email address is required");
    }
    final String subject = content.title() == null ? "Notification" : content.title();
    final String body = content.body() == null ? "You have a new notification" : content.body();
    final ResendEmailRequest request =
        new ResendEmailRequest(
            fromEmail,
            List.of(destination),
            subject,
            HTML_TEMPLATE.formatted(HtmlUtils.htmlEscape(subject), HtmlUtils.htmlEscape(body)),
            body);
    final ResendEmailResponse response;
    try {
      response =
          restClient
              .post()
              .uri(emailsPath)
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
              .contentType(MediaType.APPLICATION_JSON)
              .body(request)
              .retrieve()
              .body(ResendEmailResponse.class);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "resend send failed with http status={} statusText={}",
          ex.getStatusCode().value(),
          ex.getStatusText());
      throw HttpProviderErrors.fromResponse(PROVIDER, ex);
    } catch (ResourceAccessException ex) {
      throw HttpProviderErrors.fromResourceAccess(PROVIDER, ex);
    } catch (RuntimeException ex) {
      throw new ProviderException(
          ProviderException.Reason.INVALID_RESPONSE, "resend response parse failed", ex);
    }
    if (response == null || response.id() == null || response.id().isBlank()) {
      throw new ProviderException(
          ProviderException.Reason.INVALID_RESPONSE, "resend response has no email id");
    }
    logger.debug("email sent via resend emailId={}", response.id());
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  record ResendEmailRequest(
      String from, List<String> to, String subject, String html, String text) {}

  record ResendEmailResponse(String id) {}
}
