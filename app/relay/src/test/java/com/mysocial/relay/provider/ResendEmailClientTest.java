package com.mysocial.relay.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.net.SocketTimeoutException;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class ResendEmailClientTest {

  private static final DeliveryContent CONTENT =
      new DeliveryContent("New <Reply>", "alice replied", "reply", Map.of());

  @Test
  void sendPostsEscapedHtmlWithBearerKey() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://resend.test/emails"))
        .andExpect(method(POST))
        .andExpect(header("Authorization", "Bearer re_test"))
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.from").value("noreply@mysocial.network"))
        .andExpect(jsonPath("$.to[0]").value("bob@mail.xyz"))
        .andExpect(jsonPath("$.subject").value("New <Reply>"))
        .andExpect(jsonPath("$.text").value("alice replied"))
        .andExpect(jsonPath("$.html").value(containsString("New &lt;Reply&gt;")))
        .andRespond(withSuccess("{\"id\":\"email-1\"}", MediaType.APPLICATION_JSON));

    assertThatCode(() -> fixture.client.send("bob@mail.xyz", CONTENT)).doesNotThrowAnyException();
    fixture.server.verify();
  }

  @Test
  void missingEmailIdIsInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://resend.test/emails"))
        .andRespond(withSuccess("{\"foo\":\"bar\"}", MediaType.APPLICATION_JSON));

    assertReason(fixture, ProviderException.Reason.INVALID_RESPONSE);
  }

  @Test
  void unauthorizedIsNotRetryable() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://resend.test/emails"))
        .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertThatThrownBy(() -> fixture.client.send("bob@mail.xyz", CONTENT))
        .isInstanceOf(ProviderException.class)
        .satisfies(
            ex -> {
              final ProviderException failure = (ProviderException) ex;
              assertThat(failure.reason())
                  .isEqualTo(ProviderException.Reason.UNAUTHORIZED);
              assertThat(failure.retryable()).isFalse();
            });
  }

  @Test
  void rateLimitAndServerErrorsAreRetryable() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://resend.test/emails"))
        .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
    fixture.server.expect(requestTo("http://resend.test/emails")).andRespond(withServerError());

    assertReason(fixture, ProviderException.Reason.RATE_LIMITED);
    assertReason(fixture, ProviderException.Reason.UNAVAILABLE);
  }

  @Test
  void timeoutIsMappedToTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://resend.test/emails"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertReason(fixture, ProviderException.Reason.TIMEOUT);
  }

  @Test
  void blankAddressIsRejectedWithoutCallingResend() {
    final ClientFixture fixture = newFixture();

    assertThatThrownBy(() -> fixture.client.send(" ", CONTENT))
        .isInstanceOf(ProviderException.class)
        .extracting(ex -> ((ProviderException) ex).reason())
        .isEqualTo(ProviderException.Reason.INVALID_DESTINATION);
    fixture.server.verify();
  }

  private static void assertReason(ClientFixture fixture, ProviderException.Reason reason) {
    assertThatThrownBy(() -> fixture.client.send("bob@mail.xyz", CONTENT))
        .isInstanceOf(ProviderException.class)
        .extracting(ex -> ((ProviderException) ex).reason())
        .isEqualTo(reason);
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://resend.test").build();
    return new ClientFixture(
        new ResendEmailClient(restClient, "/emails", "re_test", "noreply@mysocial.network"),
        server);
  }

  private record ClientFixture(ResendEmailClient client, MockRestServiceServer server) {}
}
