package com.mysocial.relay.provider;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.net.ConnectException;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class FcmPushClientTest {

  private static final DeliveryContent CONTENT =
      new DeliveryContent(
          "New Follower", "alice followed you", "follow", Map.of("notification_id", "n-7"));

  @Test
  void sendPostsNotificationWithServerKey() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://fcm.test/fcm/send"))
        .andExpect(method(POST))
        .andExpect(header("Authorization", "key=fcm-key"))
        .andExpect(jsonPath("$.to").value("android-token"))
        .andExpect(jsonPath("$.notification.title").value("New Follower"))
        .andExpect(jsonPath("$.notification.body").value("alice followed you"))
        .andExpect(jsonPath("$.data.notification_id").value("n-7"))
        .andRespond(
            withSuccess(
                """
                {"multicast_id":1,"success":1,"failure":0,"canonical_ids":0,
                "results":[{"message_id":"0:1"}]}
                """,
                MediaType.APPLICATION_JSON));

    assertThatCode(() -> fixture.client.send("android-token", CONTENT)).doesNotThrowAnyException();
    fixture.server.verify();
  }

  @ParameterizedTest
  @CsvSource({
    "NotRegistered, INVALID_DESTINATION",
    "InvalidRegistration, INVALID_DESTINATION",
    "Unavailable, UNAVAILABLE",
    "MessageTooBig, REJECTED"
  })
  void resultErrorsAreClassified(String error, ProviderException.Reason reason) {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://fcm.test/fcm/send"))
        .andRespond(
            withSuccess(
                "{\"multicast_id\":1,\"success\":0,\"failure\":1,\"results\":[{\"error\":\""
                    + error
                    + "\"}]}",
                MediaType.APPLICATION_JSON));

    assertReason(fixture, reason);
  }

  @Test
  void forbiddenIsUnauthorized() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://fcm.test/fcm/send"))
        .andRespond(withStatus(HttpStatus.FORBIDDEN));

    assertReason(fixture, ProviderException.Reason.UNAUTHORIZED);
  }

  @Test
  void connectionFailureIsUnavailable() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://fcm.test/fcm/send"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    assertReason(fixture, ProviderException.Reason.UNAVAILABLE);
  }

  private static void assertReason(ClientFixture fixture, ProviderException.Reason reason) {
    assertThatThrownBy(() -> fixture.client.send("android-token", CONTENT))
        .isInstanceOf(ProviderException.class)
        .extracting(ex -> ((ProviderException) ex).reason())
        .isEqualTo(reason);
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://fcm.test").build();
    return new ClientFixture(new FcmPushClient(restClient, "/fcm/send", "fcm-key"), server);
  }

  private record ClientFixture(FcmPushClient client, MockRestServiceServer server) {}
}
