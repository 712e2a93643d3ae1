/*
 * Where: Relay configuration
 * What: RestClients for the HTTP delivery providers
 * Why: Each provider gets its own base URL while sharing connect and read timeouts; APNs only
 *      speaks HTTP/2, so its client runs on the JDK HttpClient
 */
package com.mysocial.relay.config;

import java.net.http.HttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class ProviderClientConfig {

  @Bean
  RestClient resendRestClient(RestClient.Builder builder, ProviderEndpointProperties properties) {
    return builder
        .baseUrl(properties.resendBaseUrl())
        .requestFactory(requestFactory(properties))
        .build();
  }

  @Bean
  RestClient fcmRestClient(RestClient.Builder builder, ProviderEndpointProperties properties) {
    return builder
        .baseUrl(properties.fcmBaseUrl())
        .requestFactory(requestFactory(properties))
        .build();
  }

  /** No base URL: the production or sandbox host is chosen per platform config. */
  @Bean
  RestClient apnsRestClient(RestClient.Builder builder, ProviderEndpointProperties properties) {
    final HttpClient httpClient =
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_2)
            .connectTimeout(properties.connectTimeout())
            .build();
    final JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
    factory.setReadTimeout(properties.readTimeout());
    return builder.requestFactory(factory).build();
  }

  private static SimpleClientHttpRequestFactory requestFactory(
      ProviderEndpointProperties properties) {
    final SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(properties.connectTimeout());
    factory.setReadTimeout(properties.readTimeout());
    return factory;
  }
}
