package com.mysocial.relay.provider;

import com.mysocial.common.event.DeliveryChannel;

/** Sends one notification to one destination through a push or email provider. */
public interface ProviderClient {

  DeliveryChannel channel();

  /**
   * @param destination device token for push channels, email address for email
   * @throws ProviderException when the provider did not accept the notification
   */
  void send(String destination, DeliveryContent content);
}
