package com.mysocial.relay.provider;

import com.mysocial.common.event.DeliveryChannel;
import com.mysocial.relay.model.DeliveryConfig;
import java.util.Optional;

/** Builds a {@link ProviderClient} for a resolved credential set. */
public interface ProviderClientFactory {

  DeliveryChannel channel();

  /** Empty when the credential set is incomplete for this channel. */
  Optional<ProviderClient> create(DeliveryConfig config);
}
