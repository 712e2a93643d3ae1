package com.mysocial.relay.service.messaging;

import com.mysocial.relay.model.MessageRecord;

/** Result of storing a message; {@code created} is false when the source id was seen before. */
public record StoredMessage(MessageRecord message, boolean created) {}
