package com.mysocial.relay.model;

import java.time.Instant;
import java.util.UUID;

public record MessageRecord(
    UUID id,
    String conversationId,
    String senderAddress,
    String recipientAddress,
    EncryptedContent content,
    String contentType,
    Long sourceId,
    Instant createdAt) {}
