/*
 * Where: Relay API response DTO
 * What: One decrypted direct message
 * Why: content is null with content_available=false when the ciphertext fails authentication
 */
package com.mysocial.relay.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MessageResponse(
    String id,
    String conversationId,
    String senderAddress,
    String recipientAddress,
    String content,
    String contentType,
    boolean contentAvailable,
    String createdAt) {}
