/*
 * Where: Relay data access (Redis)
 * What: Recent-message cache per conversation and the per-user real-time chat stream
 * Why: The WebSocket gateway reads STREAM:CHAT:{user} to push new messages to connected clients
 */
package com.mysocial.relay.repository;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "StringRedisTemplate is a shared Spring-managed component")
public class RedisChatRepository {

  static final String STREAM_DATA_FIELD = "data";

  private final StringRedisTemplate redisTemplate;

  public static String chatKey(String conversationId) {
    return "CHAT:" + conversationId;
  }

  public static String chatStreamKey(String userAddress) {
    return "STREAM:CHAT:" + userAddress;
  }

  public void cacheRecentMessage(String conversationId, String entry, int cacheSize) {
    final String key = chatKey(conversationId);
    redisTemplate.opsForList().leftPush(key, entry);
    redisTemplate.opsForList().trim(key, 0, cacheSize - 1L);
  }

  public RecordId appendToChatStream(String recipientAddress, String data, long maxLength) {
    final String key = chatStreamKey(recipientAddress);
    final RecordId recordId =
        redisTemplate
            .opsForStream()
            .add(StreamRecords.newRecord().in(key).ofMap(Map.of(STREAM_DATA_FIELD, data)));
    redisTemplate.opsForStream().trim(key, maxLength, true);
    return recordId;
  }
}
