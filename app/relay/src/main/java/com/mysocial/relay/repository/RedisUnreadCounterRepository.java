/*
 * Where: Relay data access (Redis)
 * What: Unread counters, the per-user platform index and the recent-notification inbox
 * Why: Counters are changed only by atomic Lua scripts so concurrent consumers never race
 */
package com.mysocial.relay.repository;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

@Repository
public class RedisUnreadCounterRepository {

  /** Result of a clamped decrement when the counter already sat at zero. */
  public static final long CLAMPED = -1L;

  /** Result of a clamped decrement when the counter key does not exist. */
  public static final long MISSING = -2L;

  private static final String UNREAD_PREFIX = "UNREAD:";
  private static final String PLATFORMS_PREFIX = "UNREAD_PLATFORMS:";
  private static final String INBOX_PREFIX = "INBOX:";
  private static final String APPLIED_PREFIX = "UNREAD_APPLIED:";
  private static final String EPOCH_PREFIX = "UNREAD_EPOCH:";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate is a shared Spring-managed component")
  private final StringRedisTemplate redisTemplate;

  private final RedisScript<Long> applyNotificationScript;
  private final RedisScript<Long> decrementUnreadScript;
  private final RedisScript<Long> rebuildUnreadScript;

  public RedisUnreadCounterRepository(
      StringRedisTemplate redisTemplate,
      @Qualifier("applyNotificationScript") RedisScript<Long> applyNotificationScript,
      @Qualifier("decrementUnreadScript") RedisScript<Long> decrementUnreadScript,
      @Qualifier("rebuildUnreadScript") RedisScript<Long> rebuildUnreadScript) {
    this.redisTemplate = redisTemplate;
    this.applyNotificationScript = applyNotificationScript;
    this.decrementUnreadScript = decrementUnreadScript;
    this.rebuildUnreadScript = rebuildUnreadScript;
  }

  public static String unreadKey(String userAddress) {
    return UNREAD_PREFIX + userAddress;
  }

  public static String platformUnreadKey(String userAddress, String platformId) {
    return UNREAD_PREFIX + userAddress + ":" + platformId;
  }

  public static String platformsKey(String userAddress) {
    return PLATFORMS_PREFIX + userAddress;
  }

  public static String inboxKey(String userAddress) {
    return INBOX_PREFIX + userAddress;
  }

  public static String appliedKey(UUID notificationId) {
    return APPLIED_PREFIX + notificationId;
  }

  /** Bumped by every counter change; a rebuild only writes when it has not moved. */
  public static String epochKey(String userAddress) {
    return EPOCH_PREFIX + userAddress;
  }

  /**
   * Increments the global and platform counters and pushes the inbox entry, once per
   * notification id.
   *
   * <p>A missing counter is not created here; the next {@link #overwrite} counts the notification.
   */
  public ApplyResult applyNotification(
      UUID notificationId,
      String userAddress,
      String platformId,
      String inboxEntry,
      int inboxSize,
      Duration markerTtl) {
    final List<String> keys = new ArrayList<>();
    keys.add(appliedKey(notificationId));
    keys.add(unreadKey(userAddress));
    keys.add(inboxKey(userAddress));
    keys.add(epochKey(userAddress));
    final List<String> args = new ArrayList<>();
    args.add(Long.toString(Math.max(markerTtl.toSeconds(), 1L)));
    args.add(inboxEntry);
    args.add(Integer.toString(inboxSize));
    if (platformId != null) {
      keys.add(platformUnreadKey(userAddress, platformId));
      keys.add(platformsKey(userAddress));
      args.add(platformId);
    }
    final Long result =
        redisTemplate.execute(applyNotificationScript, keys, args.toArray(new Object[0]));
    return ApplyResult.fromScript(result);
  }

  /**
   * Decrements one counter, clamped at zero.
   *
   * @return the new value, {@link #CLAMPED} or {@link #MISSING}
   */
  public long decrement(String userAddress, String counterKey) {
    final Long result =
        redisTemplate.execute(decrementUnreadScript, List.of(counterKey, epochKey(userAddress)));
    return result == null ? MISSING : result;
  }

  public long epoch(String userAddress) {
    final String value = redisTemplate.opsForValue().get(epochKey(userAddress));
    return value == null ? 0L : Long.parseLong(value);
  }

  /** Whether the unread counters already include this notification. */
  public boolean isApplied(UUID notificationId) {
    return Boolean.TRUE.equals(redisTemplate.hasKey(appliedKey(notificationId)));
  }

  public Optional<Long> read(String counterKey) {
    final String value = redisTemplate.opsForValue().get(counterKey);
    if (value == null) {
      return Optional.empty();
    }
    return Optional.of(Math.max(Long.parseLong(value), 0L));
  }

  public Set<String> platforms(String userAddress) {
    final Set<String> members = redisTemplate.opsForSet().members(platformsKey(userAddress));
    return members == null ? Set.of() : members;
  }

  /**
   * Replaces the counters of a user with values recounted from the notification table. Platforms
   * already indexed but absent from {@code platformUnread} are reset to zero.
   *
   * @param expectedEpoch {@link #epoch} read before the recount
   * @return false without writing when a counter changed since {@code expectedEpoch}
   */
  public boolean overwrite(
      String userAddress, long expectedEpoch, long totalUnread, Map<String, Long> platformUnread) {
    final Set<String> platforms = new TreeSet<>(platforms(userAddress));
    platforms.addAll(platformUnread.keySet());
    final List<String> keys = new ArrayList<>();
    keys.add(epochKey(userAddress));
    keys.add(unreadKey(userAddress));
    keys.add(platformsKey(userAddress));
    final List<String> args = new ArrayList<>();
    args.add(Long.toString(expectedEpoch));
    args.add(Long.toString(totalUnread));
    for (String platformId : platforms) {
      keys.add(platformUnreadKey(userAddress, platformId));
      args.add(platformId);
      args.add(Long.toString(platformUnread.getOrDefault(platformId, 0L)));
    }
    final Long result =
        redisTemplate.execute(rebuildUnreadScript, keys, args.toArray(new Object[0]));
    return result != null && result > 0;
  }

  public enum ApplyResult {
    ALREADY_APPLIED,
    APPLIED,
    /** Marker set and counted by the next rebuild; the missing counter was not created. */
    COUNTER_MISSING;

    static ApplyResult fromScript(Long result) {
      if (result == null || result == 0L) {
        return ALREADY_APPLIED;
      }
      return result == 1L ? APPLIED : COUNTER_MISSING;
    }
  }
}
