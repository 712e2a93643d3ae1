/*
 * Where: Relay notification pipeline
 * What: Reads, decrements and rebuilds the Redis unread counters
 * Why: Counters are a cache of relay_notifications and must heal when missing or drifted
 */
package com.mysocial.relay.service.notification;

import com.mysocial.relay.model.NotificationRecord;
import com.mysocial.relay.model.UnreadCounts;
import com.mysocial.relay.repository.NotificationRepository;
import com.mysocial.relay.repository.RedisUnreadCounterRepository;
import com.mysocial.relay.service.RelayMetrics;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class UnreadCounterService {

  private static final Logger logger = LoggerFactory.getLogger(UnreadCounterService.class);
  private static final int MAX_REBUILD_ATTEMPTS = 3;

  private final RedisUnreadCounterRepository counterRepository;
  private final NotificationRepository notificationRepository;
  private final RelayMetrics metrics;

  /**
   * Unread totals for a user. A missing counter triggers a rebuild; an unreachable Redis falls
   * back to counting rows.
   */
  public UnreadCounts counts(String userAddress, String platformId) {
    try {
      return readCounters(userAddress, platformId);
    } catch (DataAccessException ex) {
      logger.warn("unread counters unavailable; counting from database user={}", userAddress, ex);
      return fromDatabase(userAddress, platformId);
    }
  }

  /** Decrements both counters for a notification that just turned read. */
  public void decrement(String userAddress, String platformId) {
    try {
      final long total =
          counterRepository.decrement(
              userAddress, RedisUnreadCounterRepository.unreadKey(userAddress));
      boolean drifted = isDrift(total);
      if (platformId != null) {
        final long platform =
            counterRepository.decrement(
                userAddress,
                RedisUnreadCounterRepository.platformUnreadKey(userAddress, platformId));
        drifted = drifted || isDrift(platform);
      }
      if (drifted) {
        logger.info("unread counter drift detected; rebuilding user={}", userAddress);
        reconcile(userAddress);
      }
    } catch (DataAccessException ex) {
      logger.warn(
          "unread counter decrement failed user={} platformId={}", userAddress, platformId, ex);
    }
  }

  /**
   * Overwrites the counters of a user with values counted from relay_notifications. Rows whose
   * counters were applied in Redis but not yet stamped are included through their markers. The
   * write is skipped and the count retried when a counter changes during the recount.
   */
  public UnreadCounts reconcile(String userAddress) {
    UnreadCounts counts = null;
    for (int attempt = 1; attempt <= MAX_REBUILD_ATTEMPTS; attempt++) {
      final long epoch = counterRepository.epoch(userAddress);
      counts = recount(userAddress);
      if (counterRepository.overwrite(
          userAddress, epoch, counts.totalUnread(), counts.platformCounts())) {
        metrics.recordUnreadReconcile();
        return counts;
      }
      logger.debug("unread counters moved during rebuild user={} attempt={}", userAddress, attempt);
    }
    logger.warn(
        "unread counter rebuild kept racing; serving recounted values user={} attempts={}",
        userAddress,
        MAX_REBUILD_ATTEMPTS);
    return counts;
  }

  private UnreadCounts recount(String userAddress) {
    long total = notificationRepository.countUnread(userAddress);
    final Map<String, Long> byPlatform =
        new TreeMap<>(notificationRepository.countUnreadByPlatform(userAddress));
    final List<NotificationRecord> pendingRows =
        notificationRepository.findUnreadWithoutCounters(userAddress);
    for (NotificationRecord pending : pendingRows) {
      if (!counterRepository.isApplied(pending.id())) {
        continue;
      }
      total++;
      if (pending.platformId() != null) {
        byPlatform.merge(pending.platformId(), 1L, Long::sum);
      }
    }
    return new UnreadCounts(total, null, null, new LinkedHashMap<>(byPlatform));
  }

  private UnreadCounts readCounters(String userAddress, String platformId) {
    final Optional<Long> total =
        counterRepository.read(RedisUnreadCounterRepository.unreadKey(userAddress));
    if (total.isEmpty()) {
      return select(reconcile(userAddress), platformId);
    }
    final Set<String> indexed = counterRepository.platforms(userAddress);
    if (platformId != null) {
      final Optional<Long> platformUnread =
          counterRepository.read(
              RedisUnreadCounterRepository.platformUnreadKey(userAddress, platformId));
      if (platformUnread.isEmpty() && indexed.contains(platformId)) {
        return select(reconcile(userAddress), platformId);
      }
      // a platform never indexed has never had an unread notification applied
      return new UnreadCounts(total.get(), platformId, platformUnread.orElse(0L), Map.of());
    }
    final Map<String, Long> byPlatform = new LinkedHashMap<>();
    for (String platform : new TreeSet<>(indexed)) {
      final Optional<Long> count =
          counterRepository.read(
              RedisUnreadCounterRepository.platformUnreadKey(userAddress, platform));
      if (count.isEmpty()) {
        return reconcile(userAddress);
      }
      byPlatform.put(platform, count.get());
    }
    return new UnreadCounts(total.get(), null, null, byPlatform);
  }

  private UnreadCounts fromDatabase(String userAddress, String platformId) {
    final long total = notificationRepository.countUnread(userAddress);
    final Map<String, Long> byPlatform = notificationRepository.countUnreadByPlatform(userAddress);
    return select(new UnreadCounts(total, null, null, byPlatform), platformId);
  }

  private static UnreadCounts select(UnreadCounts counts, String platformId) {
    if (platformId == null) {
      return counts;
    }
    return new UnreadCounts(
        counts.totalUnread(),
        platformId,
        counts.platformCounts().getOrDefault(platformId, 0L),
        Map.of());
  }

  private static boolean isDrift(long result) {
    return result == RedisUnreadCounterRepository.CLAMPED
        || result == RedisUnreadCounterRepository.MISSING;
  }
}
