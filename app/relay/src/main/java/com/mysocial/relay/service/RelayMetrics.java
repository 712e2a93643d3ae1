/*
 * Where: Relay service layer
 * What: Application metrics for the poller, the consumers and the delivery channels
 * Why: Lag, dead letters and dropped deliveries must be visible on Prometheus
 */
package com.mysocial.relay.service;

import com.mysocial.common.event.DeliveryChannel;
import com.mysocial.relay.model.ConsumerPipeline;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class RelayMetrics {

  private static final String METRIC_OUTBOX_PUBLISHED_TOTAL = "relay.outbox.published.total";
  private static final String METRIC_OUTBOX_FAILURE_TOTAL = "relay.outbox.failure.total";
  private static final String METRIC_OUTBOX_PUBLISH_DELAY = "relay.outbox.publish.delay";
  private static final String METRIC_OUTBOX_EXHAUSTED_CURRENT = "relay.outbox.exhausted.current";
  private static final String METRIC_OUTBOX_FAILED_POLLS_CURRENT =
      "relay.outbox.failed.polls.current";
  private static final String METRIC_CONSUMER_TOTAL = "relay.consumer.messages.total";
  private static final String METRIC_DEAD_LETTER_TOTAL = "relay.dead_letter.total";
  private static final String METRIC_NOTIFICATION_CREATED_TOTAL =
      "relay.notification.created.total";
  private static final String METRIC_UNREAD_RECONCILE_TOTAL = "relay.unread.reconcile.total";
  private static final String METRIC_MESSAGE_STORED_TOTAL = "relay.message.stored.total";
  private static final String METRIC_DELIVERY_CHANNEL_TOTAL = "relay.delivery.channel.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger outboxExhaustedCurrent = new AtomicInteger(0);
  private final AtomicInteger outboxFailedPollsCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> taggedCounters = new ConcurrentHashMap<>();
  private final Counter outboxPublishedCounter;
  private final Counter outboxFailureCounter;
  private final Counter notificationCreatedCounter;
  private final Counter unreadReconcileCounter;
  private final Timer outboxPublishDelayTimer;

  public RelayMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_OUTBOX_EXHAUSTED_CURRENT, outboxExhaustedCurrent, AtomicInteger::get)
        .description("Outbox rows left behind after exhausting their publish attempts")
        .register(meterRegistry);
    Gauge.builder(
            METRIC_OUTBOX_FAILED_POLLS_CURRENT, outboxFailedPollsCurrent, AtomicInteger::get)
        .description("Consecutive failed outbox polls")
        .register(meterRegistry);
    this.outboxPublishedCounter =
        Counter.builder(METRIC_OUTBOX_PUBLISHED_TOTAL)
            .description("Outbox rows published to JetStream")
            .register(meterRegistry);
    this.outboxFailureCounter =
        Counter.builder(METRIC_OUTBOX_FAILURE_TOTAL)
            .description("Outbox publish attempts that failed")
            .register(meterRegistry);
    this.notificationCreatedCounter =
        Counter.builder(METRIC_NOTIFICATION_CREATED_TOTAL)
            .description("Notifications inserted for a recipient")
            .register(meterRegistry);
    this.unreadReconcileCounter =
        Counter.builder(METRIC_UNREAD_RECONCILE_TOTAL)
            .description("Unread counter rebuilds from the notification table")
            .register(meterRegistry);
    this.outboxPublishDelayTimer =
        Timer.builder(METRIC_OUTBOX_PUBLISH_DELAY)
            .description("Delay from outbox row creation to JetStream publish ack")
            .register(meterRegistry);
  }

  public void recordOutboxPublished(Instant createdAt, Instant publishedAt) {
    outboxPublishedCounter.increment();
    if (createdAt == null || publishedAt == null || publishedAt.isBefore(createdAt)) {
      return;
    }
    outboxPublishDelayTimer.record(Duration.between(createdAt, publishedAt));
  }

  public void recordOutboxFailure() {
    outboxFailureCounter.increment();
  }

  public void updateOutboxExhaustedCurrent(int exhaustedCount) {
    outboxExhaustedCurrent.set(Math.max(exhaustedCount, 0));
  }

  public void updateOutboxFailedPolls(int failedPolls) {
    outboxFailedPollsCurrent.set(Math.max(failedPolls, 0));
  }

  public void recordConsumerResult(ConsumerPipeline pipeline, String result) {
    tagged(
            METRIC_CONSUMER_TOTAL,
            "JetStream messages handled by relay consumers",
            Tags.of("pipeline", pipeline.tag(), "result", result))
        .increment();
  }

  public void recordDeadLetter(ConsumerPipeline pipeline) {
    tagged(
            METRIC_DEAD_LETTER_TOTAL,
            "Messages moved to relay_dead_letters",
            Tags.of("pipeline", pipeline.tag()))
        .increment();
  }

  public void recordNotificationCreated() {
    notificationCreatedCounter.increment();
  }

  public void recordUnreadReconcile() {
    unreadReconcileCounter.increment();
  }

  public void recordMessageStored(String source) {
    tagged(
            METRIC_MESSAGE_STORED_TOTAL,
            "Encrypted direct messages stored",
            Tags.of("source", source))
        .increment();
  }

  public void recordDeliveryChannel(DeliveryChannel channel, String result) {
    tagged(
            METRIC_DELIVERY_CHANNEL_TOTAL,
            "Delivery channel outcomes",
            Tags.of("channel", channel.name().toLowerCase(Locale.ROOT), "result", result))
        .increment();
  }

  private Counter tagged(String name, String description, Tags tags) {
    final StringBuilder key = new StringBuilder(name);
    tags.forEach(tag -> key.append('|').append(tag.getKey()).append('=').append(tag.getValue()));
    return taggedCounters.computeIfAbsent(
        key.toString(),
        ignored ->
            Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
