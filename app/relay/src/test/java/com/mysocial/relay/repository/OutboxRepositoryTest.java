/*
 * Where: Relay outbox data access integration test
 * What: Unprocessed scan order, retry bookkeeping and the leased cursor against Postgres
 */
package com.mysocial.relay.repository;

import static com.mysocial.common.JdbcTimestampUtils.toInstant;
import static com.mysocial.common.JdbcTimestampUtils.toTimestamp;
import static org.assertj.core.api.Assertions.assertThat;

import com.mysocial.relay.AbstractPostgresContainerTest;
import com.mysocial.relay.model.OutboxRecord;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class OutboxRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-01-17T00:00:00Z");
  private static final String CURSOR = "relay-outbox";
  // far above the sequence values other tests draw
  private static final long LATE_LOWER_ID = 1_000_010L;
  private static final long LATE_HIGHER_ID = 1_000_011L;

  @Autowired private OutboxRepository outboxRepository;
  @Autowired private OutboxCursorRepository cursorRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM relay_outbox", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM relay_outbox_cursor", new MapSqlParameterSource());
  }

  @Test
  void findUnprocessedAfterSkipsProcessedAndExhaustedRowsInIdOrder() {
    final long first = insertOutboxRow("post.created", "{\"post_id\":\"p-1\"}", 0, null);
    final long processed = insertOutboxRow("post.created", "{}", 0, null);
    final long exhausted = insertOutboxRow("reaction.added", "{}", 3, null);
    final long waiting = insertOutboxRow("reaction.added", "{}", 1, BASE_TIME.plusSeconds(30));
    outboxRepository.markProcessed(processed, BASE_TIME);

    final List<OutboxRecord> rows = outboxRepository.findUnprocessedAfter(0L, 3, 10);

    assertThat(rows).extracting(OutboxRecord::id).containsExactly(first, waiting);
    assertThat(rows.get(0).payloadJson()).contains("\"post_id\"");
    assertThat(rows.get(1).nextRetryAt()).isEqualTo(BASE_TIME.plusSeconds(30));
    assertThat(outboxRepository.countExhausted(3)).isEqualTo(1);
    assertThat(outboxRepository.findUnprocessedAfter(exhausted, 3, 10))
        .extracting(OutboxRecord::id)
        .containsExactly(waiting);
  }

  @Test
  void rowCommittedBelowTheCursorIsFoundWithinTheLookbackWindow() {
    cursorRepository.claimLease(CURSOR, "relay-1", BASE_TIME, BASE_TIME.plusSeconds(30));
    insertOutboxRowWithId(LATE_HIGHER_ID, "post.created");
    outboxRepository.markProcessed(LATE_HIGHER_ID, BASE_TIME);
    cursorRepository.advance(CURSOR, "relay-1", LATE_HIGHER_ID, BASE_TIME);

    insertOutboxRowWithId(LATE_LOWER_ID, "comment.created");
    final long cursor =
        cursorRepository
            .claimLease(CURSOR, "relay-1", BASE_TIME.plusSeconds(1), BASE_TIME.plusSeconds(31))
            .orElseThrow();

    assertThat(cursor).isEqualTo(LATE_HIGHER_ID);
    assertThat(outboxRepository.findUnprocessedAfter(cursor, 3, 10)).isEmpty();
    assertThat(outboxRepository.findUnprocessedAfter(Math.max(0L, cursor - 1000L), 3, 10))
        .extracting(OutboxRecord::id)
        .containsExactly(LATE_LOWER_ID);
  }

  @Test
  void markProcessedIsOneShot() {
    final long id = insertOutboxRow("post.created", "{}", 1, BASE_TIME);

    assertThat(outboxRepository.markProcessed(id, BASE_TIME)).isEqualTo(1);
    assertThat(outboxRepository.markProcessed(id, BASE_TIME.plusSeconds(5))).isZero();
    assertThat(fetchTimestamp(id, "processed_at")).isEqualTo(BASE_TIME);
    assertThat(fetchTimestamp(id, "next_retry_at")).isNull();
  }

  @Test
  void markFailureStoresRetryState() {
    final long id = insertOutboxRow("post.created", "{}", 0, null);

    final int updated =
        outboxRepository.markFailure(id, 1, BASE_TIME.plusSeconds(2), "nats timeout");

    assertThat(updated).isEqualTo(1);
    final OutboxRecord row = outboxRepository.findUnprocessedAfter(0L, 3, 10).get(0);
    assertThat(row.retryCount()).isEqualTo(1);
    assertThat(row.nextRetryAt()).isEqualTo(BASE_TIME.plusSeconds(2));
    assertThat(
            jdbcTemplate.queryForObject(
                "SELECT error_message FROM relay_outbox WHERE id = :id",
                new MapSqlParameterSource("id", id),
                String.class))
        .isEqualTo("nats timeout");
  }

  @Test
  void cursorLeaseIsExclusiveUntilExpiry() {
    final Instant leaseUntil = BASE_TIME.plusSeconds(30);

    final OptionalLong first =
        cursorRepository.claimLease(CURSOR, "relay-1", BASE_TIME, leaseUntil);
    final OptionalLong contended =
        cursorRepository.claimLease(CURSOR, "relay-2", BASE_TIME.plusSeconds(1), leaseUntil);
    final OptionalLong afterExpiry =
        cursorRepository.claimLease(
            CURSOR, "relay-2", leaseUntil.plusSeconds(1), leaseUntil.plusSeconds(31));

    assertThat(first).hasValue(0L);
    assertThat(contended).isEmpty();
    assertThat(afterExpiry).hasValue(0L);
  }

  @Test
  void advanceNeverMovesBackwardsAndRequiresTheLeaseHolder() {
    cursorRepository.claimLease(CURSOR, "relay-1", BASE_TIME, BASE_TIME.plusSeconds(30));

    assertThat(cursorRepository.advance(CURSOR, "relay-1", 42L, BASE_TIME)).isEqualTo(1);
    assertThat(cursorRepository.advance(CURSOR, "relay-1", 17L, BASE_TIME)).isEqualTo(1);
    assertThat(cursorRepository.advance(CURSOR, "relay-2", 99L, BASE_TIME)).isZero();

    final OptionalLong renewed =
        cursorRepository.claimLease(
            CURSOR, "relay-1", BASE_TIME.plusSeconds(5), BASE_TIME.plusSeconds(35));
    assertThat(renewed).hasValue(42L);
  }

  @Test
  void releasedLeaseCanBeTakenImmediately() {
    cursorRepository.claimLease(CURSOR, "relay-1", BASE_TIME, BASE_TIME.plusSeconds(30));
    cursorRepository.advance(CURSOR, "relay-1", 7L, BASE_TIME);

    assertThat(cursorRepository.releaseLease(CURSOR, "relay-1", BASE_TIME)).isEqualTo(1);

    assertThat(
            cursorRepository.claimLease(
                CURSOR, "relay-2", BASE_TIME.plusSeconds(1), BASE_TIME.plusSeconds(31)))
        .hasValue(7L);
  }

  private long insertOutboxRow(
      String eventType, String payload, int retryCount, Instant nextRetryAt) {
    final Long id =
        jdbcTemplate.queryForObject(
            """
            INSERT INTO relay_outbox (
              event_type, event_data, event_id, platform_id, created_at, retry_count, next_retry_at
            ) VALUES (
              :eventType, CAST(:payload AS JSONB), :eventId, 'platform-1', :createdAt,
              :retryCount, :nextRetryAt
            )
            RETURNING id
            """,
            new MapSqlParameterSource()
                .addValue("eventType", eventType)
                .addValue("payload", payload)
                .addValue("eventId", "evt-" + eventType)
                .addValue("createdAt", toTimestamp(BASE_TIME))
                .addValue("retryCount", retryCount)
                .addValue("nextRetryAt", toTimestamp(nextRetryAt), Types.TIMESTAMP),
            Long.class);
    return id == null ? -1L : id;
  }

  private void insertOutboxRowWithId(long id, String eventType) {
    jdbcTemplate.update(
        """
        INSERT INTO relay_outbox (id, event_type, event_data, event_id, platform_id, created_at)
        VALUES (:id, :eventType, CAST('{}' AS JSONB), :eventId, 'platform-1', :createdAt)
        """,
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("eventType", eventType)
            .addValue("eventId", "evt-" + id)
            .addValue("createdAt", toTimestamp(BASE_TIME)));
  }

  private Instant fetchTimestamp(long id, String column) {
    final Timestamp value =
        jdbcTemplate.queryForObject(
            "SELECT " + column + " FROM relay_outbox WHERE id = :id",
            new MapSqlParameterSource("id", id),
            Timestamp.class);
    return toInstant(value);
  }
}
