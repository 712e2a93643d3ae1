package com.mysocial.relay.service.outbox;

/**
 * Summary of one poll.
 *
 * @param leaseHeld false when another instance owns the cursor and nothing was read
 * @param published rows published and marked in this poll
 * @param failed true when a publish or a store write failed
 */
public record OutboxPollResult(boolean leaseHeld, int published, boolean failed) {

  static OutboxPollResult leaseNotHeld() {
    return new OutboxPollResult(false, 0, false);
  }

  static OutboxPollResult storeFailure() {
    return new OutboxPollResult(true, 0, true);
  }
}
