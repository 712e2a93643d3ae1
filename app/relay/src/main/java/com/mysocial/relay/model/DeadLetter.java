package com.mysocial.relay.model;

public record DeadLetter(
    ConsumerPipeline pipeline,
    String subject,
    Long streamSequence,
    Long sourceId,
    String payload,
    String errorMessage,
    long deliveredCount) {}
