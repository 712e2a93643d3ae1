package com.mysocial.relay.model;

import java.time.Instant;

public record DeviceTokenRecord(
    String userAddress,
    String deviceToken,
    DevicePlatform platform,
    String platformId,
    Instant updatedAt) {}
