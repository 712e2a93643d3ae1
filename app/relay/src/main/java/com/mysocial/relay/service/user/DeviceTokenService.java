/*
 * Where: Relay user settings
 * What: Registers, lists and removes push device tokens
 * Why: The delivery dispatcher reads iOS tokens for APNs and Android tokens for FCM
 */
package com.mysocial.relay.service.user;

import com.mysocial.relay.api.InvalidRelayRequestException;
import com.mysocial.relay.api.request.RegisterDeviceRequest;
import com.mysocial.relay.api.response.DeviceTokenResponse;
import com.mysocial.relay.model.DevicePlatform;
import com.mysocial.relay.model.DeviceTokenRecord;
import com.mysocial.relay.repository.DeviceTokenRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeviceTokenService {

  private static final Logger logger = LoggerFactory.getLogger(DeviceTokenService.class);

  private final DeviceTokenRepository deviceTokenRepository;
  private final Clock clock;

  public DeviceTokenResponse register(String userAddress, RegisterDeviceRequest request) {
    final DevicePlatform platform;
    try {
      platform = DevicePlatform.fromWireName(request.platform());
    } catch (IllegalArgumentException ex) {
      throw new InvalidRelayRequestException(ex.getMessage());
    }
    final DeviceTokenRecord token =
        new DeviceTokenRecord(
            userAddress,
            request.deviceToken().trim(),
            platform,
            blankToNull(request.platformId()),
            Instant.now(clock));
    deviceTokenRepository.upsert(token);
    logger.info(
        "device token registered user={} platform={} platformId={}",
        userAddress,
        platform.wireName(),
        token.platformId());
    return toResponse(token);
  }

  public List<DeviceTokenResponse> list(String userAddress) {
    return deviceTokenRepository.findByUser(userAddress).stream()
        .map(DeviceTokenService::toResponse)
        .toList();
  }

  /** Tokens of one device family, optionally narrowed to a platform; unscoped tokens match all. */
  public List<String> tokensFor(String userAddress, DevicePlatform platform, String platformId) {
    return deviceTokenRepository.findByUser(userAddress).stream()
        .filter(token -> token.platform() == platform)
        .filter(
            token ->
                platformId == null
                    || token.platformId() == null
                    || token.platformId().equals(platformId))
        .map(DeviceTokenRecord::deviceToken)
        .distinct()
        .toList();
  }

  public boolean unregister(String userAddress, String deviceToken) {
    return deviceTokenRepository.delete(userAddress, deviceToken) > 0;
  }

  private static DeviceTokenResponse toResponse(DeviceTokenRecord token) {
    return new DeviceTokenResponse(
        token.deviceToken(),
        token.platform().wireName(),
        token.platformId(),
        token.updatedAt() == null ? null : token.updatedAt().toString());
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
