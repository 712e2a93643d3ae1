/*
 * Where: Relay API
 * What: Device token registration and delivery preferences of the caller
 * Why: The dispatcher reads both to pick destinations and enabled channels
 */
package com.mysocial.relay.api;

import com.mysocial.relay.api.request.RegisterDeviceRequest;
import com.mysocial.relay.api.request.UpdatePreferencesRequest;
import com.mysocial.relay.api.response.DeviceTokenResponse;
import com.mysocial.relay.api.response.PreferencesResponse;
import com.mysocial.relay.service.user.DeviceTokenService;
import com.mysocial.relay.service.user.UserPreferencesService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class UserSettingsController {

  private final DeviceTokenService deviceTokenService;
  private final UserPreferencesService preferencesService;

  @PostMapping("/devices")
  public ResponseEntity<DeviceTokenResponse> registerDevice(
      @RequestHeader(CallerAddress.HEADER) String userAddress,
      @Valid @RequestBody RegisterDeviceRequest request) {
    return ResponseEntity.ok(
        deviceTokenService.register(CallerAddress.require(userAddress), request));
  }

  @GetMapping("/devices")
  public ResponseEntity<List<DeviceTokenResponse>> listDevices(
      @RequestHeader(CallerAddress.HEADER) String userAddress) {
    return ResponseEntity.ok(deviceTokenService.list(CallerAddress.require(userAddress)));
  }

  @DeleteMapping("/devices/{deviceToken}")
  public ResponseEntity<Void> unregisterDevice(
      @RequestHeader(CallerAddress.HEADER) String userAddress,
      @PathVariable("deviceToken") String deviceToken) {
    final boolean removed =
        deviceTokenService.unregister(CallerAddress.require(userAddress), deviceToken);
    return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
  }

  @GetMapping("/preferences")
  public ResponseEntity<PreferencesResponse> getPreferences(
      @RequestHeader(CallerAddress.HEADER) String userAddress) {
    return ResponseEntity.ok(preferencesService.getPreferences(CallerAddress.require(userAddress)));
  }

  @PutMapping("/preferences")
  public ResponseEntity<PreferencesResponse> updatePreferences(
      @RequestHeader(CallerAddress.HEADER) String userAddress,
      @Valid @RequestBody UpdatePreferencesRequest request) {
    return ResponseEntity.ok(
        preferencesService.updatePreferences(CallerAddress.require(userAddress), request));
  }
}
