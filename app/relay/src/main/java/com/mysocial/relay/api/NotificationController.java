/*
 * Where: Relay API
 * What: list_notifications, unread_counts and mark_read endpoints
 */
package com.mysocial.relay.api;

import com.mysocial.relay.api.response.NotificationListResponse;
import com.mysocial.relay.api.response.NotificationResponse;
import com.mysocial.relay.api.response.UnreadCountsResponse;
import com.mysocial.relay.service.notification.NotificationQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

  private final NotificationQueryService notificationQueryService;

  @GetMapping
  public ResponseEntity<NotificationListResponse> listNotifications(
      @RequestHeader(CallerAddress.HEADER) String userAddress,
      @RequestParam(name = "platform_id", required = false) String platformId,
      @RequestParam(name = "limit", required = false) Integer limit,
      @RequestParam(name = "offset", required = false) Integer offset) {
    return ResponseEntity.ok(
        notificationQueryService.listNotifications(
            CallerAddress.require(userAddress), platformId, PageParameters.of(limit, offset)));
  }

  @GetMapping("/unread-counts")
  public ResponseEntity<UnreadCountsResponse> unreadCounts(
      @RequestHeader(CallerAddress.HEADER) String userAddress,
      @RequestParam(name = "platform_id", required = false) String platformId) {
    return ResponseEntity.ok(
        notificationQueryService.unreadCounts(CallerAddress.require(userAddress), platformId));
  }

  @PostMapping("/{notificationId}/read")
  public ResponseEntity<NotificationResponse> markRead(
      @RequestHeader(CallerAddress.HEADER) String userAddress,
      @PathVariable("notificationId") String notificationId) {
    return ResponseEntity.ok(
        notificationQueryService.markRead(CallerAddress.require(userAddress), notificationId));
  }
}
