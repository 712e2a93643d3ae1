package com.mysocial.relay.api;

import com.mysocial.relay.api.response.ConversationListResponse;
import com.mysocial.relay.api.response.MessageListResponse;
import com.mysocial.relay.service.messaging.MessageQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/conversations")
@RequiredArgsConstructor
public class ConversationController {

  private final MessageQueryService messageQueryService;

  @GetMapping
  public ResponseEntity<ConversationListResponse> listConversations(
      @RequestHeader(CallerAddress.HEADER) String userAddress,
      @RequestParam(name = "limit", required = false) Integer limit,
      @RequestParam(name = "offset", required = false) Integer offset) {
    return ResponseEntity.ok(
        messageQueryService.listConversations(
            CallerAddress.require(userAddress), PageParameters.of(limit, offset)));
  }

  @GetMapping("/{conversationId}/messages")
  public ResponseEntity<MessageListResponse> listMessages(
      @RequestHeader(CallerAddress.HEADER) String userAddress,
      @PathVariable("conversationId") String conversationId,
      @RequestParam(name = "limit", required = false) Integer limit,
      @RequestParam(name = "offset", required = false) Integer offset) {
    return ResponseEntity.ok(
        messageQueryService.listMessages(
            CallerAddress.require(userAddress), conversationId, PageParameters.of(limit, offset)));
  }
}
