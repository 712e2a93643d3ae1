package com.mysocial.relay.api;

import com.mysocial.relay.api.request.SendMessageRequest;
import com.mysocial.relay.api.response.MessageResponse;
import com.mysocial.relay.service.messaging.MessageService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/messages")
@RequiredArgsConstructor
public class MessageController {

  private final MessageService messageService;

  @PostMapping
  public ResponseEntity<MessageResponse> sendMessage(
      @RequestHeader(CallerAddress.HEADER) String userAddress,
      @Valid @RequestBody SendMessageRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(messageService.sendMessage(CallerAddress.require(userAddress), request));
  }
}
