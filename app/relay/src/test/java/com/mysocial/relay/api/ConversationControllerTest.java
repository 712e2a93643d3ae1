package com.mysocial.relay.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.mysocial.relay.api.response.ConversationListResponse;
import com.mysocial.relay.api.response.ConversationResponse;
import com.mysocial.relay.api.response.MessageListResponse;
import com.mysocial.relay.api.response.MessageResponse;
import com.mysocial.relay.service.messaging.MessageQueryService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ConversationController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class ConversationControllerTest {

  private static final String CONVERSATION_ID = "conv-1";

  @Autowired private MockMvc mockMvc;

  @MockitoBean private MessageQueryService messageQueryService;

  @Test
  void listConversationsReturnsOtherParticipant() throws Exception {
    when(messageQueryService.listConversations("0xalice", new PageParameters(50, 0)))
        .thenReturn(
            new ConversationListResponse(
                List.of(
                    new ConversationResponse(
                        CONVERSATION_ID,
                        "0xbob",
                        "2026-01-17T00:00:00Z",
                        "2026-01-17T00:05:00Z")),
                50,
                0));

    mockMvc
        .perform(get("/v1/conversations").header(CallerAddress.HEADER, "0xalice"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.conversations[0].conversation_id").value(CONVERSATION_ID))
        .andExpect(jsonPath("$.conversations[0].other_participant").value("0xbob"))
        .andExpect(jsonPath("$.conversations[0].last_message_at").value("2026-01-17T00:05:00Z"));
  }

  @Test
  void listMessagesMarksUndecryptableContent() throws Exception {
    when(messageQueryService.listMessages("0xalice", CONVERSATION_ID, new PageParameters(10, 0)))
        .thenReturn(
            new MessageListResponse(
                CONVERSATION_ID,
                List.of(
                    new MessageResponse(
                        "msg-2",
                        CONVERSATION_ID,
                        "0xbob",
                        "0xalice",
                        null,
                        "text/plain",
                        false,
                        "2026-01-17T00:05:00Z"),
                    new MessageResponse(
                        "msg-1",
                        CONVERSATION_ID,
                        "0xalice",
                        "0xbob",
                        "gm",
                        "text/plain",
                        true,
                        "2026-01-17T00:00:00Z")),
                10,
                0));

    mockMvc
        .perform(
            get("/v1/conversations/" + CONVERSATION_ID + "/messages")
                .header(CallerAddress.HEADER, "0xalice")
                .param("limit", "10"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.messages[0].content_available").value(false))
        .andExpect(jsonPath("$.messages[0].content").doesNotExist())
        .andExpect(jsonPath("$.messages[1].content").value("gm"));
  }

  @Test
  void nonParticipantReturns403() throws Exception {
    when(messageQueryService.listMessages("0xmallory", CONVERSATION_ID, new PageParameters(50, 0)))
        .thenThrow(new ConversationAccessDeniedException(CONVERSATION_ID));

    mockMvc
        .perform(
            get("/v1/conversations/" + CONVERSATION_ID + "/messages")
                .header(CallerAddress.HEADER, "0xmallory"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("RELAY_CONVERSATION_FORBIDDEN"));
  }

  @Test
  void unknownConversationReturns404() throws Exception {
    when(messageQueryService.listMessages("0xalice", "missing", new PageParameters(50, 0)))
        .thenThrow(new ConversationNotFoundException("missing"));

    mockMvc
        .perform(get("/v1/conversations/missing/messages").header(CallerAddress.HEADER, "0xalice"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("RELAY_NOT_FOUND"))
        .andExpect(jsonPath("$.message").value("conversation not found: missing"));
  }

  @Test
  void nonNumericLimitReturns400() throws Exception {
    mockMvc
        .perform(
            get("/v1/conversations").header(CallerAddress.HEADER, "0xalice").param("limit", "ten"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("RELAY_BAD_REQUEST"));
  }
}
