/*
 * Where: Relay API request DTO
 * What: Partial update of delivery preferences; null fields keep their stored value
 */
package com.mysocial.relay.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.Email;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record is only used to receive requests and is not copied")
public record UpdatePreferencesRequest(
    @Email String emailAddress,
    Boolean pushEnabled,
    Boolean emailEnabled,
    List<String> mutedKinds) {}
