package com.example.dde.api.response;

import com.example.dde.model.AuthorizationDecision;
import com.example.dde.model.DenialReason;
import com.example.dde.model.EntryType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthorizationResponse(
    boolean allowed, EntryType entryType, DenialReason denialReason, String reason) {

  public static AuthorizationResponse from(AuthorizationDecision decision) {
    return new AuthorizationResponse(
        decision.allowed(), decision.entryType(), decision.denialReason(), decision.reason());
  }
}
