package com.example.dde.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DashboardResponse(
    List<FormInstanceSummary> pendingSecondEntry,
    List<FormInstanceSummary> pendingResolution,
    DashboardStats stats) {

  public DashboardResponse {
    pendingSecondEntry = pendingSecondEntry == null ? List.of() : List.copyOf(pendingSecondEntry);
    pendingResolution = pendingResolution == null ? List.of() : List.copyOf(pendingResolution);
  }
}
