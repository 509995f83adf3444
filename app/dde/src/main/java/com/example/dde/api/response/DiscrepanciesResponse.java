package com.example.dde.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DiscrepanciesResponse(
    long formInstanceId, int openCount, List<DiscrepancyResponse> discrepancies) {

  public DiscrepanciesResponse {
    discrepancies = discrepancies == null ? List.of() : List.copyOf(discrepancies);
  }
}
