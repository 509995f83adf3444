package com.example.dde.api.response;

import com.example.dde.model.DiscrepancyStatus;
import com.example.dde.model.FieldComparison;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FieldComparisonResponse(
    long fieldEntryId,
    String fieldName,
    String firstValue,
    String secondValue,
    boolean matches,
    Long discrepancyId,
    DiscrepancyStatus discrepancyStatus) {

  public static FieldComparisonResponse from(FieldComparison comparison) {
    return new FieldComparisonResponse(
        comparison.fieldEntryId(),
        comparison.fieldName(),
        comparison.firstValue(),
        comparison.secondValue(),
        comparison.matches(),
        comparison.discrepancyId(),
        comparison.discrepancyStatus());
  }
}
