package com.example.dde.api.response;

import com.example.dde.model.DiscrepancyRecord;
import com.example.dde.model.DiscrepancyStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DiscrepancyResponse(
    long discrepancyId,
    long formInstanceId,
    long fieldEntryId,
    String fieldName,
    String firstValue,
    String secondValue,
    DiscrepancyStatus status,
    String resolution,
    String resolvedValue,
    String resolverId,
    Instant resolvedAt,
    String notes,
    Instant createdAt) {

  public static DiscrepancyResponse from(DiscrepancyRecord record) {
    return new DiscrepancyResponse(
        record.discrepancyId(),
        record.formInstanceId(),
        record.fieldEntryId(),
        record.fieldName(),
        record.firstValue(),
        record.secondValue(),
        record.status(),
        record.strategy() == null ? null : record.strategy().value(),
        record.resolvedValue(),
        record.resolverId(),
        record.resolvedAt(),
        record.resolutionNotes(),
        record.createdAt());
  }
}
