package com.example.dde.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SecondEntryValue(
    @NotNull(message = "field_entry_id is required") Long fieldEntryId, String value) {}
