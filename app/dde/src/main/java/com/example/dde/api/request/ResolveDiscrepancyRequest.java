/*
 * どこで: DDE API
 * 何を: 不一致の解決リクエストを保持する
 * なぜ: resolution 未指定を Web 層で早期に弾くため
 */
package com.example.dde.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResolveDiscrepancyRequest(
    @NotBlank(
            message =
                "resolution is required (first_correct, second_correct, new_value, or adjudicated)")
        String resolution,
    String newValue,
    String notes) {}
