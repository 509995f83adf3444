/*
 * どこで: DDE API
 * 何を: 2 回目入力の送信内容を保持する
 * なぜ: JSON からのバインドと検証を明確にするため
 */
package com.example.dde.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SecondEntryRequest(
    @NotEmpty(message = "entries array is required") List<@Valid SecondEntryValue> entries) {

  public SecondEntryRequest {
    entries = entries == null ? null : List.copyOf(entries);
  }
}
