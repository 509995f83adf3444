/*
 * どこで: DDE API
 * 何を: フィールド単位の比較結果と集計を表す
 * なぜ: 不一致の確認画面に必要な情報をまとめて返すため
 */
package com.example.dde.api.response;

import com.example.dde.model.ComparisonResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ComparisonResponse(
    long formInstanceId,
    String subjectLabel,
    String formName,
    List<FieldComparisonResponse> items,
    int total,
    int matched,
    int mismatched) {

  public ComparisonResponse {
    items = items == null ? List.of() : List.copyOf(items);
  }

  public static ComparisonResponse from(ComparisonResult result) {
    return new ComparisonResponse(
        result.formInstanceId(),
        result.subjectLabel(),
        result.formName(),
        result.items().stream().map(FieldComparisonResponse::from).toList(),
        result.total(),
        result.matched(),
        result.mismatched());
  }
}
