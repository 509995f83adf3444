package com.example.dde.model;

/** 1 フィールド分の比較結果。discrepancy 系は該当レコードがなければ null。 */
public record FieldComparison(
    long fieldEntryId,
    String fieldName,
    String firstValue,
    String secondValue,
    boolean matches,
    Long discrepancyId,
    DiscrepancyStatus discrepancyStatus) {}
