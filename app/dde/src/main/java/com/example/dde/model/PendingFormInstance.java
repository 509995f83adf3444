package com.example.dde.model;

/** ダッシュボード用: フォームインスタンスと未解決不一致件数の組。 */
public record PendingFormInstance(FormInstanceRecord instance, int openDiscrepancies) {}
