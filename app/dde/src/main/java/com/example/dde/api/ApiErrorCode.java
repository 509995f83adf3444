/*
 * どこで: DDE API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.dde.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  NOT_FOUND,
  INVALID_STATE,
  AUTHORIZATION_DENIED,
  PRECONDITION_FAILED,
  STORE_UNAVAILABLE
}
