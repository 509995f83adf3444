/*
 * どこで: DDE API
 * 何を: 現在の状態から許可されない操作(409)を表す例外を定義する
 * なぜ: 遷移元の不一致や解決済み不一致の再解決を明確に扱うため
 */
package com.example.dde.api;

public class InvalidDdeTransitionException extends RuntimeException {

  public InvalidDdeTransitionException(String message) {
    super(message);
  }
}
