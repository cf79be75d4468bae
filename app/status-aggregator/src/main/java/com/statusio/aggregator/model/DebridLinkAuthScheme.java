/*
 * どこで: Status Aggregator ドメインモデル
 * 何を: Debrid-Link の認証方式(ヘッダ/クエリ)を定義する
 * なぜ: 利用者設定で認証方式を切り替えられるようにするため
 */
package com.statusio.aggregator.model;

public enum DebridLinkAuthScheme {
  BEARER("Bearer"),
  QUERY("query");

  private final String value;

  DebridLinkAuthScheme(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * 役割: 設定値の文字列を認証方式へ変換する。
   * 動作: 未指定・空文字・"Bearer"(大文字小文字無視)は BEARER、それ以外の値はすべて QUERY とする。
   */
  public static DebridLinkAuthScheme fromValue(String value) {
    if (value == null || value.isBlank() || BEARER.value.equalsIgnoreCase(value.trim())) {
      return BEARER;
    }
    return QUERY;
  }
}
