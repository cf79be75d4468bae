/*
 * どこで: Common 補助
 * 何を: API キーやトークンを先頭/末尾のみ残した形へ伏せ字化する
 * なぜ: ログやキャッシュキーの材料に生の秘密情報を載せないため
 */
package com.statusio.common;

public final class SecretRedactor {

  public static final String NONE = "(none)";

  // 先頭と末尾に残す文字数。これ以下の長さの秘密は全体を伏せる。
  static final int VISIBLE_CHARS = 4;
  private static final String ELLIPSIS = "…";

  private SecretRedactor() {}

  /**
   * 役割: 秘密文字列を "abcd…wxyz" 形式へ変換する。
   * 動作: null/空白は "(none)"、短すぎる値は長さのみを残して全体を伏せる。
   */
  public static String redact(String secret) {
    if (secret == null || secret.isBlank()) {
      return NONE;
    }
    final String value = secret.trim();
    if (value.length() <= VISIBLE_CHARS * 2) {
      return ELLIPSIS + "(" + value.length() + ")";
    }
    return value.substring(0, VISIBLE_CHARS) + ELLIPSIS + value.substring(value.length() - VISIBLE_CHARS);
  }
}
