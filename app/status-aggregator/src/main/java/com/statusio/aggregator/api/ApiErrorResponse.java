/*
 * どこで: Status Aggregator API
 * 何を: エラー応答の標準フォーマットを定義する
 * なぜ: 集約失敗と入力不正をクライアントがコードで判別できるようにするため
 */
package com.statusio.aggregator.api;

public record ApiErrorResponse(String code, String message) {}
