/*
 * どこで: Status Aggregator サービス層
 * 何を: 集約処理そのものの内部障害を表現する
 * なぜ: フィンガープリントやキャッシュの障害を空の結果と区別して 500 へ正規化するため
 */
package com.statusio.aggregator.service;

public class StatusAggregationException extends RuntimeException {

  public StatusAggregationException(String message, Throwable cause) {
    super(message, cause);
  }
}
