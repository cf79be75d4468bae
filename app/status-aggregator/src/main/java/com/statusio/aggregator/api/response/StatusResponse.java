/*
 * どこで: Status Aggregator API DTO
 * 何を: 集約結果と描画済みカードの応答を定義する
 * なぜ: 機械処理向けの結果一覧と人が読むカードを 1 回の応答で返すため
 */
package com.statusio.aggregator.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "JSON DTO record はシリアライズ用途であり、防御的コピーよりも契約互換性を優先するため")
public record StatusResponse(
    List<ProviderStatusResponse> results,
    List<String> enabled,
    boolean hasData,
    StatusCardResponse card) {}
