/*
 * どこで: Status Aggregator プロバイダ DTO
 * 何を: Debrid-Link /api/account/infos の応答エンベロープを表現する
 * なぜ: success フラグと value オブジェクトの存在を検証してから残り秒数を読むため
 */
package com.statusio.aggregator.provider.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DebridLinkAccountResponse(Boolean success, Value value) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Value(String username, JsonNode premiumLeft, JsonNode accountType) {}
}
