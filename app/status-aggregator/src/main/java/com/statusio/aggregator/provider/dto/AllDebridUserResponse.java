/*
 * どこで: Status Aggregator プロバイダ DTO
 * 何を: AllDebrid /v4/user の応答エンベロープを表現する
 * なぜ: status 判別子と data.user の存在を検証してから中身を読むため
 */
package com.statusio.aggregator.provider.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AllDebridUserResponse(String status, Data data) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Data(User user) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record User(String username, Boolean isPremium, JsonNode premiumUntil) {}
}
