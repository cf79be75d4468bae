/*
 * どこで: Status Aggregator プロバイダ DTO
 * 何を: Real-Debrid /rest/1.0/user の応答を表現する
 * なぜ: premium 判定と失効時刻の表現揺れ(epoch/日付文字列)を型として明示するため
 */
package com.statusio.aggregator.provider.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RealDebridUserResponse(
    String username,
    String user,
    JsonNode premium,
    String type,
    JsonNode expiration,
    @JsonProperty("premium_until") @JsonAlias("premiumUntil") JsonNode premiumUntil) {}
