/*
 * どこで: Status Aggregator プロバイダ DTO
 * 何を: Premiumize /api/account/info の応答を表現する
 */
package com.statusio.aggregator.provider.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PremiumizeAccountResponse(
    String status,
    @JsonProperty("customer_id") JsonNode customerId,
    @JsonProperty("premium_until") JsonNode premiumUntil) {}
