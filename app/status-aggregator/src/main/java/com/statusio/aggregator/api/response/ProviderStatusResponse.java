package com.statusio.aggregator.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.statusio.aggregator.model.ProviderStatus;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProviderStatusResponse(
    String name,
    String premium,
    Long daysRemaining,
    String expiresAt,
    String username,
    String note) {

  public static ProviderStatusResponse from(ProviderStatus status) {
    return new ProviderStatusResponse(
        status.providerName(),
        status.premiumState().name(),
        status.daysRemaining(),
        status.expiresAt() == null ? null : status.expiresAt().toString(),
        status.accountId(),
        status.diagnostic());
  }
}
