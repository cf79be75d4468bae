/*
 * どこで: Status Aggregator プロバイダ DTO
 * 何を: TorBox /v1/api/user/me の応答エンベロープを表現する
 * なぜ: premium フラグと残り秒数の両方を独立に受け取るため
 */
package com.statusio.aggregator.provider.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/** アカウント情報は data.user、data、user、応答直下のいずれかに置かれる。 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TorBoxUserResponse(
    Boolean success,
    Account data,
    Account user,
    String username,
    Boolean isPremium,
    String accountType,
    JsonNode premiumUntil,
    @JsonAlias({"premium_left", "remainingPremiumSeconds"}) JsonNode premiumLeft,
    String note) {

  /** 読み取れるアカウントが無ければ null を返す。 */
  public Account resolveAccount() {
    if (data != null) {
      return data.resolve();
    }
    if (user != null) {
      return user;
    }
    final Account flat =
        new Account(null, username, isPremium, accountType, premiumUntil, premiumLeft, note);
    return flat.hasAccountFields() ? flat : null;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Account(
      Account user,
      String username,
      Boolean isPremium,
      String accountType,
      JsonNode premiumUntil,
      @JsonAlias({"premium_left", "remainingPremiumSeconds"}) JsonNode premiumLeft,
      String note) {

    public Account resolve() {
      return user != null ? user : this;
    }

    boolean hasAccountFields() {
      return username != null
          || isPremium != null
          || accountType != null
          || premiumUntil != null
          || premiumLeft != null;
    }
  }
}
