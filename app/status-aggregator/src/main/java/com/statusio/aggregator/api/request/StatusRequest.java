/*
 * どこで: Status Aggregator API DTO
 * 何を: 状態問い合わせの入力(各プロバイダの資格情報とキャッシュ TTL)を定義する
 * なぜ: snake_case の API 契約をドメインの CredentialSet から切り離すため
 */
package com.statusio.aggregator.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.statusio.aggregator.model.CredentialSet;
import com.statusio.aggregator.model.DebridLinkAuthScheme;

/** cacheMinutes は数値・文字列のどちらでも受け付け、解釈はサービス層に任せる。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StatusRequest(
    String rdToken,
    String adKey,
    String pmKey,
    Boolean pmUseOauth,
    String tbToken,
    String dlKey,
    String dlAuth,
    String dlEndpoint,
    String cacheMinutes) {

  public CredentialSet toCredentialSet() {
    return new CredentialSet(
        rdToken,
        adKey,
        pmKey,
        Boolean.TRUE.equals(pmUseOauth),
        tbToken,
        dlKey,
        DebridLinkAuthScheme.fromValue(dlAuth),
        dlEndpoint);
  }

  @Override
  public String toString() {
    return "StatusRequest[" + toCredentialSet() + ", cacheMinutes=" + cacheMinutes + "]";
  }
}
