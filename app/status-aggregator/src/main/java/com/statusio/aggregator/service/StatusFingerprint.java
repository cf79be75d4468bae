/*
 * どこで: Status Aggregator サービス層
 * 何を: 資格情報の組から集約キャッシュのキーを算出する
 * なぜ: 生の秘密値をキャッシュキーやメモリ上のキーに残さず、利用者ごとの結果を分離するため
 */
package com.statusio.aggregator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;
import com.statusio.aggregator.model.CredentialSet;
import com.statusio.aggregator.model.ProviderId;
import com.statusio.common.SecretRedactor;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class StatusFingerprint {

  private final ObjectMapper objectMapper;

  /**
   * 役割: 資格情報からキャッシュキーを算出する。
   * 動作: 有効プロバイダ一覧・秘密値のマスク表現・認証方式・エンドポイントを固定順の JSON にし、
   * SHA-256 の16進表現を返す。マスク表現は先頭と末尾 4 文字だけなので、中間だけが異なる秘密値は同じキーになる。
   */
  public String of(CredentialSet credentials) {
    final Map<String, String> canonical = new LinkedHashMap<>();
    canonical.put(
        "enabled",
        credentials.enabledProviders().stream().map(ProviderId::tag).collect(Collectors.joining(",")));
    canonical.put("rd", SecretRedactor.redact(credentials.realDebridToken()));
    canonical.put("ad", SecretRedactor.redact(credentials.allDebridKey()));
    canonical.put("pm", SecretRedactor.redact(credentials.premiumizeKey()));
    canonical.put("pm_auth", credentials.premiumizeUseOauth() ? "access_token" : "apikey");
    canonical.put("tb", SecretRedactor.redact(credentials.torBoxToken()));
    canonical.put("dl", SecretRedactor.redact(credentials.debridLinkKey()));
    canonical.put("dl_auth", credentials.debridLinkAuthScheme().value());
    canonical.put(
        "dl_endpoint",
        credentials.debridLinkEndpoint() == null ? "" : credentials.debridLinkEndpoint());
    try {
      final String json = objectMapper.writeValueAsString(canonical);
      return Hashing.sha256().hashString(json, StandardCharsets.UTF_8).toString();
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize credential fingerprint", ex);
    }
  }
}
