/*
 * どこで: Status Aggregator ドメインモデル
 * 何を: 呼び出し元から受け取るプロバイダ別の資格情報とアダプタ設定を保持する
 * なぜ: 有効なプロバイダの判定とキャッシュキー生成を 1 つの値から行うため
 */
package com.statusio.aggregator.model;

import java.util.ArrayList;
import java.util.List;

/** 資格情報は前後の空白を除去して保持し、空文字は未設定(null)として扱う。 */
public record CredentialSet(
    String realDebridToken,
    String allDebridKey,
    String premiumizeKey,
    boolean premiumizeUseOauth,
    String torBoxToken,
    String debridLinkKey,
    DebridLinkAuthScheme debridLinkAuthScheme,
    String debridLinkEndpoint) {

  public CredentialSet {
    realDebridToken = normalize(realDebridToken);
    allDebridKey = normalize(allDebridKey);
    premiumizeKey = normalize(premiumizeKey);
    torBoxToken = normalize(torBoxToken);
    debridLinkKey = normalize(debridLinkKey);
    debridLinkAuthScheme =
        debridLinkAuthScheme == null ? DebridLinkAuthScheme.BEARER : debridLinkAuthScheme;
    debridLinkEndpoint = normalize(debridLinkEndpoint);
  }

  public static CredentialSet empty() {
    return new CredentialSet(null, null, null, false, null, null, null, null);
  }

  public String credentialFor(ProviderId provider) {
    return switch (provider) {
      case REAL_DEBRID -> realDebridToken;
      case ALL_DEBRID -> allDebridKey;
      case PREMIUMIZE -> premiumizeKey;
      case TOR_BOX -> torBoxToken;
      case DEBRID_LINK -> debridLinkKey;
    };
  }

  public boolean isEnabled(ProviderId provider) {
    return credentialFor(provider) != null;
  }

  /** 資格情報を持つプロバイダを {@link ProviderId} の宣言順で返す。 */
  public List<ProviderId> enabledProviders() {
    final List<ProviderId> enabled = new ArrayList<>();
    for (ProviderId provider : ProviderId.values()) {
      if (isEnabled(provider)) {
        enabled.add(provider);
      }
    }
    return List.copyOf(enabled);
  }

  /**
   * 役割: 未設定の資格情報だけを defaults の値で補う。
   * 動作: 認証方式・エンドポイント・OAuth 指定は呼び出し元の値を優先する。
   */
  public CredentialSet withDefaults(CredentialSet defaults) {
    if (defaults == null) {
      return this;
    }
    return new CredentialSet(
        firstNonNull(realDebridToken, defaults.realDebridToken),
        firstNonNull(allDebridKey, defaults.allDebridKey),
        firstNonNull(premiumizeKey, defaults.premiumizeKey),
        premiumizeUseOauth,
        firstNonNull(torBoxToken, defaults.torBoxToken),
        firstNonNull(debridLinkKey, defaults.debridLinkKey),
        debridLinkAuthScheme,
        debridLinkEndpoint);
  }

  @Override
  public String toString() {
    // 秘密情報を含むため有効プロバイダのみを出力する
    return "CredentialSet[enabled=" + enabledProviders() + "]";
  }

  private static String firstNonNull(String value, String fallback) {
    return value != null ? value : fallback;
  }

  private static String normalize(String value) {
    if (value == null) {
      return null;
    }
    final String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
