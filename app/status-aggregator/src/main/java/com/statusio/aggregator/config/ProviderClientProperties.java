/*
 * どこで: Status Aggregator 設定
 * 何を: 各プロバイダのアカウント情報 API の URL と User-Agent を保持する
 * なぜ: 呼び出し先をコード外へ出し、テストや検証環境で差し替えられるようにするため
 */
package com.statusio.aggregator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "statusio.providers")
public record ProviderClientProperties(
    String realDebridUrl,
    String allDebridUrl,
    String premiumizeUrl,
    String torBoxUrl,
    String debridLinkUrl,
    String userAgent) {

  public static final String DEFAULT_REAL_DEBRID_URL = "https://api.real-debrid.com/rest/1.0/user";
  public static final String DEFAULT_ALL_DEBRID_URL = "https://api.alldebrid.com/v4/user";
  public static final String DEFAULT_PREMIUMIZE_URL = "https://www.premiumize.me/api/account/info";
  public static final String DEFAULT_TOR_BOX_URL =
      "https://api.torbox.app/v1/api/user/me?settings=true";
  public static final String DEFAULT_DEBRID_LINK_URL = "https://debrid-link.com/api/account/infos";
  public static final String DEFAULT_USER_AGENT = "Statusio/1.0";

  public ProviderClientProperties {
    realDebridUrl = defaultIfBlank(realDebridUrl, DEFAULT_REAL_DEBRID_URL);
    allDebridUrl = defaultIfBlank(allDebridUrl, DEFAULT_ALL_DEBRID_URL);
    premiumizeUrl = defaultIfBlank(premiumizeUrl, DEFAULT_PREMIUMIZE_URL);
    torBoxUrl = defaultIfBlank(torBoxUrl, DEFAULT_TOR_BOX_URL);
    debridLinkUrl = defaultIfBlank(debridLinkUrl, DEFAULT_DEBRID_LINK_URL);
    userAgent = defaultIfBlank(userAgent, DEFAULT_USER_AGENT);
  }

  public static ProviderClientProperties defaults() {
    return new ProviderClientProperties(null, null, null, null, null, null);
  }

  private static String defaultIfBlank(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value.trim();
  }
}
