/*
 * どこで: Status Aggregator ドメインモデル
 * 何を: 対応する debrid プロバイダを列挙する
 * なぜ: 集約順・キャッシュキー・表示名をプロバイダ単位で固定するため
 */
package com.statusio.aggregator.model;

public enum ProviderId {
  REAL_DEBRID("realdebrid", "rd", "Real-Debrid"),
  ALL_DEBRID("alldebrid", "ad", "AllDebrid"),
  PREMIUMIZE("premiumize", "pm", "Premiumize"),
  TOR_BOX("torbox", "tb", "TorBox"),
  DEBRID_LINK("debridlink", "dl", "Debrid-Link");

  private final String tag;
  private final String shortTag;
  private final String displayName;

  ProviderId(String tag, String shortTag, String displayName) {
    this.tag = tag;
    this.shortTag = shortTag;
    this.displayName = displayName;
  }

  public String tag() {
    return tag;
  }

  public String shortTag() {
    return shortTag;
  }

  public String displayName() {
    return displayName;
  }
}
