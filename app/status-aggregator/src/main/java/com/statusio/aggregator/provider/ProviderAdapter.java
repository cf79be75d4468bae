/*
 * どこで: Status Aggregator プロバイダ層
 * 何を: 1 つの debrid プロバイダのアカウント情報を正規化状態へ変換する抽象
 * なぜ: 集約サービスがプロバイダごとの応答形式を知らずに並列呼び出しできるようにするため
 */
package com.statusio.aggregator.provider;

import com.statusio.aggregator.model.CredentialSet;
import com.statusio.aggregator.model.ProviderId;
import com.statusio.aggregator.model.ProviderStatus;

public interface ProviderAdapter {

  ProviderId providerId();

  /** 資格情報が設定されているプロバイダだけが集約の対象になる。 */
  default boolean isEnabled(CredentialSet credentials) {
    return credentials != null && credentials.isEnabled(providerId());
  }

  /**
   * 役割: 資格情報を使ってプロバイダへ 1 回問い合わせ、正規化した状態を返す。
   * 動作: 例外を送出しない。通信失敗・HTTP エラー・解析失敗はすべて UNKNOWN 状態として返す。
   */
  ProviderStatus fetchStatus(CredentialSet credentials);
}
