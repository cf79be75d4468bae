/*
 * どこで: Status Aggregator 設定
 * 何を: リクエストで資格情報が省略されたときに使う既定の資格情報を保持する
 * なぜ: 単一利用者の運用で環境変数からトークンを与えられるようにするため
 */
package com.statusio.aggregator.config;

import com.statusio.aggregator.model.CredentialSet;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "statusio.credentials")
public record DefaultCredentialsProperties(
    String rdToken, String adKey, String pmKey, String tbToken, String dlKey) {

  public static DefaultCredentialsProperties none() {
    return new DefaultCredentialsProperties(null, null, null, null, null);
  }

  public CredentialSet toCredentialSet() {
    return new CredentialSet(rdToken, adKey, pmKey, false, tbToken, dlKey, null, null);
  }

  @Override
  public String toString() {
    return "DefaultCredentialsProperties" + toCredentialSet().enabledProviders();
  }
}
