/*
 * どこで: Status Aggregator プロバイダ層
 * 何を: プロバイダ呼び出し失敗の種別と診断文字列を表現する
 * なぜ: アダプタ境界で UNKNOWN 状態へ一貫変換するため
 */
package com.statusio.aggregator.provider;

public class ProviderIntegrationException extends RuntimeException {

  public enum Reason {
    MISSING_CREDENTIAL,
    UPSTREAM_STATUS,
    TRANSPORT_FAILURE,
    TIMEOUT,
    BAD_RESPONSE,
    STATUS_UNKNOWN
  }

  static final String MISSING_CREDENTIAL = "missing credential";
  static final String BAD_RESPONSE = "bad response";
  static final String STATUS_UNKNOWN = "status unknown";

  private final Reason reason;
  private final String accountId;

  public ProviderIntegrationException(Reason reason, String diagnostic) {
    this(reason, diagnostic, null, null);
  }

  public ProviderIntegrationException(Reason reason, String diagnostic, Throwable cause) {
    this(reason, diagnostic, null, cause);
  }

  public ProviderIntegrationException(
      Reason reason, String diagnostic, String accountId, Throwable cause) {
    super(diagnostic, cause);
    this.reason = reason;
    this.accountId = accountId;
  }

  public static ProviderIntegrationException badResponse() {
    return new ProviderIntegrationException(Reason.BAD_RESPONSE, BAD_RESPONSE);
  }

  public static ProviderIntegrationException statusUnknown(String accountId) {
    return new ProviderIntegrationException(Reason.STATUS_UNKNOWN, STATUS_UNKNOWN, accountId, null);
  }

  public Reason reason() {
    return reason;
  }

  public String diagnostic() {
    return getMessage();
  }

  /** 解析できた範囲で判明したアカウント ID。無ければ null。 */
  public String accountId() {
    return accountId;
  }
}
