/*
 * どこで: Status Aggregator プロバイダ層
 * 何を: 全アダプタ共通の資格情報チェック・例外変換・ログ出力を担当する
 * なぜ: 「アダプタは例外を送出しない」契約を各プロバイダ実装から切り離して保証するため
 */
package com.statusio.aggregator.provider;

import com.statusio.aggregator.config.ProviderClientProperties;
import com.statusio.aggregator.model.CredentialSet;
import com.statusio.aggregator.model.ProviderStatus;
import com.statusio.aggregator.service.TimeConverter;
import com.statusio.common.SecretRedactor;
import java.net.SocketTimeoutException;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public abstract class AbstractProviderAdapter implements ProviderAdapter {

  private final Logger logger = LoggerFactory.getLogger(getClass());

  private final RestClient restClient;
  protected final ProviderClientProperties properties;
  protected final TimeConverter timeConverter;

  protected AbstractProviderAdapter(
      RestClient restClient, ProviderClientProperties properties, TimeConverter timeConverter) {
    this.restClient = restClient;
    this.properties = properties;
    this.timeConverter = timeConverter;
  }

  @Override
  public final ProviderStatus fetchStatus(CredentialSet credentials) {
    final String credential = credentials == null ? null : credentials.credentialFor(providerId());
    if (credential == null) {
      return toUnknownStatus(
          new ProviderIntegrationException(
              ProviderIntegrationException.Reason.MISSING_CREDENTIAL,
              ProviderIntegrationException.MISSING_CREDENTIAL));
    }
    try {
      final ProviderStatus status = requestStatus(credential, credentials);
      logger.debug(
          "{} account info resolved state={} credential={}",
          providerId().tag(),
          status.premiumState(),
          SecretRedactor.redact(credential));
      return status;
    } catch (RestClientResponseException ex) {
      return toUnknownStatus(mapResponseException(ex));
    } catch (ResourceAccessException ex) {
      return toUnknownStatus(mapResourceException(ex));
    } catch (ProviderIntegrationException ex) {
      return toUnknownStatus(ex);
    } catch (RuntimeException ex) {
      logger.warn("{} account info parse failed", providerId().tag(), ex);
      return toUnknownStatus(
          new ProviderIntegrationException(
              ProviderIntegrationException.Reason.BAD_RESPONSE,
              ProviderIntegrationException.BAD_RESPONSE,
              ex));
    }
  }

  /**
   * 役割: プロバイダへ問い合わせて応答を正規化する。
   * 動作: 形式不正は BAD_RESPONSE、状態を判定できない応答は STATUS_UNKNOWN の
   * ProviderIntegrationException を送出する。部分的な状態は返さない。
   */
  protected abstract ProviderStatus requestStatus(String credential, CredentialSet credentials);

  protected <T> T getBearer(URI uri, String token, Class<T> bodyType) {
    return restClient
        .get()
        .uri(uri)
        .header(HttpHeaders.USER_AGENT, properties.userAgent())
        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
        .retrieve()
        .body(bodyType);
  }

  protected <T> T getAnonymous(URI uri, Class<T> bodyType) {
    return restClient
        .get()
        .uri(uri)
        .header(HttpHeaders.USER_AGENT, properties.userAgent())
        .retrieve()
        .body(bodyType);
  }

  protected static <T> T requireBody(T body) {
    if (body == null) {
      throw ProviderIntegrationException.badResponse();
    }
    return body;
  }

  private ProviderStatus toUnknownStatus(ProviderIntegrationException ex) {
    if (ex.reason() != ProviderIntegrationException.Reason.MISSING_CREDENTIAL) {
      logger.info(
          "{} status unknown reason={} diagnostic={}",
          providerId().tag(),
          ex.reason(),
          ex.diagnostic());
    }
    return ProviderStatus.unknown(providerId(), ex.accountId(), ex.diagnostic());
  }

  private ProviderIntegrationException mapResponseException(RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "{} account info failed with http status={} statusText={}",
        providerId().tag(),
        status,
        ex.getStatusText());
    return new ProviderIntegrationException(
        ProviderIntegrationException.Reason.UPSTREAM_STATUS, "HTTP " + status, ex);
  }

  private ProviderIntegrationException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("{} account info timed out", providerId().tag());
      return new ProviderIntegrationException(
          ProviderIntegrationException.Reason.TIMEOUT, "network timeout", ex);
    }
    logger.warn("{} account info connection failed", providerId().tag(), ex);
    return new ProviderIntegrationException(
        ProviderIntegrationException.Reason.TRANSPORT_FAILURE,
        "network " + rootMessage(ex),
        ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private String rootMessage(Throwable ex) {
    Throwable current = ex;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    final String message = current.getMessage();
    return message == null || message.isBlank() ? current.getClass().getSimpleName() : message;
  }
}
