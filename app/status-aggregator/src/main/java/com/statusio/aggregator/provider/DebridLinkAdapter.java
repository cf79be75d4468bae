/*
 * どこで: Status Aggregator プロバイダ層
 * 何を: Debrid-Link のアカウント情報から premium 状態と残日数を求める
 * なぜ: エンドポイントと認証方式(Bearer ヘッダ/apikey クエリ)を利用者設定で切り替える必要があるため
 */
package com.statusio.aggregator.provider;

import com.statusio.aggregator.config.ProviderClientProperties;
import com.statusio.aggregator.model.CredentialSet;
import com.statusio.aggregator.model.DebridLinkAuthScheme;
import com.statusio.aggregator.model.ProviderId;
import com.statusio.aggregator.model.ProviderStatus;
import com.statusio.aggregator.model.RemainingTime;
import com.statusio.aggregator.provider.dto.DebridLinkAccountResponse;
import com.statusio.aggregator.service.TimeConverter;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.URI;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class DebridLinkAdapter extends AbstractProviderAdapter {

  static final String API_KEY_PARAM = "apikey";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public DebridLinkAdapter(
      RestClient providerRestClient,
      ProviderClientProperties properties,
      TimeConverter timeConverter) {
    super(providerRestClient, properties, timeConverter);
  }

  @Override
  public ProviderId providerId() {
    return ProviderId.DEBRID_LINK;
  }

  @Override
  protected ProviderStatus requestStatus(String credential, CredentialSet credentials) {
    final String endpoint =
        credentials.debridLinkEndpoint() != null
            ? credentials.debridLinkEndpoint()
            : properties.debridLinkUrl();
    final DebridLinkAccountResponse body =
        requireBody(
            credentials.debridLinkAuthScheme() == DebridLinkAuthScheme.QUERY
                ? getAnonymous(withApiKey(endpoint, credential), DebridLinkAccountResponse.class)
                : getBearer(toUri(endpoint), credential, DebridLinkAccountResponse.class));
    if (!Boolean.TRUE.equals(body.success()) || body.value() == null) {
      throw ProviderIntegrationException.badResponse();
    }
    final DebridLinkAccountResponse.Value value = body.value();
    final double seconds = JsonValues.numberOrZero(value.premiumLeft());
    final RemainingTime remaining =
        seconds > 0 ? timeConverter.fromDuration(seconds) : RemainingTime.none();
    if (remaining.hasTimeLeft()) {
      return ProviderStatus.active(providerId(), remaining, value.username());
    }
    final String accountType = JsonValues.text(value.accountType());
    return ProviderStatus.inactive(
        providerId(), value.username(), "accountType=" + (accountType == null ? "?" : accountType));
  }

  private URI withApiKey(String endpoint, String credential) {
    try {
      return UriComponentsBuilder.fromUriString(endpoint)
          .queryParam(API_KEY_PARAM, credential)
          .build()
          .encode()
          .toUri();
    } catch (IllegalArgumentException ex) {
      throw invalidEndpoint(ex);
    }
  }

  private URI toUri(String endpoint) {
    try {
      final URI uri = URI.create(endpoint);
      if (!uri.isAbsolute()) {
        throw new IllegalArgumentException("endpoint must be absolute");
      }
      return uri;
    } catch (IllegalArgumentException ex) {
      throw invalidEndpoint(ex);
    }
  }

  private ProviderIntegrationException invalidEndpoint(IllegalArgumentException ex) {
    return new ProviderIntegrationException(
        ProviderIntegrationException.Reason.TRANSPORT_FAILURE, "network invalid endpoint", ex);
  }
}
