/*
 * どこで: Status Aggregator プロバイダ層
 * 何を: Premiumize のアカウント情報から premium 状態と残日数を求める
 * なぜ: Premiumize は premium フラグを返さないため、失効時刻から算出した残日数で判定する必要がある
 */
package com.statusio.aggregator.provider;

import com.statusio.aggregator.config.ProviderClientProperties;
import com.statusio.aggregator.model.CredentialSet;
import com.statusio.aggregator.model.ProviderId;
import com.statusio.aggregator.model.ProviderStatus;
import com.statusio.aggregator.model.RemainingTime;
import com.statusio.aggregator.provider.dto.PremiumizeAccountResponse;
import com.statusio.aggregator.service.TimeConverter;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.URI;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class PremiumizeAdapter extends AbstractProviderAdapter {

  static final String API_KEY_PARAM = "apikey";
  static final String ACCESS_TOKEN_PARAM = "access_token";
  private static final String SUCCESS = "success";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public PremiumizeAdapter(
      RestClient providerRestClient,
      ProviderClientProperties properties,
      TimeConverter timeConverter) {
    super(providerRestClient, properties, timeConverter);
  }

  @Override
  public ProviderId providerId() {
    return ProviderId.PREMIUMIZE;
  }

  @Override
  protected ProviderStatus requestStatus(String credential, CredentialSet credentials) {
    final String param = credentials.premiumizeUseOauth() ? ACCESS_TOKEN_PARAM : API_KEY_PARAM;
    final URI uri =
        UriComponentsBuilder.fromUriString(properties.premiumizeUrl())
            .queryParam(param, credential)
            .build()
            .encode()
            .toUri();
    final PremiumizeAccountResponse body =
        requireBody(getAnonymous(uri, PremiumizeAccountResponse.class));
    if (!SUCCESS.equalsIgnoreCase(body.status())) {
      throw ProviderIntegrationException.badResponse();
    }
    final String accountId = JsonValues.text(body.customerId());
    final RemainingTime remaining =
        timeConverter.fromAbsoluteEpoch(JsonValues.numberOrZero(body.premiumUntil()));
    if (!remaining.hasTimeLeft()) {
      return ProviderStatus.inactive(providerId(), accountId, null);
    }
    return ProviderStatus.active(providerId(), remaining, accountId);
  }
}
