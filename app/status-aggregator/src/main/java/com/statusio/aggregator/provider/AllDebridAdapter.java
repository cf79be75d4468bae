/*
 * どこで: Status Aggregator プロバイダ層
 * 何を: AllDebrid のユーザー情報から premium 状態と残日数を求める
 * なぜ: status="success" の判別子と data.user の存在を確認してからでないと値を信用できないため
 */
package com.statusio.aggregator.provider;

import com.statusio.aggregator.config.ProviderClientProperties;
import com.statusio.aggregator.model.CredentialSet;
import com.statusio.aggregator.model.ProviderId;
import com.statusio.aggregator.model.ProviderStatus;
import com.statusio.aggregator.model.RemainingTime;
import com.statusio.aggregator.provider.dto.AllDebridUserResponse;
import com.statusio.aggregator.service.TimeConverter;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.URI;
import java.util.OptionalDouble;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class AllDebridAdapter extends AbstractProviderAdapter {

  private static final String SUCCESS = "success";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public AllDebridAdapter(
      RestClient providerRestClient,
      ProviderClientProperties properties,
      TimeConverter timeConverter) {
    super(providerRestClient, properties, timeConverter);
  }

  @Override
  public ProviderId providerId() {
    return ProviderId.ALL_DEBRID;
  }

  @Override
  protected ProviderStatus requestStatus(String credential, CredentialSet credentials) {
    final AllDebridUserResponse body =
        requireBody(
            getBearer(
                URI.create(properties.allDebridUrl()), credential, AllDebridUserResponse.class));
    if (!SUCCESS.equals(body.status()) || body.data() == null || body.data().user() == null) {
      throw ProviderIntegrationException.badResponse();
    }
    final AllDebridUserResponse.User user = body.data().user();
    if (!Boolean.TRUE.equals(user.isPremium())) {
      return ProviderStatus.inactive(providerId(), user.username(), null);
    }
    final OptionalDouble premiumUntil = JsonValues.number(user.premiumUntil());
    final RemainingTime remaining =
        premiumUntil.isPresent() && premiumUntil.getAsDouble() > 0
            ? timeConverter.fromAbsoluteEpoch(premiumUntil.getAsDouble())
            : null;
    return ProviderStatus.active(providerId(), remaining, user.username());
  }
}
