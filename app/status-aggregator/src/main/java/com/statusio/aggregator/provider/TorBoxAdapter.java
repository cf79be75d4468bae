/*
 * どこで: Status Aggregator プロバイダ層
 * 何を: TorBox のユーザー情報から premium 状態と残日数を求める
 * なぜ: TorBox は premium フラグが false でも残り秒数を返すことがあり、両方を見ないと誤って失効扱いになるため
 */
package com.statusio.aggregator.provider;

import com.statusio.aggregator.config.ProviderClientProperties;
import com.statusio.aggregator.model.CredentialSet;
import com.statusio.aggregator.model.ProviderId;
import com.statusio.aggregator.model.ProviderStatus;
import com.statusio.aggregator.model.RemainingTime;
import com.statusio.aggregator.provider.dto.TorBoxUserResponse;
import com.statusio.aggregator.service.TimeConverter;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.URI;
import java.util.OptionalDouble;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class TorBoxAdapter extends AbstractProviderAdapter {

  private static final String PREMIUM_TYPE = "premium";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public TorBoxAdapter(
      RestClient providerRestClient,
      ProviderClientProperties properties,
      TimeConverter timeConverter) {
    super(providerRestClient, properties, timeConverter);
  }

  @Override
  public ProviderId providerId() {
    return ProviderId.TOR_BOX;
  }

  @Override
  protected ProviderStatus requestStatus(String credential, CredentialSet credentials) {
    final TorBoxUserResponse body =
        requireBody(
            getBearer(URI.create(properties.torBoxUrl()), credential, TorBoxUserResponse.class));
    final TorBoxUserResponse.Account account = body.resolveAccount();
    if (account == null) {
      throw ProviderIntegrationException.badResponse();
    }
    final boolean premiumFlag =
        Boolean.TRUE.equals(account.isPremium())
            || PREMIUM_TYPE.equalsIgnoreCase(account.accountType());
    final RemainingTime remaining = resolveRemaining(account);
    if (premiumFlag) {
      return ProviderStatus.active(
          providerId(),
          remaining.hasTimeLeft() ? remaining : null,
          account.username());
    }
    // フラグが false/欠落でも残り期間が正なら premium とみなす
    if (remaining.hasTimeLeft()) {
      return ProviderStatus.active(providerId(), remaining, account.username());
    }
    return ProviderStatus.inactive(providerId(), account.username(), account.note());
  }

  /** premiumUntil(epoch 秒)を優先し、無ければ残り秒数を使う。 */
  private RemainingTime resolveRemaining(TorBoxUserResponse.Account account) {
    final OptionalDouble premiumUntil = JsonValues.number(account.premiumUntil());
    if (premiumUntil.isPresent() && premiumUntil.getAsDouble() > 0) {
      return timeConverter.fromAbsoluteEpoch(premiumUntil.getAsDouble());
    }
    return timeConverter.fromDuration(JsonValues.numberOrZero(account.premiumLeft()));
  }
}
