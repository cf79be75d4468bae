/*
 * どこで: Status Aggregator プロバイダ層
 * 何を: Real-Debrid のユーザー情報から premium 状態と残日数を求める
 * なぜ: expiration が epoch 秒と日付文字列のどちらでも届くため、表現を判別して正規化する必要がある
 */
package com.statusio.aggregator.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.statusio.aggregator.config.ProviderClientProperties;
import com.statusio.aggregator.model.CredentialSet;
import com.statusio.aggregator.model.ProviderId;
import com.statusio.aggregator.model.ProviderStatus;
import com.statusio.aggregator.model.RemainingTime;
import com.statusio.aggregator.provider.dto.RealDebridUserResponse;
import com.statusio.aggregator.service.TimeConverter;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.OptionalDouble;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class RealDebridAdapter extends AbstractProviderAdapter {

  /**
   * epoch 秒として扱う下限(2001-09-09T01:46:40Z)。これ未満の数値は残り秒数などの別表現とみなし、
   * epoch としては解釈しない。
   */
  static final double EPOCH_SECONDS_THRESHOLD = 1_000_000_000d;

  private static final String PREMIUM_TYPE = "premium";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public RealDebridAdapter(
      RestClient providerRestClient,
      ProviderClientProperties properties,
      TimeConverter timeConverter) {
    super(providerRestClient, properties, timeConverter);
  }

  @Override
  public ProviderId providerId() {
    return ProviderId.REAL_DEBRID;
  }

  @Override
  protected ProviderStatus requestStatus(String credential, CredentialSet credentials) {
    final RealDebridUserResponse body =
        requireBody(
            getBearer(
                URI.create(properties.realDebridUrl()), credential, RealDebridUserResponse.class));
    final String accountId = JsonValues.firstNonBlank(body.username(), body.user());
    final Boolean premium = resolvePremium(body);
    if (premium == null) {
      throw ProviderIntegrationException.statusUnknown(accountId);
    }
    if (!premium) {
      return ProviderStatus.inactive(providerId(), accountId, null);
    }
    return ProviderStatus.active(providerId(), resolveRemaining(body), accountId);
  }

  /**
   * 役割: premium フラグを判定する。
   * 動作: premium=true、正の premium 秒数、type="premium" のいずれかで true。premium/type の
   * どちらかが存在してそれ以外なら false。どちらも無ければ判定不能(null)。
   */
  private Boolean resolvePremium(RealDebridUserResponse body) {
    final JsonNode premium = body.premium();
    final String type = body.type();
    if (premium != null && premium.isBoolean() && premium.booleanValue()) {
      return Boolean.TRUE;
    }
    if (premium != null && premium.isNumber() && premium.doubleValue() > 0) {
      return Boolean.TRUE;
    }
    if (PREMIUM_TYPE.equalsIgnoreCase(type)) {
      return Boolean.TRUE;
    }
    final boolean hasPremiumFlag =
        premium != null && (premium.isBoolean() || premium.isNumber());
    if (hasPremiumFlag || (type != null && !type.isBlank())) {
      return Boolean.FALSE;
    }
    return null;
  }

  /** 失効時刻が読み取れない場合は null(残日数不明)を返す。 */
  private RemainingTime resolveRemaining(RealDebridUserResponse body) {
    if (JsonValues.isPresent(body.expiration())) {
      final OptionalDouble numeric = JsonValues.number(body.expiration());
      if (numeric.isPresent() && numeric.getAsDouble() > EPOCH_SECONDS_THRESHOLD) {
        return timeConverter.fromAbsoluteEpoch(numeric.getAsDouble());
      }
      final Instant parsed = parseDate(JsonValues.text(body.expiration()));
      return parsed == null ? null : timeConverter.fromInstant(parsed);
    }
    final OptionalDouble premiumUntil = JsonValues.number(body.premiumUntil());
    if (premiumUntil.isPresent()) {
      return timeConverter.fromAbsoluteEpoch(premiumUntil.getAsDouble());
    }
    return null;
  }

  private Instant parseDate(String value) {
    if (value == null) {
      return null;
    }
    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException ignored) {
      // 日付のみの表現を続けて試す
    }
    try {
      return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
    } catch (DateTimeParseException ex) {
      return null;
    }
  }
}
