/*
 * どこで: Status Aggregator プロバイダ層テスト
 * 何を: TorBox のフラグと残り期間の組み合わせによる判定を検証する
 * なぜ: フラグが false でも残り秒数が正の利用者を失効扱いしないことを保証するため
 */
package com.statusio.aggregator.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.statusio.aggregator.config.ProviderClientProperties;
import com.statusio.aggregator.model.CredentialSet;
import com.statusio.aggregator.model.PremiumState;
import com.statusio.aggregator.model.ProviderStatus;
import com.statusio.aggregator.service.TimeConverter;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class TorBoxAdapterTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
  private static final String URL = "http://tb.test/v1/api/user/me?settings=true";

  @Test
  void remainingSecondsMakeAccountActiveEvenWithoutFlag() {
    final AdapterFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(URL))
        .andExpect(header("Authorization", "Bearer tb-token-123456"))
        .andRespond(
            withSuccess(
                """
                {"success":true,"data":{"username":"dave","isPremium":false,"premium_left":172800}}
                """,
                MediaType.APPLICATION_JSON));

    final ProviderStatus status = fixture.adapter.fetchStatus(credentials());

    assertThat(status.premiumState()).isEqualTo(PremiumState.ACTIVE);
    assertThat(status.daysRemaining()).isEqualTo(2L);
    assertThat(status.expiresAt()).isEqualTo(NOW.plusSeconds(172_800));
    assertThat(status.accountId()).isEqualTo("dave");
  }

  @Test
  void flatBodyWithoutEnvelopeIsRead() {
    final AdapterFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(URL))
        .andRespond(
            withSuccess(
                """
                {"username":"dave","isPremium":false,"premiumLeft":172800}
                """,
                MediaType.APPLICATION_JSON));

    final ProviderStatus status = fixture.adapter.fetchStatus(credentials());

    assertThat(status.premiumState()).isEqualTo(PremiumState.ACTIVE);
    assertThat(status.daysRemaining()).isEqualTo(2L);
    assertThat(status.accountId()).isEqualTo("dave");
  }

  @Test
  void topLevelUserObjectIsRead() {
    final AdapterFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(URL))
        .andRespond(
            withSuccess(
                """
                {"user":{"username":"frank","isPremium":false,"premiumLeft":172800}}
                """,
                MediaType.APPLICATION_JSON));

    final ProviderStatus status = fixture.adapter.fetchStatus(credentials());

    assertThat(status.premiumState()).isEqualTo(PremiumState.ACTIVE);
    assertThat(status.daysRemaining()).isEqualTo(2L);
    assertThat(status.accountId()).isEqualTo("frank");
  }

  @Test
  void nestedUserWithPremiumUntilIsUsed() {
    final AdapterFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(URL))
        .andRespond(
            withSuccess(
                """
                {"success":true,"data":{"user":{"username":"erin","accountType":"premium","premiumUntil":%d}}}
                """
                    .formatted(NOW.getEpochSecond() + 15 * 86_400),
                MediaType.APPLICATION_JSON));

    final ProviderStatus status = fixture.adapter.fetchStatus(credentials());

    assertThat(status.premiumState()).isEqualTo(PremiumState.ACTIVE);
    assertThat(status.daysRemaining()).isEqualTo(15L);
    assertThat(status.accountId()).isEqualTo("erin");
  }

  @Test
  void premiumFlagWithoutTimingHasUnknownDays() {
    final AdapterFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(URL))
        .andRespond(
            withSuccess(
                """
                {"success":true,"data":{"username":"dave","isPremium":true}}
                """,
                MediaType.APPLICATION_JSON));

    final ProviderStatus status = fixture.adapter.fetchStatus(credentials());

    assertThat(status.premiumState()).isEqualTo(PremiumState.ACTIVE);
    assertThat(status.daysRemaining()).isNull();
    assertThat(status.expiresAt()).isNull();
  }

  @Test
  void freeAccountIsInactiveWithNote() {
    final AdapterFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(URL))
        .andRespond(
            withSuccess(
                """
                {"success":true,"data":{"username":"dave","isPremium":false,"note":"plan expired"}}
                """,
                MediaType.APPLICATION_JSON));

    final ProviderStatus status = fixture.adapter.fetchStatus(credentials());

    assertThat(status.premiumState()).isEqualTo(PremiumState.INACTIVE);
    assertThat(status.diagnostic()).isEqualTo("plan expired");
  }

  @Test
  void bodyWithoutAccountFieldsIsBadResponse() {
    final AdapterFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(URL))
        .andRespond(withSuccess("{\"success\":false}", MediaType.APPLICATION_JSON));

    final ProviderStatus status = fixture.adapter.fetchStatus(credentials());

    assertThat(status.premiumState()).isEqualTo(PremiumState.UNKNOWN);
    assertThat(status.diagnostic()).isEqualTo("bad response");
  }

  private static CredentialSet credentials() {
    return new CredentialSet(null, null, null, false, "tb-token-123456", null, null, null);
  }

  private AdapterFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final ProviderClientProperties properties =
        new ProviderClientProperties(null, null, null, URL, null, null);
    return new AdapterFixture(
        new TorBoxAdapter(
            builder.build(), properties, new TimeConverter(Clock.fixed(NOW, ZoneOffset.UTC))),
        server);
  }

  private record AdapterFixture(TorBoxAdapter adapter, MockRestServiceServer server) {}
}
