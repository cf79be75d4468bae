package com.statusio.aggregator.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
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
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class AllDebridAdapterTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
  private static final String URL = "http://ad.test/v4/user";

  @Test
  void premiumUserIsActiveWithRemainingDays() {
    final AdapterFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(URL))
        .andExpect(header("Authorization", "Bearer ad-key-123456"))
        .andRespond(
            withSuccess(
                """
                {"status":"success","data":{"user":{"username":"carol","isPremium":true,"premiumUntil":%d}}}
                """
                    .formatted(NOW.getEpochSecond() + 30 * 86_400),
                MediaType.APPLICATION_JSON));

    final ProviderStatus status = fixture.adapter.fetchStatus(credentials());

    assertThat(status.premiumState()).isEqualTo(PremiumState.ACTIVE);
    assertThat(status.daysRemaining()).isEqualTo(30L);
    assertThat(status.accountId()).isEqualTo("carol");
  }

  @Test
  void premiumWithoutExpiryHasUnknownDays() {
    final AdapterFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(URL))
        .andRespond(
            withSuccess(
                """
                {"status":"success","data":{"user":{"username":"carol","isPremium":true,"premiumUntil":0}}}
                """,
                MediaType.APPLICATION_JSON));

    final ProviderStatus status = fixture.adapter.fetchStatus(credentials());

    assertThat(status.premiumState()).isEqualTo(PremiumState.ACTIVE);
    assertThat(status.daysRemaining()).isNull();
  }

  @Test
  void nonPremiumUserIsInactive() {
    final AdapterFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(URL))
        .andRespond(
            withSuccess(
                """
                {"status":"success","data":{"user":{"username":"carol","isPremium":false}}}
                """,
                MediaType.APPLICATION_JSON));

    final ProviderStatus status = fixture.adapter.fetchStatus(credentials());

    assertThat(status.premiumState()).isEqualTo(PremiumState.INACTIVE);
    assertThat(status.accountId()).isEqualTo("carol");
  }

  @Test
  void errorEnvelopeIsBadResponse() {
    final AdapterFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(URL))
        .andRespond(
            withSuccess(
                """
                {"status":"error","error":{"code":"AUTH_BAD_APIKEY"}}
                """,
                MediaType.APPLICATION_JSON));

    final ProviderStatus status = fixture.adapter.fetchStatus(credentials());

    assertThat(status.premiumState()).isEqualTo(PremiumState.UNKNOWN);
    assertThat(status.diagnostic()).isEqualTo("bad response");
  }

  @Test
  void unauthorizedIsUnknownWithHttpCode() {
    final AdapterFixture fixture = newFixture();
    fixture.server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    final ProviderStatus status = fixture.adapter.fetchStatus(credentials());

    assertThat(status.premiumState()).isEqualTo(PremiumState.UNKNOWN);
    assertThat(status.diagnostic()).isEqualTo("HTTP 401");
  }

  private static CredentialSet credentials() {
    return new CredentialSet(null, "ad-key-123456", null, false, null, null, null, null);
  }

  private AdapterFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final ProviderClientProperties properties =
        new ProviderClientProperties(null, URL, null, null, null, null);
    return new AdapterFixture(
        new AllDebridAdapter(
            builder.build(), properties, new TimeConverter(Clock.fixed(NOW, ZoneOffset.UTC))),
        server);
  }

  private record AdapterFixture(AllDebridAdapter adapter, MockRestServiceServer server) {}
}
