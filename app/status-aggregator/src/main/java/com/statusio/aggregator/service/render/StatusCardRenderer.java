/*
 * どこで: Status Aggregator 描画層
 * 何を: 集約結果をサービス別の行・代表アカウント情報・一言からなるテキストカードへ整形する
 * なぜ: テレビ等の簡易クライアントでも 1 枚のカードで全プロバイダの状況を確認できるようにするため
 */
package com.statusio.aggregator.service.render;

import com.statusio.aggregator.model.AggregationResult;
import com.statusio.aggregator.model.PremiumState;
import com.statusio.aggregator.model.ProviderStatus;
import com.statusio.aggregator.model.StatusBucket;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class StatusCardRenderer {

  static final String TITLE = "🔐 Statusio";
  static final String PLACEHOLDER = "—";
  static final String NOT_AVAILABLE = "N/A";

  private static final DateTimeFormatter EXPIRY_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

  private final StatusQuotes quotes;

  /**
   * 役割: 集約結果からカードを生成する。
   *
   * 期待動作:
   * - 表示できる結果が無ければ empty。
   * - 状態もアカウント ID も持たない結果は行を出さない。
   * - 一言は表示対象のうち最も悪い区分から選ぶ。
   */
  public Optional<StatusCard> render(AggregationResult result) {
    if (!result.hasData()) {
      return Optional.empty();
    }
    final List<String> lines = new ArrayList<>();
    for (ProviderStatus status : result.results()) {
      if (StatusBucket.isDisplayable(status)) {
        lines.add(serviceLine(status));
      }
    }
    final ProviderStatus primary =
        result.results().stream()
            .filter(StatusBucket::isDisplayable)
            .findFirst()
            .orElse(result.results().get(0));
    lines.add("👤 User: " + (primary.hasAccountId() ? "@" + primary.accountId() : PLACEHOLDER));
    lines.add("⏳️ Expires: " + expiryText(primary));
    lines.add("📅 Days left: " + daysText(primary));
    lines.add("💬 " + quotes.quoteFor(StatusBucket.worst(result.results())));
    return Optional.of(new StatusCard(TITLE, String.join("\n", lines)));
  }

  private String serviceLine(ProviderStatus status) {
    final StatusBucket bucket = StatusBucket.of(status);
    final String label = bucket == StatusBucket.OK ? "🤝" : "🛠️";
    return label + " Service: " + status.providerName() + " - " + bucket.name() + " " + emoji(bucket);
  }

  private static String emoji(StatusBucket bucket) {
    return switch (bucket) {
      case EXPIRED -> "🔴";
      case CRITICAL -> "🟠";
      case WARNING -> "🟡";
      case OK -> "🟢";
    };
  }

  private static String expiryText(ProviderStatus status) {
    if (status.expiresAt() != null) {
      return EXPIRY_FORMAT.format(status.expiresAt());
    }
    return status.premiumState() == PremiumState.ACTIVE ? PLACEHOLDER : NOT_AVAILABLE;
  }

  private static String daysText(ProviderStatus status) {
    if (status.daysRemaining() != null) {
      return String.valueOf(status.daysRemaining());
    }
    return status.premiumState() == PremiumState.ACTIVE ? PLACEHOLDER : "0";
  }
}
