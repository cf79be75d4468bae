/*
 * どこで: Status Aggregator API
 * 何を: 資格情報を受け取り、全プロバイダの premium 状態とカードを返す API を提供する
 * なぜ: クライアントがプロバイダごとに個別の API を呼び分けずに済むようにするため
 */
package com.statusio.aggregator.api;

import com.statusio.aggregator.api.request.StatusRequest;
import com.statusio.aggregator.api.response.ProviderStatusResponse;
import com.statusio.aggregator.api.response.StatusCardResponse;
import com.statusio.aggregator.api.response.StatusResponse;
import com.statusio.aggregator.model.AggregationResult;
import com.statusio.aggregator.model.CredentialSet;
import com.statusio.aggregator.model.ProviderId;
import com.statusio.aggregator.service.StatusAggregationService;
import com.statusio.aggregator.service.render.StatusCardRenderer;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class StatusController {

  private final StatusAggregationService statusAggregationService;
  private final StatusCardRenderer statusCardRenderer;

  /**
   * 役割:
   * - リクエストの資格情報で有効なプロバイダを集約し、結果とカードを返す。
   *
   * 期待動作:
   * - 本文が無い場合は設定済みの既定資格情報だけで集約する。
   * - 表示できるデータが無い場合 card は null。
   * - 個別プロバイダの失敗は結果中の UNKNOWN として返し、HTTP エラーにはしない。
   */
  @PostMapping("/status")
  public ResponseEntity<StatusResponse> status(
      @RequestBody(required = false) StatusRequest request) {
    final CredentialSet credentials =
        request == null ? CredentialSet.empty() : request.toCredentialSet();
    final AggregationResult result =
        statusAggregationService.aggregate(
            credentials, request == null ? null : request.cacheMinutes());
    final StatusCardResponse card =
        statusCardRenderer.render(result).map(StatusCardResponse::from).orElse(null);
    return ResponseEntity.ok(
        new StatusResponse(
            result.results().stream().map(ProviderStatusResponse::from).toList(),
            result.enabledProviders().stream().map(ProviderId::tag).toList(),
            result.hasData(),
            card));
  }
}
