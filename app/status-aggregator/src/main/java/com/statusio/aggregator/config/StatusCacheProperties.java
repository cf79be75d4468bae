/*
 * どこで: Status Aggregator 設定
 * 何を: 集約結果キャッシュの既定 TTL(分)を保持する
 * なぜ: 呼び出し元が TTL を指定しない/不正値のときの既定値を環境ごとに変えられるようにするため
 */
package com.statusio.aggregator.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "statusio.cache")
public record StatusCacheProperties(@DefaultValue("45") @Min(1) int defaultTtlMinutes) {}
