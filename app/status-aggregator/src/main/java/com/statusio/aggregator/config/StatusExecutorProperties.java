/*
 * どこで: Status Aggregator 設定
 * 何を: プロバイダ並列呼び出し用スレッドプールのサイズを保持する
 * なぜ: 全プロバイダを同時に呼び出せる並列度を設定で確保するため
 */
package com.statusio.aggregator.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "statusio.executor")
public record StatusExecutorProperties(@DefaultValue("5") @Min(1) int poolSize) {}
