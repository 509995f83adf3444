/*
 * どこで: DDE アプリの設定バインド
 * 何を: ダッシュボード一覧の取得件数を保持する
 * なぜ: 作業キューの表示件数を環境ごとに調整できるようにするため
 */
package com.example.dde.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "dde.dashboard")
public record DdeDashboardProperties(@DefaultValue("50") @Min(1) @Max(500) int pageSize) {}
