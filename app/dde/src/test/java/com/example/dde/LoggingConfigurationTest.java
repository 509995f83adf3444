/*
 * どこで: DDE のログ設定テスト
 * 何を: JSON エンコーダとトレース・運用キーのフィールド定義を検証する
 * なぜ: ログ設定の変更で DDE の調査に必要なキーが出力から落ちる回帰を防ぐため
 */
package com.example.dde;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.core.io.ClassPathResource;

class LoggingConfigurationTest {

  private static String logbackXml;

  @BeforeAll
  static void loadConfiguration() throws IOException {
    final ClassPathResource resource = new ClassPathResource("logback-spring.xml");
    assertThat(resource.exists()).isTrue();
    try (InputStream in = resource.getInputStream()) {
      logbackXml = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  @Test
  void usesCompositeJsonEncoderWithServiceName() {
    assertThat(logbackXml)
        .contains("net.logstash.logback.encoder.LoggingEventCompositeJsonEncoder")
        .contains("source=\"spring.application.name\"")
        .contains("<stackTrace>");
  }

  @Test
  void traceFieldsFallBackToMicrometerKeys() {
    assertThat(logbackXml)
        .contains("\"trace_id\":\"%X{trace_id:-%X{traceId:-}}\"")
        .contains("\"span_id\":\"%X{span_id:-%X{spanId:-}}\"");
  }

  // RequestMdcInterceptor が積むキーのうち、JSON へ必ず出すもの
  @ParameterizedTest
  @ValueSource(strings = {"request_id", "user_id", "form_instance_id"})
  void requestKeysAreRendered(String key) {
    assertThat(logbackXml).contains("\"" + key + "\":\"%X{" + key + ":-}\"");
  }
}
