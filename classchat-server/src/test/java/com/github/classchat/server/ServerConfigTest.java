// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.server;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServerConfigTest {

  @AfterEach
  void clearProperties() {
    System.clearProperty("classchat.port");
    System.clearProperty("classchat.db");
    System.clearProperty("classchat.flushItemPauseMillis");
  }

  @Test
  void defaultsMatchTheProtocol() {
    ServerConfig config = ServerConfig.defaults();
    assertThat(config.port()).isEqualTo(5555);
    assertThat(config.dbFile()).isEqualTo("classchat");
    assertThat(config.historyLimit()).isEqualTo(20);
    assertThat(config.maxFrameBytes()).isEqualTo(16 * 1024 * 1024);
  }

  @Test
  void systemPropertiesOverrideDefaults() {
    System.setProperty("classchat.port", "6001");
    System.setProperty("classchat.db", ":memory:");
    System.setProperty("classchat.flushItemPauseMillis", "5");
    ServerConfig config = ServerConfig.fromSystemProperties();
    assertThat(config.port()).isEqualTo(6001);
    assertThat(config.dbFile()).isNull();
    assertThat(config.flushItemPause()).isEqualTo(Duration.ofMillis(5));
    assertThat(config.flushNoticePause()).isEqualTo(Duration.ofMillis(100));
  }

  @Test
  void memoryMarkerMeansNoFile() {
    assertThat(ServerConfig.defaults().withDbFile(":memory:").dbFile()).isNull();
    assertThat(ServerConfig.defaults().withDbFile("other").dbFile()).isEqualTo("other");
  }

  @Test
  void rejectsAnOutOfRangePort() {
    assertThatThrownBy(() -> ServerConfig.defaults().withPort(70000))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("70000");
  }
}
