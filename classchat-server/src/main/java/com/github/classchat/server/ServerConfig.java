// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.server;

import com.github.classchat.ChatProtocol;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.Optional;

/// Server settings. Defaults come from [ChatProtocol] and any of them can be overridden with a system property of the
/// form `classchat.<name>`, e.g. `-Dclasschat.port=6000`. Setting `classchat.db` to `:memory:` keeps nothing on disk.
///
/// @param host                bind address
/// @param port                TCP port, zero for an ephemeral port
/// @param dbFile              MVStore file name, null for in-memory
/// @param maxFrameBytes       largest frame accepted from a client
/// @param historyLimit        most messages a history request returns
/// @param flushNoticePause    pause after the offline count notice before the first queued message
/// @param flushItemPause      pause between queued messages
/// @param handshakeTimeout    how long a new connection has to complete the key exchange
public record ServerConfig(String host,
                           int port,
                           @Nullable String dbFile,
                           int maxFrameBytes,
                           int historyLimit,
                           Duration flushNoticePause,
                           Duration flushItemPause,
                           Duration handshakeTimeout) {

  static final String PREFIX = "classchat.";
  static final String IN_MEMORY = ":memory:";

  public ServerConfig {
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Invalid port " + port);
    }
    if (maxFrameBytes <= 0) {
      throw new IllegalArgumentException("maxFrameBytes must be positive");
    }
    if (historyLimit <= 0) {
      throw new IllegalArgumentException("historyLimit must be positive");
    }
  }

  public static ServerConfig defaults() {
    return new ServerConfig("0.0.0.0", ChatProtocol.DEFAULT_PORT, "classchat",
        ChatProtocol.DEFAULT_MAX_FRAME_BYTES, ChatProtocol.HISTORY_MESSAGE_LIMIT,
        Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofSeconds(10));
  }

  public static ServerConfig fromSystemProperties() {
    final ServerConfig d = defaults();
    final String db = System.getProperty(PREFIX + "db", d.dbFile());
    return new ServerConfig(
        System.getProperty(PREFIX + "host", d.host()),
        Integer.getInteger(PREFIX + "port", d.port()),
        IN_MEMORY.equals(db) ? null : db,
        Integer.getInteger(PREFIX + "maxFrameBytes", d.maxFrameBytes()),
        Integer.getInteger(PREFIX + "historyLimit", d.historyLimit()),
        millis("flushNoticePauseMillis", d.flushNoticePause()),
        millis("flushItemPauseMillis", d.flushItemPause()),
        millis("handshakeTimeoutMillis", d.handshakeTimeout()));
  }

  private static Duration millis(String name, Duration fallback) {
    return Optional.ofNullable(Long.getLong(PREFIX + name)).map(Duration::ofMillis).orElse(fallback);
  }

  public ServerConfig withPort(int port) {
    return new ServerConfig(host, port, dbFile, maxFrameBytes, historyLimit, flushNoticePause, flushItemPause,
        handshakeTimeout);
  }

  public ServerConfig withDbFile(@Nullable String dbFile) {
    return new ServerConfig(host, port, IN_MEMORY.equals(dbFile) ? null : dbFile, maxFrameBytes, historyLimit,
        flushNoticePause, flushItemPause, handshakeTimeout);
  }

  public ServerConfig withPacing(Duration noticePause, Duration itemPause) {
    return new ServerConfig(host, port, dbFile, maxFrameBytes, historyLimit, noticePause, itemPause,
        handshakeTimeout);
  }

  public ServerConfig withHandshakeTimeout(Duration timeout) {
    return new ServerConfig(host, port, dbFile, maxFrameBytes, historyLimit, flushNoticePause, flushItemPause,
        timeout);
  }
}
