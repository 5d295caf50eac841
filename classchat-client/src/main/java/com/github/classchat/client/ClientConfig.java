// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.client;

import com.github.classchat.ChatProtocol;

import java.time.Duration;

/// @param pollInterval     longest the receive loop waits before rechecking whether it should stop
/// @param handshakeTimeout how long connecting may take from CONNECT to the `complete` step
public record ClientConfig(String host,
                           int port,
                           int maxFrameBytes,
                           int maxFileBytes,
                           Duration pollInterval,
                           Duration handshakeTimeout) {

  public static ClientConfig defaults() {
    return new ClientConfig("localhost", ChatProtocol.DEFAULT_PORT, ChatProtocol.DEFAULT_MAX_FRAME_BYTES,
        ChatProtocol.MAX_FILE_SIZE, Duration.ofSeconds(1), Duration.ofSeconds(10));
  }

  public ClientConfig withAddress(String host, int port) {
    return new ClientConfig(host, port, maxFrameBytes, maxFileBytes, pollInterval, handshakeTimeout);
  }

  public ClientConfig withMaxFileBytes(int maxFileBytes) {
    return new ClientConfig(host, port, maxFrameBytes, maxFileBytes, pollInterval, handshakeTimeout);
  }
}
