// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.client;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.SocketChannel;
import java.time.Duration;

/// Waits a bounded time for one socket to have something to read, so a receive loop can check its running flag
/// between waits instead of blocking in a read forever.
public interface ReadinessWait extends Closeable {

  /// @return true if a read will not block, false if the timeout passed first
  boolean awaitReadable(Duration timeout) throws IOException;

  /// Makes a thread blocked in [#awaitReadable] return early.
  void wakeup();

  /// The JDK picks epoll, kqueue or poll for the platform behind the selector.
  static ReadinessWait forChannel(SocketChannel channel) throws IOException {
    return new SelectorReadinessWait(channel);
  }
}
