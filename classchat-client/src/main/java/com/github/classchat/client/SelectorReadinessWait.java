// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.client;

import java.io.IOException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.logging.Logger;

/// A [ReadinessWait] over a [Selector] watching a single non-blocking channel.
final class SelectorReadinessWait implements ReadinessWait {
  private static final Logger LOGGER = Logger.getLogger(SelectorReadinessWait.class.getName());

  private final Selector selector;
  private final SelectionKey key;

  SelectorReadinessWait(SocketChannel channel) throws IOException {
    if (channel.isBlocking()) {
      channel.configureBlocking(false);
    }
    this.selector = Selector.open();
    this.key = channel.register(selector, SelectionKey.OP_READ);
    LOGGER.finest(() -> "Selector " + selector.provider().getClass().getSimpleName() + " watching " + channel);
  }

  @Override
  public boolean awaitReadable(Duration timeout) throws IOException {
    // select(0) would wait forever
    final long millis = Math.max(1, timeout.toMillis());
    final int ready = selector.select(millis);
    final boolean readable = ready > 0 && key.isValid() && key.isReadable();
    selector.selectedKeys().clear();
    return readable;
  }

  @Override
  public void wakeup() {
    selector.wakeup();
  }

  @Override
  public void close() throws IOException {
    key.cancel();
    selector.close();
  }
}
