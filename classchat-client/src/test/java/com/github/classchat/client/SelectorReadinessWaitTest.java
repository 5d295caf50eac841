// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.client;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SelectorReadinessWaitTest {
  private ServerSocketChannel listener;
  private SocketChannel client;
  private SocketChannel accepted;
  private ReadinessWait readiness;

  @BeforeEach
  void connectPair() throws IOException {
    listener = ServerSocketChannel.open();
    listener.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
    client = SocketChannel.open(listener.getLocalAddress());
    accepted = listener.accept();
    readiness = ReadinessWait.forChannel(client);
  }

  @AfterEach
  void closeAll() throws IOException {
    readiness.close();
    client.close();
    accepted.close();
    listener.close();
  }

  @Test
  void channelIsSwitchedToNonBlocking() {
    assertThat(client.isBlocking()).isFalse();
  }

  @Test
  void timesOutWhenNothingIsPending() throws IOException {
    final long start = System.nanoTime();
    assertThat(readiness.awaitReadable(Duration.ofMillis(50))).isFalse();
    assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(40));
  }

  @Test
  void zeroTimeoutStillReturns() throws IOException {
    assertThat(readiness.awaitReadable(Duration.ZERO)).isFalse();
  }

  @Test
  void readableOnceThePeerWrites() throws IOException {
    accepted.write(ByteBuffer.wrap(new byte[]{1, 2, 3}));
    assertThat(readiness.awaitReadable(Duration.ofSeconds(5))).isTrue();

    ByteBuffer buffer = ByteBuffer.allocate(8);
    assertThat(client.read(buffer)).isEqualTo(3);
    assertThat(readiness.awaitReadable(Duration.ofMillis(20))).isFalse();
  }

  @Test
  void peerCloseCountsAsReadable() throws IOException {
    accepted.close();
    assertThat(readiness.awaitReadable(Duration.ofSeconds(5))).isTrue();
    assertThat(client.read(ByteBuffer.allocate(8))).isEqualTo(-1);
  }

  @Test
  void wakeupCutsAWaitShort() throws IOException {
    readiness.wakeup();
    final long start = System.nanoTime();
    assertThat(readiness.awaitReadable(Duration.ofSeconds(10))).isFalse();
    assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
  }
}
