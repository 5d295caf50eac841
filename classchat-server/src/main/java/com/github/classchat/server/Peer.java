// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.server;

import com.github.classchat.Envelope;

import java.time.Duration;

/// What the router sees of a connected user. Both methods queue and return at once; the connection's writer thread
/// does the encryption and the socket I/O in the order things were queued.
public interface Peer {
  String username();

  void deliver(Envelope envelope);

  /// Queues a message that was held in the offline store.
  ///
  /// @param pickledEnvelope the stored content
  /// @param pauseBefore     how long the writer waits before sending it
  /// @param onTransmitted   run by the writer once the frame is written and not run at all if it never is
  void deliverStored(byte[] pickledEnvelope, Duration pauseBefore, Runnable onTransmitted);
}
