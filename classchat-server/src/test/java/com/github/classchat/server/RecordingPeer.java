// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.server;

import com.github.classchat.Envelope;
import com.github.classchat.EnvelopePickler;
import com.github.classchat.MessageType;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/// An in-memory [Peer] that records what it is sent. Stored messages are "transmitted" straight away until the
/// budget runs out, after which they are dropped as a broken connection would drop them.
class RecordingPeer implements Peer {
  private final String username;
  final List<Envelope> received = new ArrayList<>();
  final List<Duration> pauses = new ArrayList<>();
  int transmitBudget = Integer.MAX_VALUE;

  RecordingPeer(String username) {
    this.username = username;
  }

  @Override
  public String username() {
    return username;
  }

  @Override
  public void deliver(Envelope envelope) {
    received.add(envelope);
  }

  @Override
  public void deliverStored(byte[] pickledEnvelope, Duration pauseBefore, Runnable onTransmitted) {
    if (transmitBudget <= 0) {
      return;
    }
    transmitBudget--;
    pauses.add(pauseBefore);
    received.add(EnvelopePickler.unpickle(pickledEnvelope));
    onTransmitted.run();
  }

  List<Envelope> ofType(MessageType type) {
    return received.stream().filter(e -> e.type() == type).toList();
  }

  Envelope last() {
    return received.get(received.size() - 1);
  }

  void clear() {
    received.clear();
    pauses.clear();
  }
}
