// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.crypto;

/// Where a connection is in the key exchange. Transitions only run forward:
/// `NoKey -> AwaitingPeerKey -> Established`.
public sealed interface HandshakeState {

  record NoKey() implements HandshakeState {
  }

  /// On the server this is after sending the public key. On the client it is after sending the wrapped session key,
  /// which is held here until the server confirms it.
  record AwaitingPeerKey(byte[] pendingKey) implements HandshakeState {
  }

  record Established(byte[] sessionKey) implements HandshakeState {
  }

  HandshakeState NO_KEY = new NoKey();

  default String name() {
    return getClass().getSimpleName();
  }
}
