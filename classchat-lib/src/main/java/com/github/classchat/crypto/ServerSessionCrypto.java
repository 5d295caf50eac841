// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.crypto;

import com.github.classchat.Envelope;
import com.github.classchat.msg.HandshakeStep;

/// Server side: offer the shared public key, then accept the client's wrapped session key.
public final class ServerSessionCrypto extends SessionCrypto {
  private final ServerKeyPair serverKeys;

  public ServerSessionCrypto(String username, ServerKeyPair serverKeys) {
    super(username);
    this.serverKeys = serverKeys;
  }

  /// `NoKey -> AwaitingPeerKey`
  ///
  /// @return the `server_public_key` envelope to send
  public Envelope offerPublicKey() {
    transition(HandshakeState.NoKey.class, new HandshakeState.AwaitingPeerKey(null));
    return Envelope.serverPublicKey(username, serverKeys.encodedPublicKey());
  }

  /// `AwaitingPeerKey -> Established`
  ///
  /// @param reply what the client sent back, which must be the `client_session_key` step
  /// @return the `complete` envelope to send
  /// @throws HandshakeFailureException on anything unexpected
  public Envelope acceptSessionKey(Envelope reply) {
    requireState(HandshakeState.AwaitingPeerKey.class);
    final var exchange = expectStep(reply, HandshakeStep.CLIENT_SESSION_KEY, true);
    final byte[] sessionKey = serverKeys.unwrapSessionKey(exchange.keyMaterial());
    transition(HandshakeState.AwaitingPeerKey.class, new HandshakeState.Established(sessionKey));
    return Envelope.handshakeComplete(username);
  }
}
