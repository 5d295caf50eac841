// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.crypto;

import com.github.classchat.Envelope;
import com.github.classchat.msg.HandshakeStep;

/// Client side: answer the server's public key with a freshly generated session key, then wait for `complete`.
public final class ClientSessionCrypto extends SessionCrypto {

  public ClientSessionCrypto(String username) {
    super(username);
  }

  /// `NoKey -> AwaitingPeerKey`
  ///
  /// @param offer the `server_public_key` envelope
  /// @return the `client_session_key` envelope to send
  /// @throws HandshakeFailureException on anything unexpected
  public Envelope answerPublicKey(Envelope offer) {
    requireState(HandshakeState.NoKey.class);
    final var exchange = expectStep(offer, HandshakeStep.SERVER_PUBLIC_KEY, true);
    final byte[] sessionKey = SessionCipher.generateKey();
    final String wrapped = ServerKeyPair.wrapSessionKey(exchange.keyMaterial(), sessionKey);
    transition(HandshakeState.NoKey.class, new HandshakeState.AwaitingPeerKey(sessionKey));
    return Envelope.clientSessionKey(username, wrapped);
  }

  /// `AwaitingPeerKey -> Established`
  ///
  /// @throws HandshakeFailureException unless this is the `complete` step
  public void confirm(Envelope complete) {
    final var awaiting = (HandshakeState.AwaitingPeerKey) requireState(HandshakeState.AwaitingPeerKey.class);
    expectStep(complete, HandshakeStep.COMPLETE, false);
    transition(HandshakeState.AwaitingPeerKey.class, new HandshakeState.Established(awaiting.pendingKey()));
  }
}
