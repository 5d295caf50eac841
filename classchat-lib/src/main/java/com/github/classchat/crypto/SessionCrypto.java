// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.crypto;

import com.github.classchat.Envelope;
import com.github.classchat.MessageType;
import com.github.classchat.msg.HandshakeStep;
import com.github.classchat.msg.Payload;

import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

/// The per-connection half of the hybrid scheme: a handshake state machine plus payload encryption once the state is
/// [HandshakeState.Established]. The server and the client each drive their own side of the exchange.
///
/// A connection is read by one thread and written by another so the state is volatile. It only moves forward.
public abstract sealed class SessionCrypto permits ServerSessionCrypto, ClientSessionCrypto {
  private static final Logger LOGGER = Logger.getLogger(SessionCrypto.class.getName());

  protected final String username;
  private volatile HandshakeState state = HandshakeState.NO_KEY;

  protected SessionCrypto(String username) {
    this.username = username;
  }

  public HandshakeState state() {
    return state;
  }

  public boolean established() {
    return state instanceof HandshakeState.Established;
  }

  /// Encrypts and base64 encodes, returning the ASCII bytes that go in a frame.
  ///
  /// @throws NoSessionKeyException before the handshake has completed
  public byte[] seal(byte[] plaintext) {
    return SessionCipher.encrypt(plaintext, sessionKey("encrypt")).getBytes(StandardCharsets.US_ASCII);
  }

  /// Reverses [#seal(byte[])].
  ///
  /// @throws NoSessionKeyException before the handshake has completed
  /// @throws DecryptionFailureException if the frame was not sealed under this session's key
  public byte[] open(byte[] frame) {
    final byte[] key = sessionKey("decrypt");
    return SessionCipher.decrypt(new String(frame, StandardCharsets.US_ASCII), key);
  }

  private byte[] sessionKey(String operation) {
    if (state instanceof HandshakeState.Established established) {
      return established.sessionKey();
    }
    throw new NoSessionKeyException("Cannot " + operation + " for " + username + " in state " + state.name());
  }

  /// Moves the state forward.
  ///
  /// @throws HandshakeFailureException if the connection is not in the expected state
  protected void transition(Class<? extends HandshakeState> from, HandshakeState to) {
    final HandshakeState current = requireState(from);
    state = to;
    LOGGER.finest(() -> String.format("%s handshake %s -> %s", username, current.name(), to.name()));
  }

  /// @throws HandshakeFailureException if the connection is not in the given state
  protected HandshakeState requireState(Class<? extends HandshakeState> expected) {
    final HandshakeState current = state;
    if (!expected.isInstance(current)) {
      throw new HandshakeFailureException("Handshake for " + username + " expected " + expected.getSimpleName()
          + " but was " + current.name());
    }
    return current;
  }

  /// Pulls the key exchange payload out of an envelope that must be a KEY_EXCHANGE at the given step.
  ///
  /// @throws HandshakeFailureException for any other envelope
  protected Payload.KeyExchange expectStep(Envelope envelope, HandshakeStep step, boolean needsMaterial) {
    if (envelope.type() != MessageType.KEY_EXCHANGE) {
      throw new HandshakeFailureException("Expected KEY_EXCHANGE but got " + envelope.type() + " from " + username);
    }
    final Payload.KeyExchange exchange = envelope.payload(Payload.KeyExchange.class)
        .orElseThrow(() -> new HandshakeFailureException("KEY_EXCHANGE without key exchange data from " + username));
    if (exchange.step() != step) {
      throw new HandshakeFailureException("Expected step " + step.tag() + " but got " + exchange.step().tag()
          + " from " + username);
    }
    if (needsMaterial && (exchange.keyMaterial() == null || exchange.keyMaterial().isEmpty())) {
      throw new HandshakeFailureException("Step " + step.tag() + " is missing key material from " + username);
    }
    return exchange;
  }
}
