// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.server;

import com.github.classchat.ChatProtocol;
import com.github.classchat.Envelope;
import com.github.classchat.EnvelopePickler;
import com.github.classchat.MessageType;
import com.github.classchat.crypto.DecryptionFailureException;
import com.github.classchat.crypto.HandshakeFailureException;
import com.github.classchat.crypto.ServerKeyPair;
import com.github.classchat.crypto.ServerSessionCrypto;
import com.github.classchat.network.Frames;

import java.io.*;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Runs one connection from CONNECT to close on its own thread:
///
/// 1. read the plaintext CONNECT and claim the username
/// 2. send the welcome and run the key exchange, which must finish within the handshake timeout
/// 3. start the writer and go live, which queues any offline messages ahead of everything else
/// 4. read, decrypt and route until the client disconnects or the socket fails
///
/// Every failure is contained to this connection.
final class ConnectionHandler implements Runnable {
  private static final Logger LOGGER = Logger.getLogger(ConnectionHandler.class.getName());
  private static final int BUFFER_SIZE = 131072;

  private final Socket socket;
  private final ChatRouter router;
  private final ServerKeyPair serverKeys;
  private final ServerConfig config;
  private final Runnable onExit;

  ConnectionHandler(Socket socket, ChatRouter router, ServerKeyPair serverKeys, ServerConfig config, Runnable onExit) {
    this.socket = socket;
    this.router = router;
    this.serverKeys = serverKeys;
    this.config = config;
    this.onExit = onExit;
  }

  @Override
  public void run() {
    Session session = null;
    String username = String.valueOf(socket.getRemoteSocketAddress());
    try {
      socket.setTcpNoDelay(true);
      socket.setKeepAlive(true);
      socket.setSoTimeout((int) config.handshakeTimeout().toMillis());
      DataInputStream in = new DataInputStream(new BufferedInputStream(socket.getInputStream(), BUFFER_SIZE));
      DataOutputStream out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream(), BUFFER_SIZE));

      final Optional<Envelope> hello = EnvelopePickler.tryUnpickle(Frames.read(in, config.maxFrameBytes()));
      final Optional<String> rejection = validateConnect(hello);
      if (rejection.isPresent()) {
        LOGGER.info(() -> "Rejecting connection from " + socket.getRemoteSocketAddress() + ": " + rejection.get());
        Frames.write(out, EnvelopePickler.pickle(Envelope.error(null, rejection.get())));
        return;
      }
      username = hello.get().sender();

      final ServerSessionCrypto crypto = new ServerSessionCrypto(username, serverKeys);
      final Session candidate = new Session(username, socket, out, crypto);
      final ConnectResult result = router.connect(candidate);
      if (result instanceof ConnectResult.UsernameTaken taken) {
        candidate.sendPlain(Envelope.error(username, taken.message()));
        return;
      }
      session = candidate;

      session.sendPlain(Envelope.success(username, "Welcome to ClassChat, " + username + "!"));
      session.sendPlain(crypto.offerPublicKey());
      final String name = username;
      final Envelope reply = EnvelopePickler.tryUnpickle(Frames.read(in, config.maxFrameBytes()))
          .orElseThrow(() -> new HandshakeFailureException("Malformed key exchange from " + name));
      session.sendPlain(crypto.acceptSessionKey(reply));
      socket.setSoTimeout(0);
      LOGGER.fine(() -> "Session key established for " + name);

      session.startWriter();
      router.establish(session);
      receiveLoop(in, session);
    } catch (HandshakeFailureException e) {
      final String name = username;
      LOGGER.warning(() -> "Handshake failed for " + name + ": " + e.getMessage());
    } catch (SocketTimeoutException e) {
      final String name = username;
      LOGGER.warning(() -> "Handshake timed out for " + name);
    } catch (EOFException e) {
      final String name = username;
      LOGGER.fine(() -> name + " closed the connection");
    } catch (IOException e) {
      final String name = username;
      LOGGER.fine(() -> "Connection to " + name + " ended: " + e.getMessage());
    } catch (RuntimeException e) {
      LOGGER.log(Level.SEVERE, "Connection handler error for " + username + ": " + e.getMessage(), e);
    } finally {
      if (session != null) {
        router.disconnect(session);
        session.close();
      } else {
        ChatServer.closeQuietly(socket);
      }
      onExit.run();
    }
  }

  private static Optional<String> validateConnect(Optional<Envelope> hello) {
    if (hello.isEmpty() || hello.get().type() != MessageType.CONNECT) {
      return Optional.of("Expected CONNECT");
    }
    final String username = hello.get().sender();
    if (username.isBlank()) {
      return Optional.of("Username must not be blank");
    }
    if (ChatProtocol.SERVER_NAME.equalsIgnoreCase(username)) {
      return Optional.of("Username '" + username + "' is reserved");
    }
    return Optional.empty();
  }

  /// Undecryptable and malformed frames are dropped and the loop carries on. End of stream or any other I/O failure
  /// propagates and ends the connection.
  private void receiveLoop(DataInputStream in, Session session) throws IOException {
    final String username = session.username();
    while (!session.isClosed()) {
      final byte[] frame = Frames.read(in, config.maxFrameBytes());
      final byte[] plaintext;
      try {
        plaintext = session.crypto().open(frame);
      } catch (DecryptionFailureException e) {
        LOGGER.warning(() -> "Dropping frame from " + username + " that did not decrypt: " + e.getMessage());
        continue;
      }
      final Optional<Envelope> envelope = EnvelopePickler.tryUnpickle(plaintext);
      if (envelope.isEmpty()) {
        LOGGER.warning(() -> "Dropping malformed envelope from " + username);
        continue;
      }
      if (envelope.get().type() == MessageType.DISCONNECT) {
        LOGGER.fine(() -> username + " sent DISCONNECT");
        return;
      }
      router.handle(session, envelope.get());
    }
  }
}
