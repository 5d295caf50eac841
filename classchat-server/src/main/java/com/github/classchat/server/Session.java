// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.server;

import com.github.classchat.Envelope;
import com.github.classchat.EnvelopePickler;
import com.github.classchat.crypto.ServerSessionCrypto;
import com.github.classchat.network.Frames;

import java.io.DataOutputStream;
import java.io.IOException;
import java.net.Socket;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/// One connected user. The connection handler thread reads, and a dedicated writer thread drains the outbound queue,
/// encrypting each envelope under the session key. Handshake envelopes go out in plaintext through [#sendPlain]
/// before the writer starts.
///
/// A failed write closes the socket, which ends the handler's blocking read and so runs the disconnect cleanup.
/// Anything still queued is abandoned; stored messages among it stay undelivered in the store.
final class Session implements Peer, AutoCloseable {
  private static final Logger LOGGER = Logger.getLogger(Session.class.getName());

  sealed interface Outbound {
    record Live(Envelope envelope) implements Outbound {
    }

    record Stored(byte[] pickled, Duration pauseBefore, Runnable onTransmitted) implements Outbound {
    }

    record Shutdown() implements Outbound {
    }
  }

  private final String username;
  private final Socket socket;
  private final DataOutputStream out;
  private final ServerSessionCrypto crypto;
  private final BlockingQueue<Outbound> outbound = new LinkedBlockingQueue<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  Session(String username, Socket socket, DataOutputStream out, ServerSessionCrypto crypto) {
    this.username = username;
    this.socket = socket;
    this.out = out;
    this.crypto = crypto;
  }

  @Override
  public String username() {
    return username;
  }

  ServerSessionCrypto crypto() {
    return crypto;
  }

  @Override
  public void deliver(Envelope envelope) {
    if (!closed.get()) {
      outbound.add(new Outbound.Live(envelope));
    }
  }

  @Override
  public void deliverStored(byte[] pickledEnvelope, Duration pauseBefore, Runnable onTransmitted) {
    if (!closed.get()) {
      outbound.add(new Outbound.Stored(pickledEnvelope, pauseBefore, onTransmitted));
    }
  }

  /// Writes straight to the socket without encryption. Only for the handshake.
  void sendPlain(Envelope envelope) throws IOException {
    synchronized (out) {
      Frames.write(out, EnvelopePickler.pickle(envelope));
    }
  }

  void startWriter() {
    Thread writer = new Thread(this::writeLoop, "classchat-writer-" + username);
    writer.setDaemon(true);
    writer.start();
  }

  private void writeLoop() {
    try {
      while (!closed.get()) {
        final Outbound next = outbound.take();
        if (next instanceof Outbound.Live live) {
          writeSealed(EnvelopePickler.pickle(live.envelope()));
        } else if (next instanceof Outbound.Stored stored) {
          if (!stored.pauseBefore().isZero()) {
            Thread.sleep(stored.pauseBefore().toMillis());
          }
          writeSealed(stored.pickled());
          stored.onTransmitted().run();
        } else {
          break;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (IOException e) {
      LOGGER.info(() -> "Write to " + username + " failed: " + e.getMessage());
      close();
    } catch (RuntimeException e) {
      LOGGER.log(Level.SEVERE, "Writer for " + username + " failed", e);
      close();
    }
    LOGGER.fine(() -> String.format("Writer for %s exiting with %d message(s) abandoned", username, outbound.size()));
  }

  private void writeSealed(byte[] pickled) throws IOException {
    final byte[] frame = crypto.seal(pickled);
    synchronized (out) {
      Frames.write(out, frame);
    }
  }

  boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      outbound.clear();
      outbound.add(new Outbound.Shutdown());
      ChatServer.closeQuietly(socket);
    }
  }
}
