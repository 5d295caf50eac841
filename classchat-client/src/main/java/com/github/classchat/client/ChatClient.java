// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.client;

import com.github.classchat.Envelope;
import com.github.classchat.EnvelopePickler;
import com.github.classchat.MessageType;
import com.github.classchat.crypto.ClientSessionCrypto;
import com.github.classchat.crypto.DecryptionFailureException;
import com.github.classchat.crypto.HandshakeFailureException;
import com.github.classchat.network.FrameAssembler;
import com.github.classchat.network.Frames;
import org.jetbrains.annotations.NotNull;

import java.io.EOFException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;
import java.util.logging.Level;
import java.util.logging.Logger;

/// A headless ClassChat client. [#connect] sends CONNECT, runs the key exchange and then starts a receive thread that
/// hands every decrypted envelope to a [ChatListener]. The send methods may be called from any thread.
///
/// The receive thread never blocks in a read. It waits on a [ReadinessWait] for at most the configured poll interval
/// and rechecks its running flag in between, so [#close()] takes effect promptly.
public class ChatClient implements AutoCloseable {
  private static final Logger LOGGER = Logger.getLogger(ChatClient.class.getName());
  private static final int BUFFER_SIZE = 131072;
  private static final long WRITE_BACKOFF_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

  private final String username;
  private final ClientConfig config;
  private final SocketChannel channel;
  private final ReadinessWait readiness;
  private final FrameAssembler assembler;
  private final ClientSessionCrypto crypto;
  private final ByteBuffer readBuffer = ByteBuffer.allocate(BUFFER_SIZE);
  private final Object writeLock = new Object();
  private volatile boolean running = true;
  private volatile Thread receiver;
  private String welcome;

  private ChatClient(String username, ClientConfig config, SocketChannel channel) throws IOException {
    this.username = username;
    this.config = config;
    this.channel = channel;
    this.readiness = ReadinessWait.forChannel(channel);
    this.assembler = new FrameAssembler(config.maxFrameBytes());
    this.crypto = new ClientSessionCrypto(username);
  }

  /// Connects and completes the key exchange before returning.
  ///
  /// @throws ConnectionRejectedException if the server refused the username
  /// @throws SocketTimeoutException if the exchange did not finish within the handshake timeout
  /// @throws HandshakeFailureException if the server's key exchange was malformed
  public static ChatClient connect(@NotNull ClientConfig config, @NotNull String username,
                                   @NotNull ChatListener listener) throws IOException {
    final SocketChannel channel = SocketChannel.open(new InetSocketAddress(config.host(), config.port()));
    channel.socket().setTcpNoDelay(true);
    final ChatClient client;
    try {
      client = new ChatClient(username, config, channel);
    } catch (IOException e) {
      channel.close();
      throw e;
    }
    try {
      client.handshake();
    } catch (IOException | RuntimeException e) {
      client.running = false;
      client.closeChannel();
      throw e;
    }
    client.startReceiver(listener);
    return client;
  }

  private void handshake() throws IOException {
    final Instant deadline = Instant.now().plus(config.handshakeTimeout());
    writeFrame(EnvelopePickler.pickle(Envelope.connect(username)));

    Envelope next = awaitPlaintext(deadline);
    if (next.type() == MessageType.ERROR) {
      throw new ConnectionRejectedException(next.textOpt().orElse("Connection rejected"));
    }
    if (next.type() == MessageType.SUCCESS) {
      welcome = next.text();
      LOGGER.fine(() -> username + " welcomed: " + welcome);
      next = awaitPlaintext(deadline);
    }
    writeFrame(EnvelopePickler.pickle(crypto.answerPublicKey(next)));
    crypto.confirm(awaitPlaintext(deadline));
    LOGGER.fine(() -> "Session key established for " + username);
  }

  private Envelope awaitPlaintext(Instant deadline) throws IOException {
    while (true) {
      final Optional<byte[]> frame = assembler.next();
      if (frame.isPresent()) {
        return EnvelopePickler.tryUnpickle(frame.get())
            .orElseThrow(() -> new HandshakeFailureException("Malformed handshake envelope for " + username));
      }
      final Duration remaining = Duration.between(Instant.now(), deadline);
      if (remaining.isNegative() || remaining.isZero()) {
        throw new SocketTimeoutException("Handshake timed out for " + username);
      }
      if (readiness.awaitReadable(remaining)) {
        readAvailable();
      }
    }
  }

  private void readAvailable() throws IOException {
    readBuffer.clear();
    final int read = channel.read(readBuffer);
    if (read < 0) {
      throw new EOFException("Server closed the connection");
    }
    readBuffer.flip();
    assembler.append(readBuffer);
  }

  private void startReceiver(ChatListener listener) {
    Thread thread = new Thread(() -> receiveLoop(listener), "classchat-receiver-" + username);
    thread.setDaemon(true);
    receiver = thread;
    thread.start();
  }

  private void receiveLoop(ChatListener listener) {
    try {
      while (running) {
        drain(listener);
        if (readiness.awaitReadable(config.pollInterval())) {
          readAvailable();
        }
      }
    } catch (EOFException e) {
      LOGGER.info(() -> "Server closed the connection for " + username);
    } catch (ClosedSelectorException e) {
      // close() gave up waiting for this thread and closed the selector under it
      LOGGER.fine(() -> "Receiver for " + username + " stopped by close");
    } catch (IOException e) {
      if (running) {
        LOGGER.log(Level.WARNING, "Receive failed for " + username, e);
      }
    } finally {
      running = false;
      closeChannel();
      listener.onClosed();
    }
  }

  private void drain(ChatListener listener) {
    Optional<byte[]> frame;
    while ((frame = assembler.next()).isPresent()) {
      final byte[] plaintext;
      try {
        plaintext = crypto.open(frame.get());
      } catch (DecryptionFailureException e) {
        LOGGER.warning(() -> "Dropping frame for " + username + " that did not decrypt: " + e.getMessage());
        continue;
      }
      final Optional<Envelope> envelope = EnvelopePickler.tryUnpickle(plaintext);
      if (envelope.isEmpty()) {
        LOGGER.warning(() -> "Dropping malformed envelope for " + username);
        continue;
      }
      try {
        listener.onEnvelope(envelope.get());
      } catch (RuntimeException e) {
        LOGGER.log(Level.SEVERE, "Listener failed on " + envelope.get().type(), e);
      }
    }
  }

  /// Encrypts and sends.
  ///
  /// @throws com.github.classchat.crypto.NoSessionKeyException if the key exchange has not finished
  public void send(Envelope envelope) throws IOException {
    writeFrame(crypto.seal(EnvelopePickler.pickle(envelope)));
  }

  private void writeFrame(byte[] body) throws IOException {
    final ByteBuffer buffer = Frames.encode(body);
    synchronized (writeLock) {
      while (buffer.hasRemaining()) {
        if (channel.write(buffer) == 0) {
          // the socket send buffer is full; a large attachment can take a while to drain
          LockSupport.parkNanos(WRITE_BACKOFF_NANOS);
        }
      }
    }
  }

  public void sendPrivate(String receiver, String text) throws IOException {
    send(Envelope.privateMessage(username, receiver, text));
  }

  public void sendGroup(String group, String text) throws IOException {
    send(Envelope.groupMessage(username, group, text));
  }

  /// @throws IllegalArgumentException if the file is larger than the configured limit, before anything is sent
  public void sendFile(String target, Path file, boolean toGroup) throws IOException {
    final long size = Files.size(file);
    checkFileSize(file.getFileName().toString(), size);
    sendFile(target, file.getFileName().toString(), Files.readAllBytes(file), toGroup);
  }

  /// @throws IllegalArgumentException if the content is larger than the configured limit, before anything is sent
  public void sendFile(String target, String filename, byte[] content, boolean toGroup) throws IOException {
    checkFileSize(filename, content.length);
    send(Envelope.file(username, target, filename, content, toGroup));
  }

  private void checkFileSize(String filename, long size) {
    if (size > config.maxFileBytes()) {
      throw new IllegalArgumentException(String.format("File '%s' is %d bytes which is over the %d byte limit",
          filename, size, config.maxFileBytes()));
    }
  }

  public void createGroup(String name) throws IOException {
    send(Envelope.createGroup(username, name));
  }

  public void joinGroup(String name) throws IOException {
    send(Envelope.joinGroup(username, name));
  }

  public void listUsers() throws IOException {
    send(Envelope.listUsers(username));
  }

  public void listGroups() throws IOException {
    send(Envelope.listGroups(username));
  }

  public void requestHistory(String peer, boolean group) throws IOException {
    send(Envelope.historyRequest(username, peer, group));
  }

  public String username() {
    return username;
  }

  /// The server's greeting, if it sent one.
  public Optional<String> welcome() {
    return Optional.ofNullable(welcome);
  }

  public boolean isConnected() {
    return running && channel.isOpen();
  }

  /// Tells the server we are going, then closes.
  public void disconnect() {
    if (isConnected()) {
      try {
        send(Envelope.disconnect(username));
      } catch (IOException e) {
        LOGGER.fine(() -> "DISCONNECT for " + username + " not sent: " + e.getMessage());
      }
    }
    close();
  }

  /// Stops the receive thread. Safe to call from a listener callback.
  @Override
  public void close() {
    running = false;
    readiness.wakeup();
    final Thread thread = receiver;
    if (thread != null && thread != Thread.currentThread()) {
      try {
        thread.join(config.pollInterval().toMillis() * 2);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    closeChannel();
  }

  private void closeChannel() {
    try {
      readiness.close();
    } catch (IOException e) {
      LOGGER.finest(() -> "Ignoring selector close failure: " + e.getMessage());
    }
    try {
      channel.close();
    } catch (IOException e) {
      LOGGER.finest(() -> "Ignoring channel close failure: " + e.getMessage());
    }
  }
}
