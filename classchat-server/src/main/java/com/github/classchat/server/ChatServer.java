// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.server;

import com.github.classchat.crypto.ServerKeyPair;
import com.github.classchat.store.ChatStore;
import org.jetbrains.annotations.TestOnly;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/// The chat server: an accept loop handing each socket to a [ConnectionHandler] on its own thread. One RSA keypair is
/// generated at startup and shared by every connection's key exchange.
public class ChatServer implements AutoCloseable {
  private static final Logger LOGGER = Logger.getLogger(ChatServer.class.getName());

  private static final String HELP = "help";
  private static final String SERVER_PORT = "server-port";
  private static final String DB_FILE = "db-file";

  private final ServerConfig config;
  private final ServerSocket serverSocket;
  private final ChatStore store;
  private final ChatRouter router;
  private final ServerKeyPair serverKeys;
  private final Set<Socket> clients = ConcurrentHashMap.newKeySet();
  private final AtomicLong connectionCounter = new AtomicLong();
  private volatile boolean running = true;

  public ChatServer(ServerConfig config) throws IOException {
    this(config, ChatStore.open(config.dbFile()));
  }

  /// Takes ownership of the store and closes it on [#close()].
  public ChatServer(ServerConfig config, ChatStore store) throws IOException {
    this.config = config;
    this.store = store;
    this.serverKeys = ServerKeyPair.generate();
    this.router = new ChatRouter(store, config);
    this.serverSocket = new ServerSocket();
    this.serverSocket.setReuseAddress(true);
    this.serverSocket.bind(new InetSocketAddress(config.host(), config.port()));
    LOGGER.info(() -> "ClassChat server listening on " + serverSocket.getLocalSocketAddress());
  }

  /// Blocks accepting connections until [#close()].
  public void start() {
    while (running) {
      try {
        Socket clientSocket = serverSocket.accept();
        clients.add(clientSocket);
        final long id = connectionCounter.incrementAndGet();
        LOGGER.fine(() -> "Accepted connection " + id + " from " + clientSocket.getRemoteSocketAddress());
        Thread handler = new Thread(
            new ConnectionHandler(clientSocket, router, serverKeys, config, () -> clients.remove(clientSocket)),
            "classchat-connection-" + id);
        handler.setDaemon(true);
        handler.start();
      } catch (IOException e) {
        if (!running) {
          break;
        }
        LOGGER.log(Level.SEVERE, "Error accepting client connection", e);
      }
    }
    LOGGER.info("Server has shut down.");
  }

  public int getPort() {
    return serverSocket.getLocalPort();
  }

  @TestOnly
  ChatRouter router() {
    return router;
  }

  @TestOnly
  ChatStore store() {
    return store;
  }

  @Override
  public void close() throws IOException {
    if (!running) {
      return;
    }
    running = false;
    serverSocket.close();
    clients.forEach(ChatServer::closeQuietly);
    store.close();
  }

  static void closeQuietly(Closeable closeable) {
    try {
      closeable.close();
    } catch (IOException e) {
      LOGGER.finest(() -> "Ignoring close failure: " + e.getMessage());
    }
  }

  public static void main(String[] args) {
    CommandLineParser parser = new CommandLineParser();
    ServerConfig config = ServerConfig.fromSystemProperties();
    try {
      parser.parse(args);
      if (parser.hasOption(HELP) || parser.hasOption("h")) {
        printHelp();
        return;
      }
      config = config.withPort(parser.getIntOption(SERVER_PORT).orElse(config.port()));
      if (parser.hasOption(DB_FILE)) {
        config = config.withDbFile(parser.getOption(DB_FILE).orElseThrow());
      }
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      printHelp();
      return;
    }

    LoggerConfig.initialize();
    try (ChatServer server = new ChatServer(config)) {
      Runtime.getRuntime().addShutdownHook(new Thread(() -> {
        try {
          server.close();
        } catch (IOException e) {
          LOGGER.log(Level.WARNING, "Error closing server", e);
        }
      }, "classchat-shutdown"));
      server.start();
    } catch (IOException e) {
      LOGGER.log(Level.SEVERE, "Could not start server: " + e.getMessage(), e);
    }
  }

  private static void printHelp() {
    System.out.println("Usage: java " + ChatServer.class.getName() + " [options]");
    System.out.println("  --" + SERVER_PORT + "=5555      Server TCP port to listen on");
    System.out.println("  --" + DB_FILE + "=classchat     MVStore file name, or :memory:");
    System.out.println("  -h, --help              Show this help message");
    System.out.println("Other settings are read from -Dclasschat.<name> system properties.");
  }
}
