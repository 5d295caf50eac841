// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat;

/// Constants shared by the server and the client.
public final class ChatProtocol {
  private ChatProtocol() {
  }

  public static final int DEFAULT_PORT = 5555;

  /// The sender name on every envelope the server originates.
  public static final String SERVER_NAME = "SERVER";

  /// Largest attachment a client will send, checked before the file is read onto the wire.
  public static final int MAX_FILE_SIZE = 10 * 1024 * 1024;

  /// A 10 MiB attachment grows by a third once base64 encoded and then again by the padding
  /// and the envelope fields, so frames get comfortable headroom above that.
  public static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024 * 1024;

  public static final int HISTORY_MESSAGE_LIMIT = 20;

  public static final int RSA_KEY_BITS = 2048;
  public static final int SESSION_KEY_BYTES = 32;
  public static final int IV_BYTES = 16;
}
