// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.client;

import com.github.classchat.Envelope;

/// Callbacks from the client's receive thread. Implementations should hand work off rather than block.
public interface ChatListener {
  void onEnvelope(Envelope envelope);

  /// The connection has ended, whether by [ChatClient#close()] or by the server.
  default void onClosed() {
  }
}
