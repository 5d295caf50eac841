// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.crypto;

/// The key exchange went wrong: a step out of order, missing key material or a key that would not decrypt. The
/// connection is closed and there is no retry.
public class HandshakeFailureException extends SecurityException {
  public HandshakeFailureException(String message) {
    super(message);
  }

  public HandshakeFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
