// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat;

/// Raised when bytes cannot be read back as an [Envelope]. Receive loops catch this and drop the frame.
public class MalformedEnvelopeException extends IllegalArgumentException {
  public MalformedEnvelopeException(String message) {
    super(message);
  }

  public MalformedEnvelopeException(String message, Throwable cause) {
    super(message, cause);
  }
}
