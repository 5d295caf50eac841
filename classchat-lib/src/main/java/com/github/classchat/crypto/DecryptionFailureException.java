// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.crypto;

/// A frame that does not decrypt under the session key. Receive loops drop the frame and carry on.
public class DecryptionFailureException extends SecurityException {
  public DecryptionFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
