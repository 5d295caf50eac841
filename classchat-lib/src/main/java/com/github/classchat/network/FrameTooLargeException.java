// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.network;

import java.io.IOException;

/// A length prefix outside the allowed range. The stream can no longer be trusted so this ends the connection.
public class FrameTooLargeException extends IOException {
  public FrameTooLargeException(String message) {
    super(message);
  }
}
