// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.client;

import java.io.IOException;

/// The server refused the CONNECT, usually because the username is already live. A retry with another name may work.
public class ConnectionRejectedException extends IOException {
  public ConnectionRejectedException(String message) {
    super(message);
  }
}
