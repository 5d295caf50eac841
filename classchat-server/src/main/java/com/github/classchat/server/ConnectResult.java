// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.server;

public sealed interface ConnectResult {
  record Accepted(String username) implements ConnectResult {
  }

  record UsernameTaken(String username) implements ConnectResult {
    public String message() {
      return "Username '" + username + "' is already taken";
    }
  }
}
