// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.crypto;

public class NoSessionKeyException extends IllegalStateException {
  public NoSessionKeyException(String message) {
    super(message);
  }
}
