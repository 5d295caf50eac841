// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.msg;

import java.util.Arrays;
import java.util.Optional;

/// Tags carried by the three KEY_EXCHANGE envelopes, in the order they are exchanged.
public enum HandshakeStep {
  SERVER_PUBLIC_KEY("server_public_key"),
  CLIENT_SESSION_KEY("client_session_key"),
  COMPLETE("complete");

  private final String tag;

  HandshakeStep(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }

  public static Optional<HandshakeStep> fromTag(String tag) {
    return Arrays.stream(values()).filter(s -> s.tag.equals(tag)).findFirst();
  }
}
