// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat;

import java.util.Arrays;
import java.util.Optional;

/// The closed set of envelope kinds. The code is what goes over the wire so the declaration order can change freely.
public enum MessageType {
  CONNECT(1),
  DISCONNECT(2),
  PRIVATE(3),
  GROUP(4),
  FILE(5),
  CREATE_GROUP(6),
  JOIN_GROUP(7),
  LIST_USERS(8),
  LIST_GROUPS(9),
  HISTORY_REQUEST(10),
  HISTORY_RESPONSE(11),
  KEY_EXCHANGE(12),
  SUCCESS(13),
  ERROR(14),
  OFFLINE(15);

  private final byte code;

  MessageType(int code) {
    this.code = (byte) code;
  }

  public byte code() {
    return code;
  }

  /// Only the server may originate these. A client that sends one gets an error back.
  public boolean serverOnly() {
    return this == HISTORY_RESPONSE || this == SUCCESS || this == ERROR || this == OFFLINE;
  }

  public static Optional<MessageType> fromCode(byte code) {
    return Arrays.stream(values()).filter(t -> t.code == code).findFirst();
  }
}
