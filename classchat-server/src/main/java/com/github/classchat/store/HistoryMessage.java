// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.store;

import com.github.classchat.MessageType;
import com.github.classchat.msg.Payload;

import java.io.Serializable;
import java.time.Instant;

/// One row of the append-only message history. For group traffic the receiver is the group name.
public record HistoryMessage(long id,
                             String sender,
                             String receiver,
                             MessageType type,
                             String text,
                             Instant timestamp,
                             boolean group,
                             String groupName) implements Serializable {

  public Payload.HistoryEntry toEntry() {
    return new Payload.HistoryEntry(sender, receiver, type, text, timestamp);
  }

  boolean between(String a, String b) {
    return !group && ((sender.equals(a) && receiver.equals(b)) || (sender.equals(b) && receiver.equals(a)));
  }

  boolean inGroup(String name) {
    return group && name.equals(groupName);
  }
}
