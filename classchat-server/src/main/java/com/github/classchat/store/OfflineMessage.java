// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.store;

import com.github.classchat.MessageType;

import java.io.Serializable;
import java.time.Instant;

/// A message held for a receiver who was not connected. The content is the pickled envelope exactly as it would have
/// been sent live. Once delivered is set it is never cleared.
public record OfflineMessage(long id,
                             String receiver,
                             String sender,
                             MessageType type,
                             byte[] content,
                             Instant timestamp,
                             boolean delivered,
                             boolean group,
                             String groupName) implements Serializable {

  OfflineMessage markedDelivered() {
    return new OfflineMessage(id, receiver, sender, type, content, timestamp, true, group, groupName);
  }
}
