// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.msg;

import com.github.classchat.MessageType;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// The typed `data` part of an envelope. Each kind of request or response that carries structure has exactly one
/// record here so that the router and the client pattern match rather than poke around in a dictionary.
public sealed interface Payload {

  /// An attachment. The content travels inline so it is bounded by the frame size.
  record FileData(String filename, byte[] content, boolean toGroup) implements Payload {
    public FileData {
      Objects.requireNonNull(filename, "filename");
      Objects.requireNonNull(content, "content");
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof FileData other)) return false;
      return toGroup == other.toGroup && filename.equals(other.filename) && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
      return 31 * Objects.hash(filename, toGroup) + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
      return "FileData[filename=" + filename + ", size=" + content.length + ", toGroup=" + toGroup + "]";
    }
  }

  record GroupRef(String name) implements Payload {
    public GroupRef {
      Objects.requireNonNull(name, "name");
    }
  }

  /// Asks for the recent conversation with a user, or the recent traffic of a group.
  record HistoryQuery(String peer, boolean group) implements Payload {
    public HistoryQuery {
      Objects.requireNonNull(peer, "peer");
    }
  }

  record HistoryEntry(String sender, String receiver, MessageType type, String text, Instant timestamp) {
    public HistoryEntry {
      Objects.requireNonNull(sender, "sender");
      Objects.requireNonNull(receiver, "receiver");
      Objects.requireNonNull(type, "type");
      Objects.requireNonNull(timestamp, "timestamp");
    }
  }

  /// Oldest first.
  record HistoryResult(String peer, boolean group, List<HistoryEntry> messages) implements Payload {
    public HistoryResult {
      Objects.requireNonNull(peer, "peer");
      messages = List.copyOf(messages);
    }
  }

  record UserStatus(String username, boolean online) {
    public UserStatus {
      Objects.requireNonNull(username, "username");
    }
  }

  record UserList(List<UserStatus> users) implements Payload {
    public UserList {
      users = List.copyOf(users);
    }
  }

  record GroupSummary(String name, String creator) {
    public GroupSummary {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(creator, "creator");
    }
  }

  record GroupList(List<GroupSummary> groups) implements Payload {
    public GroupList {
      groups = List.copyOf(groups);
    }
  }

  /// One step of the key exchange. The material is the base64 public key, the base64 wrapped session key, or
  /// absent on `complete`.
  record KeyExchange(HandshakeStep step, String keyMaterial) implements Payload {
    public KeyExchange {
      Objects.requireNonNull(step, "step");
    }
  }
}
