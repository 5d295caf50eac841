// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat;

import com.github.classchat.msg.HandshakeStep;
import com.github.classchat.msg.Payload;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;

import static com.github.classchat.ChatProtocol.SERVER_NAME;

/// The unit of exchange between client and server. Both sides build envelopes with the static factories below rather
/// than the canonical constructor so that each kind of message always has the same shape.
///
/// @param type     the kind of message
/// @param sender   who sent it. The server ignores this on inbound traffic and routes under the session's own name.
/// @param receiver the user or group the message is for, where there is one
/// @param text     the human-readable body, where there is one
/// @param payload  the typed data, where there is any
public record Envelope(@NotNull MessageType type,
                       @NotNull String sender,
                       @Nullable String receiver,
                       @Nullable String text,
                       @Nullable Payload payload) {

  public Envelope {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(sender, "sender");
  }

  public Optional<String> textOpt() {
    return Optional.ofNullable(text);
  }

  /// The payload if it is of the expected kind.
  public <T extends Payload> Optional<T> payload(Class<T> kind) {
    return kind.isInstance(payload) ? Optional.of(kind.cast(payload)) : Optional.empty();
  }

  public static Envelope connect(String username) {
    return new Envelope(MessageType.CONNECT, username, null, null, null);
  }

  public static Envelope disconnect(String username) {
    return new Envelope(MessageType.DISCONNECT, username, null, null, null);
  }

  public static Envelope privateMessage(String sender, String receiver, String text) {
    return new Envelope(MessageType.PRIVATE, sender, receiver, text, null);
  }

  public static Envelope groupMessage(String sender, String group, String text) {
    return new Envelope(MessageType.GROUP, sender, group, text, null);
  }

  public static Envelope file(String sender, String target, String filename, byte[] content, boolean toGroup) {
    return new Envelope(MessageType.FILE, sender, target, null,
        new Payload.FileData(filename, content, toGroup));
  }

  public static Envelope createGroup(String sender, String group) {
    return new Envelope(MessageType.CREATE_GROUP, sender, null, null, new Payload.GroupRef(group));
  }

  public static Envelope joinGroup(String sender, String group) {
    return new Envelope(MessageType.JOIN_GROUP, sender, null, null, new Payload.GroupRef(group));
  }

  public static Envelope listUsers(String sender) {
    return new Envelope(MessageType.LIST_USERS, sender, null, null, null);
  }

  public static Envelope listGroups(String sender) {
    return new Envelope(MessageType.LIST_GROUPS, sender, null, null, null);
  }

  public static Envelope historyRequest(String sender, String peer, boolean group) {
    return new Envelope(MessageType.HISTORY_REQUEST, sender, null, null, new Payload.HistoryQuery(peer, group));
  }

  public static Envelope historyResponse(String receiver, Payload.HistoryResult result) {
    return new Envelope(MessageType.HISTORY_RESPONSE, SERVER_NAME, receiver, null, result);
  }

  public static Envelope userList(String receiver, Payload.UserList users) {
    return new Envelope(MessageType.LIST_USERS, SERVER_NAME, receiver, null, users);
  }

  public static Envelope groupList(String receiver, Payload.GroupList groups) {
    return new Envelope(MessageType.LIST_GROUPS, SERVER_NAME, receiver, null, groups);
  }

  public static Envelope serverPublicKey(String receiver, String publicKey) {
    return new Envelope(MessageType.KEY_EXCHANGE, SERVER_NAME, receiver, null,
        new Payload.KeyExchange(HandshakeStep.SERVER_PUBLIC_KEY, publicKey));
  }

  public static Envelope clientSessionKey(String sender, String encryptedSessionKey) {
    return new Envelope(MessageType.KEY_EXCHANGE, sender, SERVER_NAME, null,
        new Payload.KeyExchange(HandshakeStep.CLIENT_SESSION_KEY, encryptedSessionKey));
  }

  public static Envelope handshakeComplete(String receiver) {
    return new Envelope(MessageType.KEY_EXCHANGE, SERVER_NAME, receiver, null,
        new Payload.KeyExchange(HandshakeStep.COMPLETE, null));
  }

  public static Envelope success(String receiver, String text) {
    return new Envelope(MessageType.SUCCESS, SERVER_NAME, receiver, text, null);
  }

  public static Envelope error(String receiver, String text) {
    return new Envelope(MessageType.ERROR, SERVER_NAME, receiver, text, null);
  }

  public static Envelope offline(String receiver, String text) {
    return new Envelope(MessageType.OFFLINE, SERVER_NAME, receiver, text, null);
  }
}
