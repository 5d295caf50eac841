// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.server;

import com.github.classchat.Envelope;
import com.github.classchat.EnvelopePickler;
import com.github.classchat.MessageType;
import com.github.classchat.msg.Payload;
import com.github.classchat.store.ChatStore;
import com.github.classchat.store.HistoryMessage;
import com.github.classchat.store.OfflineMessage;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.TestOnly;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/// Owns the shared registries and makes every routing decision. One lock covers each read-decide-act sequence: the
/// check whether a recipient is live and the resulting deliver or enqueue happen with no connect or disconnect in
/// between. Store calls are made while holding the lock which serialises persistence behind it.
///
/// Two registries are kept:
///
/// - `connected` is every username with a connection, including those still in the key exchange. It enforces one
///   connection per username.
/// - `live` is the subset that has finished the key exchange and had its offline queue handed over. Only these get
///   direct delivery; everyone else is treated as offline.
///
/// Every request produces exactly one reply to its sender.
public class ChatRouter {
  private static final Logger LOGGER = Logger.getLogger(ChatRouter.class.getName());

  private final ChatStore store;
  private final ServerConfig config;
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, Peer> connected = new HashMap<>();
  private final Set<String> live = new HashSet<>();
  /// Members who joined while this process has been running. Routing uses the union of this and the store.
  private final Map<String, Set<String>> groupMembers = new HashMap<>();

  public ChatRouter(@NotNull ChatStore store, @NotNull ServerConfig config) {
    this.store = store;
    this.config = config;
  }

  /// Claims the username and records the user in the store. The key exchange happens after this returns and outside
  /// the lock.
  public ConnectResult connect(Peer peer) {
    final String username = peer.username();
    lock.lock();
    try {
      if (connected.containsKey(username)) {
        LOGGER.info(() -> "Rejected connection for " + username + " as the name is in use");
        return new ConnectResult.UsernameTaken(username);
      }
      connected.put(username, peer);
      store.registerUser(username);
    } finally {
      lock.unlock();
    }
    LOGGER.info(() -> username + " connected");
    return new ConnectResult.Accepted(username);
  }

  /// Called once the key exchange is done. Queues the offline count notice and every stored message onto the peer in
  /// the same critical section that makes it live, so nothing routed afterwards can overtake them. Each stored
  /// message is marked delivered by the writer only once it has actually been sent.
  ///
  /// @return how many stored messages were queued
  public int establish(Peer peer) {
    final String username = peer.username();
    lock.lock();
    try {
      if (connected.get(username) != peer) {
        LOGGER.warning(() -> "Ignoring establish for " + username + " which is no longer connected");
        return 0;
      }
      final List<OfflineMessage> pending = store.undelivered(username);
      if (!pending.isEmpty()) {
        peer.deliver(Envelope.offline(username, "You have " + pending.size() + " offline message(s)"));
        Duration pause = config.flushNoticePause();
        for (OfflineMessage message : pending) {
          final long id = message.id();
          peer.deliverStored(message.content(), pause, () -> store.markDelivered(username, List.of(id)));
          pause = config.flushItemPause();
        }
      }
      live.add(username);
      LOGGER.fine(() -> String.format("%s is live with %d offline message(s) queued", username, pending.size()));
      return pending.size();
    } finally {
      lock.unlock();
    }
  }

  /// Idempotent. Only removes the registration if it still belongs to this peer, so a rejected duplicate cannot
  /// evict the original.
  public void disconnect(Peer peer) {
    final String username = peer.username();
    lock.lock();
    try {
      if (connected.remove(username, peer)) {
        live.remove(username);
        LOGGER.info(() -> username + " disconnected");
      }
    } finally {
      lock.unlock();
    }
  }

  /// Dispatches one request from an established connection. The sender is always the connection's own username.
  public void handle(Peer from, Envelope envelope) {
    final String sender = from.username();
    LOGGER.finest(() -> String.format("%s sent %s", sender, envelope.type()));
    if (envelope.type().serverOnly()) {
      from.deliver(Envelope.error(sender, "Unsupported message type " + envelope.type()));
      return;
    }
    switch (envelope.type()) {
      case PRIVATE -> {
        if (envelope.receiver() == null || envelope.text() == null) {
          from.deliver(malformed(sender, envelope));
        } else {
          routePrivate(from, envelope.receiver(), envelope.text());
        }
      }
      case GROUP -> {
        if (envelope.receiver() == null || envelope.text() == null) {
          from.deliver(malformed(sender, envelope));
        } else {
          routeGroup(from, envelope.receiver(), envelope.text());
        }
      }
      case FILE -> envelope.payload(Payload.FileData.class)
          .filter(file -> envelope.receiver() != null)
          .ifPresentOrElse(file -> routeFile(from, envelope.receiver(), file),
              () -> from.deliver(malformed(sender, envelope)));
      case CREATE_GROUP -> envelope.payload(Payload.GroupRef.class)
          .ifPresentOrElse(group -> createGroup(from, group.name()),
              () -> from.deliver(malformed(sender, envelope)));
      case JOIN_GROUP -> envelope.payload(Payload.GroupRef.class)
          .ifPresentOrElse(group -> joinGroup(from, group.name()),
              () -> from.deliver(malformed(sender, envelope)));
      case LIST_USERS -> listUsers(from);
      case LIST_GROUPS -> listGroups(from);
      case HISTORY_REQUEST -> envelope.payload(Payload.HistoryQuery.class)
          .ifPresentOrElse(query -> history(from, query),
              () -> from.deliver(malformed(sender, envelope)));
      case DISCONNECT -> disconnect(from);
      case CONNECT -> from.deliver(Envelope.error(sender, "Already connected as '" + sender + "'"));
      case KEY_EXCHANGE -> from.deliver(Envelope.error(sender, "Session key already established"));
      default -> throw new IllegalStateException("Unhandled message type " + envelope.type());
    }
  }

  private static Envelope malformed(String sender, Envelope envelope) {
    return Envelope.error(sender, "Malformed " + envelope.type() + " request");
  }

  public void routePrivate(Peer from, String receiver, String text) {
    final String sender = from.username();
    lock.lock();
    try {
      if (!store.userExists(receiver)) {
        from.deliver(Envelope.error(sender, "User '" + receiver + "' does not exist. Cannot send message."));
        return;
      }
      store.appendHistory(sender, receiver, MessageType.PRIVATE, text, false);
      final Envelope message = Envelope.privateMessage(sender, receiver, text);
      final Optional<Peer> target = livePeer(receiver);
      if (target.isPresent()) {
        target.get().deliver(message);
        from.deliver(Envelope.success(sender, "Message delivered to " + receiver));
      } else {
        store.enqueueOffline(receiver, sender, MessageType.PRIVATE, EnvelopePickler.pickle(message), null);
        from.deliver(Envelope.offline(sender,
            "'" + receiver + "' is offline. Message will be delivered when they connect."));
      }
    } finally {
      lock.unlock();
    }
  }

  public void routeGroup(Peer from, String group, String text) {
    final String sender = from.username();
    lock.lock();
    try {
      if (!groupKnown(group)) {
        from.deliver(Envelope.error(sender, "Group '" + group + "' does not exist"));
        return;
      }
      store.appendHistory(sender, group, MessageType.GROUP, text, true);
      final Envelope message = Envelope.groupMessage(sender, group, text);
      byte[] pickled = null;
      int delivered = 0;
      int queued = 0;
      for (String member : recipients(group, sender)) {
        final Optional<Peer> target = livePeer(member);
        if (target.isPresent()) {
          target.get().deliver(message);
          delivered++;
        } else if (store.userExists(member)) {
          if (pickled == null) {
            pickled = EnvelopePickler.pickle(message);
          }
          store.enqueueOffline(member, sender, MessageType.GROUP, pickled, group);
          queued++;
        }
      }
      final int d = delivered;
      final int q = queued;
      LOGGER.fine(() -> String.format("%s to group %s: %d delivered %d queued", sender, group, d, q));
      from.deliver(Envelope.success(sender,
          "Message sent to group '" + group + "' (" + delivered + " delivered, " + queued + " queued)"));
    } finally {
      lock.unlock();
    }
  }

  /// Files go to whoever is live right now. They are neither written to history nor queued for anyone offline.
  public void routeFile(Peer from, String target, Payload.FileData file) {
    final String sender = from.username();
    final Envelope message = Envelope.file(sender, target, file.filename(), file.content(), file.toGroup());
    lock.lock();
    try {
      if (file.toGroup()) {
        if (!groupKnown(target)) {
          from.deliver(Envelope.error(sender, "Group '" + target + "' does not exist"));
          return;
        }
        int delivered = 0;
        for (String member : recipients(target, sender)) {
          final Optional<Peer> peer = livePeer(member);
          if (peer.isPresent()) {
            peer.get().deliver(message);
            delivered++;
          }
        }
        from.deliver(Envelope.success(sender,
            "File '" + file.filename() + "' delivered to " + delivered + " member(s) of '" + target + "'"));
      } else {
        if (!store.userExists(target)) {
          from.deliver(Envelope.error(sender, "User '" + target + "' does not exist. Cannot send file."));
          return;
        }
        final Optional<Peer> peer = livePeer(target);
        if (peer.isPresent()) {
          peer.get().deliver(message);
          from.deliver(Envelope.success(sender, "File '" + file.filename() + "' delivered to " + target));
        } else {
          from.deliver(Envelope.offline(sender,
              "'" + target + "' is offline. File '" + file.filename() + "' was not delivered."));
        }
      }
    } finally {
      lock.unlock();
    }
  }

  public void createGroup(Peer from, String name) {
    final String creator = from.username();
    lock.lock();
    try {
      if (name.isBlank()) {
        from.deliver(Envelope.error(creator, "Group name must not be blank"));
        return;
      }
      store.createGroup(name, creator).ifPresentOrElse(group -> {
        groupMembers.computeIfAbsent(name, k -> new HashSet<>()).add(creator);
        from.deliver(Envelope.success(creator, "Group '" + name + "' created"));
      }, () -> from.deliver(Envelope.error(creator, "Group '" + name + "' already exists")));
    } finally {
      lock.unlock();
    }
  }

  /// Joining twice is a no-op that still succeeds.
  public void joinGroup(Peer from, String name) {
    final String username = from.username();
    lock.lock();
    try {
      if (!groupKnown(name)) {
        from.deliver(Envelope.error(username, "Group '" + name + "' does not exist"));
        return;
      }
      final boolean added = store.addGroupMember(name, username);
      groupMembers.computeIfAbsent(name, k -> new HashSet<>()).add(username);
      from.deliver(Envelope.success(username,
          added ? "Joined group '" + name + "'" : "Already a member of group '" + name + "'"));
    } finally {
      lock.unlock();
    }
  }

  /// Every registered user with whether they are live.
  public void listUsers(Peer from) {
    final List<Payload.UserStatus> users = new ArrayList<>();
    lock.lock();
    try {
      store.allUsers().forEach(user ->
          users.add(new Payload.UserStatus(user.username(), live.contains(user.username()))));
    } finally {
      lock.unlock();
    }
    from.deliver(Envelope.userList(from.username(), new Payload.UserList(users)));
  }

  public void listGroups(Peer from) {
    final List<Payload.GroupSummary> groups = new ArrayList<>();
    lock.lock();
    try {
      store.allGroups().forEach(group -> groups.add(new Payload.GroupSummary(group.name(), group.creator())));
    } finally {
      lock.unlock();
    }
    from.deliver(Envelope.groupList(from.username(), new Payload.GroupList(groups)));
  }

  /// Empty rather than an error when there is nothing to return.
  public void history(Peer from, Payload.HistoryQuery query) {
    final String requester = from.username();
    final List<HistoryMessage> rows;
    lock.lock();
    try {
      rows = query.group()
          ? store.groupHistory(query.peer(), config.historyLimit())
          : store.conversationHistory(requester, query.peer(), config.historyLimit());
    } finally {
      lock.unlock();
    }
    final List<Payload.HistoryEntry> entries = rows.stream().map(HistoryMessage::toEntry).toList();
    from.deliver(Envelope.historyResponse(requester,
        new Payload.HistoryResult(query.peer(), query.group(), entries)));
  }

  @TestOnly
  boolean isLive(String username) {
    lock.lock();
    try {
      return live.contains(username);
    } finally {
      lock.unlock();
    }
  }

  // the helpers below are only called with the lock held

  private Optional<Peer> livePeer(String username) {
    return live.contains(username) ? Optional.ofNullable(connected.get(username)) : Optional.empty();
  }

  private boolean groupKnown(String group) {
    return groupMembers.containsKey(group) || store.groupExists(group);
  }

  /// Cached members plus stored members, less the sender, in name order.
  private SortedSet<String> recipients(String group, String sender) {
    final SortedSet<String> members = new TreeSet<>(store.groupMembers(group));
    members.addAll(groupMembers.getOrDefault(group, Set.of()));
    members.remove(sender);
    return members;
  }
}
