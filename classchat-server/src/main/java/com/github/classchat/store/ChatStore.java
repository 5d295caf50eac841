// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.store;

import com.github.classchat.MessageType;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.logging.Logger;

/// Durable chat state in an embedded MVStore. There is one map per table:
///
/// - `users` keyed by username
/// - `message_history` keyed by a sequence so that key order is insertion order
/// - `offline_messages` keyed by a second sequence with the same property
/// - `groups` keyed by group name
/// - `group_members` keyed by group name and username joined with a NUL so that the members of a group are one
///   contiguous key range
///
/// Three index maps hold sequence numbers under NUL separated prefixes in the same way. History is indexed by
/// conversation and by group, and offline messages are indexed by receiver while they are undelivered. Reads
/// range-scan an index rather than walk a whole table.
///
/// Each mutating method commits before it returns. There are no transactions spanning calls. The mutating methods
/// are synchronized so that the read-then-write steps they contain do not interleave.
public class ChatStore implements AutoCloseable {
  private static final Logger LOGGER = Logger.getLogger(ChatStore.class.getName());

  static final String MAP_PREFIX = "com.github.classchat.store#";
  private static final char SEPARATOR = '\u0000';
  // sorts after every digit so that prefix + UPPER_BOUND is past the last key of a prefix
  private static final String UPPER_BOUND = ":";

  private final MVStore store;
  private final MVMap<String, StoredUser> users;
  private final MVMap<Long, HistoryMessage> history;
  private final MVMap<Long, OfflineMessage> offline;
  private final MVMap<String, ChatGroup> groups;
  private final MVMap<String, GroupMembership> members;
  private final MVMap<String, Long> historyByConversation;
  private final MVMap<String, Long> historyByGroup;
  private final MVMap<String, Long> pendingByReceiver;
  private final AtomicLong historySequence;
  private final AtomicLong offlineSequence;

  public ChatStore(MVStore store) {
    this.store = store;
    this.users = store.openMap(MAP_PREFIX + "users");
    this.history = store.openMap(MAP_PREFIX + "message_history");
    this.offline = store.openMap(MAP_PREFIX + "offline_messages");
    this.groups = store.openMap(MAP_PREFIX + "groups");
    this.members = store.openMap(MAP_PREFIX + "group_members");
    this.historyByConversation = store.openMap(MAP_PREFIX + "message_history_by_conversation");
    this.historyByGroup = store.openMap(MAP_PREFIX + "message_history_by_group");
    this.pendingByReceiver = store.openMap(MAP_PREFIX + "offline_messages_pending");
    this.historySequence = new AtomicLong(Optional.ofNullable(history.lastKey()).orElse(0L));
    this.offlineSequence = new AtomicLong(Optional.ofNullable(offline.lastKey()).orElse(0L));
  }

  /// Opens or creates the store.
  ///
  /// @param fileName the MVStore file, or null for a store that lives only in memory
  public static ChatStore open(@Nullable String fileName) {
    final MVStore store = fileName == null
        ? MVStore.open(null)
        : new MVStore.Builder().fileName(fileName).compress().open();
    LOGGER.info(() -> "Opened chat store " + (fileName == null ? "in memory" : fileName));
    return new ChatStore(store);
  }

  // ---------------------------------------------------------------- users

  /// Creates the user on first sight, otherwise moves last_seen on.
  public synchronized StoredUser registerUser(@NotNull String username) {
    final Instant now = Instant.now();
    final StoredUser user = Optional.ofNullable(users.get(username))
        .map(existing -> existing.seenAt(now))
        .orElseGet(() -> new StoredUser(username, now, now));
    users.put(username, user);
    store.commit();
    LOGGER.finest(() -> "Registered " + user);
    return user;
  }

  public boolean userExists(String username) {
    return users.containsKey(username);
  }

  /// Ordered by username.
  public List<StoredUser> allUsers() {
    return List.copyOf(users.values());
  }

  // ---------------------------------------------------------------- history

  /// Appends to the history. For group traffic the receiver is the group name.
  public synchronized HistoryMessage appendHistory(String sender, String receiver, MessageType type,
                                                   String text, boolean group) {
    final HistoryMessage message = new HistoryMessage(historySequence.incrementAndGet(), sender, receiver, type,
        text, Instant.now(), group, group ? receiver : null);
    history.put(message.id(), message);
    if (group) {
      historyByGroup.put(indexKey(receiver, message.id()), message.id());
    } else {
      historyByConversation.put(indexKey(conversation(sender, receiver), message.id()), message.id());
    }
    store.commit();
    return message;
  }

  /// The most recent private messages between two users in either direction, oldest first.
  public List<HistoryMessage> conversationHistory(String a, String b, int limit) {
    return newestFirstThenReversed(historyByConversation, conversation(a, b), message -> message.between(a, b),
        limit);
  }

  /// The most recent messages sent to a group, oldest first.
  public List<HistoryMessage> groupHistory(String groupName, int limit) {
    return newestFirstThenReversed(historyByGroup, groupName, message -> message.inGroup(groupName), limit);
  }

  private List<HistoryMessage> newestFirstThenReversed(MVMap<String, Long> index, String prefix,
                                                       Predicate<HistoryMessage> matches, int limit) {
    final String start = prefix + SEPARATOR;
    final List<HistoryMessage> result = new ArrayList<>();
    String key = index.lowerKey(start + UPPER_BOUND);
    while (key != null && key.startsWith(start) && result.size() < limit) {
      final HistoryMessage message = history.get(index.get(key));
      if (message != null && matches.test(message)) {
        result.add(message);
      }
      key = index.lowerKey(key);
    }
    Collections.reverse(result);
    return result;
  }

  /// Both directions of a conversation share one key.
  private static String conversation(String a, String b) {
    return a.compareTo(b) <= 0 ? a + SEPARATOR + b : b + SEPARATOR + a;
  }

  // ---------------------------------------------------------------- offline queue

  public synchronized OfflineMessage enqueueOffline(String receiver, String sender, MessageType type,
                                                    byte[] content, @Nullable String groupName) {
    final OfflineMessage message = new OfflineMessage(offlineSequence.incrementAndGet(), receiver, sender, type,
        content, Instant.now(), false, groupName != null, groupName);
    offline.put(message.id(), message);
    pendingByReceiver.put(indexKey(receiver, message.id()), message.id());
    store.commit();
    LOGGER.finest(() -> String.format("Queued offline message %d from %s for %s", message.id(), sender, receiver));
    return message;
  }

  /// Every undelivered message for the receiver in the order they were queued.
  public List<OfflineMessage> undelivered(String receiver) {
    final String prefix = receiver + SEPARATOR;
    final List<OfflineMessage> result = new ArrayList<>();
    final var cursor = pendingByReceiver.cursor(prefix);
    while (cursor.hasNext()) {
      final String key = cursor.next();
      if (!key.startsWith(prefix)) {
        break;
      }
      final OfflineMessage message = offline.get(cursor.getValue());
      if (message != null && !message.delivered()) {
        result.add(message);
      }
    }
    return result;
  }

  /// Marks the listed messages delivered. Ids that belong to someone else or that are already delivered are skipped,
  /// so calling this twice is harmless.
  ///
  /// @return how many rows changed
  public synchronized int markDelivered(String receiver, Collection<Long> ids) {
    int changed = 0;
    for (Long id : ids) {
      final OfflineMessage message = offline.get(id);
      if (message != null && !message.delivered() && message.receiver().equals(receiver)) {
        offline.put(id, message.markedDelivered());
        pendingByReceiver.remove(indexKey(receiver, id));
        changed++;
      }
    }
    if (changed > 0) {
      store.commit();
    }
    return changed;
  }

  /// Marks every undelivered message for the receiver.
  public int markDelivered(String receiver) {
    return markDelivered(receiver, undelivered(receiver).stream().map(OfflineMessage::id).toList());
  }

  // ---------------------------------------------------------------- groups

  /// @return the new group, or empty if the name is taken
  public synchronized Optional<ChatGroup> createGroup(String name, String creator) {
    if (groups.containsKey(name)) {
      return Optional.empty();
    }
    final Instant now = Instant.now();
    final ChatGroup group = new ChatGroup(name, creator, now);
    groups.put(name, group);
    members.put(memberKey(name, creator), new GroupMembership(name, creator, now));
    store.commit();
    LOGGER.fine(() -> "Created group " + name + " for " + creator);
    return Optional.of(group);
  }

  public boolean groupExists(String name) {
    return groups.containsKey(name);
  }

  public Optional<ChatGroup> findGroup(String name) {
    return Optional.ofNullable(groups.get(name));
  }

  /// Ordered by name.
  public List<ChatGroup> allGroups() {
    return List.copyOf(groups.values());
  }

  /// @return true if a row was added, false if the user was already a member
  public synchronized boolean addGroupMember(String groupName, String username) {
    final String key = memberKey(groupName, username);
    if (members.containsKey(key)) {
      return false;
    }
    members.put(key, new GroupMembership(groupName, username, Instant.now()));
    store.commit();
    return true;
  }

  public boolean isGroupMember(String groupName, String username) {
    return members.containsKey(memberKey(groupName, username));
  }

  /// Ordered by username.
  public List<String> groupMembers(String groupName) {
    final String prefix = groupName + SEPARATOR;
    final List<String> result = new ArrayList<>();
    final var cursor = members.cursor(prefix);
    while (cursor.hasNext()) {
      final String key = cursor.next();
      if (!key.startsWith(prefix)) {
        break;
      }
      result.add(cursor.getValue().username());
    }
    return result;
  }

  private static String memberKey(String groupName, String username) {
    return groupName + SEPARATOR + username;
  }

  /// Zero padded so that string order matches sequence order.
  private static String indexKey(String prefix, long id) {
    return prefix + SEPARATOR + String.format("%019d", id);
  }

  @Override
  public void close() {
    // this will commit any pending changes
    store.close();
  }
}
