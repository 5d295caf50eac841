// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.store;

import com.github.classchat.MessageType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChatStoreTest {
  private ChatStore store;

  @BeforeEach
  void setUp() {
    store = ChatStore.open(null);
  }

  @AfterEach
  void tearDown() {
    store.close();
  }

  @Test
  void registerCreatesThenTouchesLastSeen() throws InterruptedException {
    StoredUser first = store.registerUser("alice");
    assertThat(first.registeredAt()).isEqualTo(first.lastSeen());
    Thread.sleep(5);
    StoredUser second = store.registerUser("alice");
    assertThat(second.registeredAt()).isEqualTo(first.registeredAt());
    assertThat(second.lastSeen()).isAfter(first.lastSeen());
    assertThat(store.allUsers()).hasSize(1);
  }

  @Test
  void usersAreListedByName() {
    store.registerUser("carol");
    store.registerUser("alice");
    store.registerUser("bob");
    assertThat(store.allUsers()).extracting(StoredUser::username).containsExactly("alice", "bob", "carol");
    assertThat(store.userExists("bob")).isTrue();
    assertThat(store.userExists("dave")).isFalse();
  }

  @Test
  void conversationHistoryIsTheSameFromEitherSide() {
    store.appendHistory("alice", "bob", MessageType.PRIVATE, "hi bob", false);
    store.appendHistory("bob", "alice", MessageType.PRIVATE, "hi alice", false);
    store.appendHistory("alice", "carol", MessageType.PRIVATE, "not for bob", false);
    store.appendHistory("alice", "bob", MessageType.PRIVATE, "how are you", false);

    List<HistoryMessage> ab = store.conversationHistory("alice", "bob", 20);
    List<HistoryMessage> ba = store.conversationHistory("bob", "alice", 20);
    assertThat(ab).isEqualTo(ba);
    assertThat(ab).extracting(HistoryMessage::text).containsExactly("hi bob", "hi alice", "how are you");
  }

  @Test
  void historyKeepsTheMostRecentOldestFirst() {
    for (int i = 1; i <= 25; i++) {
      store.appendHistory("alice", "bob", MessageType.PRIVATE, "message " + i, false);
    }
    List<HistoryMessage> recent = store.conversationHistory("bob", "alice", 20);
    assertThat(recent).hasSize(20);
    assertThat(recent.get(0).text()).isEqualTo("message 6");
    assertThat(recent.get(19).text()).isEqualTo("message 25");
  }

  @Test
  void groupHistoryIsSeparateFromPrivateHistory() {
    store.appendHistory("alice", "cs101", MessageType.GROUP, "hello", true);
    store.appendHistory("alice", "cs102", MessageType.GROUP, "other group", true);
    // a user who happens to share the group's name
    store.appendHistory("bob", "cs101", MessageType.PRIVATE, "private", false);

    assertThat(store.groupHistory("cs101", 20)).extracting(HistoryMessage::text).containsExactly("hello");
    assertThat(store.conversationHistory("bob", "cs101", 20)).extracting(HistoryMessage::text)
        .containsExactly("private");
    assertThat(store.groupHistory("nobody", 20)).isEmpty();
  }

  @Test
  void offlineMessagesComeBackInQueueOrderForTheirReceiverOnly() {
    store.enqueueOffline("bob", "alice", MessageType.PRIVATE, new byte[]{1}, null);
    store.enqueueOffline("carol", "alice", MessageType.PRIVATE, new byte[]{2}, null);
    store.enqueueOffline("bob", "carol", MessageType.GROUP, new byte[]{3}, "cs101");

    List<OfflineMessage> forBob = store.undelivered("bob");
    assertThat(forBob).extracting(OfflineMessage::sender).containsExactly("alice", "carol");
    assertThat(forBob.get(1).group()).isTrue();
    assertThat(forBob.get(1).groupName()).isEqualTo("cs101");
    assertThat(forBob.get(0).content()).containsExactly((byte) 1);
  }

  @Test
  void markDeliveredIsIdempotentAndScopedToTheReceiver() {
    OfflineMessage first = store.enqueueOffline("bob", "alice", MessageType.PRIVATE, new byte[]{1}, null);
    OfflineMessage second = store.enqueueOffline("bob", "alice", MessageType.PRIVATE, new byte[]{2}, null);
    OfflineMessage carols = store.enqueueOffline("carol", "alice", MessageType.PRIVATE, new byte[]{3}, null);

    assertThat(store.markDelivered("bob", List.of(first.id(), carols.id()))).isEqualTo(1);
    assertThat(store.markDelivered("bob", List.of(first.id()))).isZero();
    assertThat(store.undelivered("bob")).extracting(OfflineMessage::id).containsExactly(second.id());
    assertThat(store.undelivered("carol")).hasSize(1);

    assertThat(store.markDelivered("bob")).isEqualTo(1);
    assertThat(store.markDelivered("bob")).isZero();
    assertThat(store.undelivered("bob")).isEmpty();
  }

  @Test
  void offlineQueueKeepsSequenceOrderPastNineMessages() {
    for (int i = 1; i <= 12; i++) {
      store.enqueueOffline("bob", "alice", MessageType.PRIVATE, new byte[]{(byte) i}, null);
    }
    assertThat(store.undelivered("bob")).extracting(OfflineMessage::id)
        .containsExactly(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L, 10L, 11L, 12L);

    assertThat(store.markDelivered("bob", List.of(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L, 10L))).isEqualTo(10);
    assertThat(store.undelivered("bob")).extracting(OfflineMessage::id).containsExactly(11L, 12L);
  }

  @Test
  void lookupsStayInsideTheirOwnConversationGroupAndReceiver() {
    store.appendHistory("al", "ice", MessageType.PRIVATE, "al to ice", false);
    store.appendHistory("al", "icebox", MessageType.PRIVATE, "al to icebox", false);
    store.appendHistory("ali", "ce", MessageType.PRIVATE, "ali to ce", false);
    store.appendHistory("al", "cs1", MessageType.GROUP, "cs1", true);
    store.appendHistory("al", "cs10", MessageType.GROUP, "cs10", true);
    store.enqueueOffline("bo", "al", MessageType.PRIVATE, new byte[]{1}, null);
    store.enqueueOffline("bob", "al", MessageType.PRIVATE, new byte[]{2}, null);

    assertThat(store.conversationHistory("ice", "al", 20)).extracting(HistoryMessage::text)
        .containsExactly("al to ice");
    assertThat(store.groupHistory("cs1", 20)).extracting(HistoryMessage::text).containsExactly("cs1");
    assertThat(store.undelivered("bo")).extracting(OfflineMessage::sender).containsExactly("al");
    assertThat(store.undelivered("bo").get(0).content()).containsExactly((byte) 1);
  }

  @Test
  void groupNamesAreUniqueAndTheCreatorIsAMember() {
    assertThat(store.createGroup("cs101", "alice")).isPresent();
    assertThat(store.createGroup("cs101", "bob")).isEmpty();
    assertThat(store.findGroup("cs101")).hasValueSatisfying(g -> assertThat(g.creator()).isEqualTo("alice"));
    assertThat(store.groupMembers("cs101")).containsExactly("alice");
  }

  @Test
  void membershipOnlyGrowsAndRejoiningChangesNothing() {
    store.createGroup("cs101", "alice");
    store.createGroup("cs1010", "zed");
    assertThat(store.addGroupMember("cs101", "bob")).isTrue();
    assertThat(store.addGroupMember("cs101", "bob")).isFalse();
    assertThat(store.isGroupMember("cs101", "bob")).isTrue();
    assertThat(store.isGroupMember("cs1010", "bob")).isFalse();
    // members of a group whose name is a prefix of another do not leak across
    assertThat(store.groupMembers("cs101")).containsExactly("alice", "bob");
    assertThat(store.groupMembers("cs1010")).containsExactly("zed");
  }

  @Test
  void everythingSurvivesAReopen(@TempDir Path dir) {
    final String file = dir.resolve("classchat.mv.db").toString();
    try (ChatStore onDisk = ChatStore.open(file)) {
      onDisk.registerUser("alice");
      onDisk.appendHistory("alice", "bob", MessageType.PRIVATE, "persisted", false);
      onDisk.enqueueOffline("bob", "alice", MessageType.PRIVATE, new byte[]{9}, null);
      onDisk.createGroup("cs101", "alice");
    }
    try (ChatStore reopened = ChatStore.open(file)) {
      assertThat(reopened.userExists("alice")).isTrue();
      assertThat(reopened.conversationHistory("bob", "alice", 20)).extracting(HistoryMessage::text)
          .containsExactly("persisted");
      assertThat(reopened.undelivered("bob")).hasSize(1);
      assertThat(reopened.groupMembers("cs101")).containsExactly("alice");
      // sequences carry on from the persisted maximum
      HistoryMessage next = reopened.appendHistory("bob", "alice", MessageType.PRIVATE, "after", false);
      assertThat(next.id()).isEqualTo(2L);
    }
  }
}
