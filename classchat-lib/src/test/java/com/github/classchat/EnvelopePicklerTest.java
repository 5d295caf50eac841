// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat;

import com.github.classchat.msg.HandshakeStep;
import com.github.classchat.msg.Payload;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopePicklerTest {

  @Test
  void groupMessageKeepsSenderReceiverAndText() {
    Envelope hello = Envelope.groupMessage("alice", "cs101", "hello");
    Envelope back = EnvelopePickler.instance.deserialize(EnvelopePickler.instance.serialize(hello));
    assertEquals(MessageType.GROUP, back.type());
    assertEquals("alice", back.sender());
    assertEquals("cs101", back.receiver());
    assertEquals("hello", back.text());
    assertNull(back.payload());
  }

  @Test
  void fileContentSurvivesByteForByte() {
    byte[] content = new byte[4096];
    for (int i = 0; i < content.length; i++) {
      content[i] = (byte) i;
    }
    Envelope file = Envelope.file("alice", "bob", "notes.bin", content, false);
    Envelope back = EnvelopePickler.unpickle(EnvelopePickler.pickle(file));
    Payload.FileData data = back.payload(Payload.FileData.class).orElseThrow();
    assertEquals("notes.bin", data.filename());
    assertArrayEquals(content, data.content());
    assertFalse(data.toGroup());
    assertEquals(file, back);
  }

  @Test
  void handshakeCompleteHasNoKeyMaterial() {
    Envelope complete = Envelope.handshakeComplete("alice");
    Payload.KeyExchange exchange = EnvelopePickler.unpickle(EnvelopePickler.pickle(complete))
        .payload(Payload.KeyExchange.class).orElseThrow();
    assertEquals(HandshakeStep.COMPLETE, exchange.step());
    assertNull(exchange.keyMaterial());
  }

  @Test
  void payloadOfWrongKindIsEmpty() {
    Envelope join = Envelope.joinGroup("bob", "cs101");
    assertTrue(join.payload(Payload.GroupRef.class).isPresent());
    assertTrue(join.payload(Payload.HistoryQuery.class).isEmpty());
  }

  /// A history response whose one timestamp, the last twelve bytes of the pickle, cannot be an Instant.
  static byte[] historyWithOverflowingTimestamp() {
    Payload.HistoryEntry entry = new Payload.HistoryEntry("alice", "bob", MessageType.PRIVATE, "hi",
        Instant.ofEpochSecond(0));
    byte[] bytes = EnvelopePickler.pickle(
        Envelope.historyResponse("bob", new Payload.HistoryResult("alice", false, List.of(entry))));
    ByteBuffer.wrap(bytes, bytes.length - Long.BYTES - Integer.BYTES, Long.BYTES + Integer.BYTES)
        .putLong(Long.MAX_VALUE)
        .putInt(Integer.MAX_VALUE);
    return bytes;
  }

  @Test
  void timestampThatOverflowsIsMalformed() {
    byte[] bytes = historyWithOverflowingTimestamp();
    MalformedEnvelopeException e = assertThrows(MalformedEnvelopeException.class,
        () -> EnvelopePickler.unpickle(bytes));
    assertInstanceOf(ArithmeticException.class, e.getCause());
    assertTrue(EnvelopePickler.tryUnpickle(bytes).isEmpty());
  }

  @Test
  void emptyInputIsMalformed() {
    assertThrows(MalformedEnvelopeException.class, () -> EnvelopePickler.unpickle(new byte[0]));
    assertTrue(EnvelopePickler.tryUnpickle(new byte[0]).isEmpty());
  }

  @Test
  void unknownVersionIsMalformed() {
    byte[] pickled = EnvelopePickler.pickle(Envelope.listUsers("carol"));
    pickled[0] = 99;
    assertThrows(MalformedEnvelopeException.class, () -> EnvelopePickler.unpickle(pickled));
  }

  @Test
  void unknownTypeCodeIsMalformed() {
    byte[] pickled = EnvelopePickler.pickle(Envelope.listUsers("carol"));
    pickled[1] = 0x7f;
    assertThrows(MalformedEnvelopeException.class, () -> EnvelopePickler.unpickle(pickled));
  }

  @Test
  void trailingBytesAreMalformed() {
    byte[] pickled = EnvelopePickler.pickle(Envelope.listGroups("carol"));
    byte[] longer = Arrays.copyOf(pickled, pickled.length + 1);
    assertThrows(MalformedEnvelopeException.class, () -> EnvelopePickler.unpickle(longer));
  }

  @Test
  void hugeLengthPrefixIsRejectedWithoutAllocating() {
    byte[] pickled = EnvelopePickler.pickle(Envelope.connect("dave"));
    // the sender length sits straight after the version and type bytes
    pickled[2] = 0x7f;
    assertThrows(MalformedEnvelopeException.class, () -> EnvelopePickler.unpickle(pickled));
  }

  @Test
  void listsKeepTheirOrder() {
    var users = new Payload.UserList(List.of(
        new Payload.UserStatus("alice", true),
        new Payload.UserStatus("bob", false),
        new Payload.UserStatus("carol", true)));
    Envelope back = EnvelopePickler.unpickle(EnvelopePickler.pickle(Envelope.userList("alice", users)));
    assertEquals(users, back.payload());
    assertEquals(ChatProtocol.SERVER_NAME, back.sender());
  }
}
