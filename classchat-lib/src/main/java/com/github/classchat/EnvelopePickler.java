// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat;

import com.github.classchat.msg.HandshakeStep;
import com.github.classchat.msg.Payload;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/// Writes envelopes the boilerplate way with a [DataOutputStream]. The layout is:
///
/// - `[byte]` format version
/// - `[byte]` message type code
/// - sender, then optional receiver and optional text, each string as an int length and UTF-8 bytes with a presence
///   byte in front of the optional ones
/// - `[byte]` payload tag, zero when there is no payload, then the payload fields
///
/// Reading is strict: unknown codes, lengths that run past the end of the input and trailing bytes all raise
/// [MalformedEnvelopeException].
public final class EnvelopePickler {
  private static final Logger LOGGER = Logger.getLogger(EnvelopePickler.class.getName());

  static final byte FORMAT_VERSION = 1;

  static final byte NO_PAYLOAD = 0;
  static final byte FILE_DATA = 1;
  static final byte GROUP_REF = 2;
  static final byte HISTORY_QUERY = 3;
  static final byte HISTORY_RESULT = 4;
  static final byte USER_LIST = 5;
  static final byte GROUP_LIST = 6;
  static final byte KEY_EXCHANGE = 7;

  private EnvelopePickler() {
  }

  public static final Pickler<Envelope> instance = new Pickler<>() {
    @Override
    public byte[] serialize(Envelope envelope) {
      return pickle(envelope);
    }

    @Override
    public Envelope deserialize(byte[] bytes) {
      return unpickle(bytes);
    }
  };

  public static byte[] pickle(Envelope envelope) {
    try (ByteArrayOutputStream bos = new ByteArrayOutputStream();
         DataOutputStream dos = new DataOutputStream(bos)) {
      dos.writeByte(FORMAT_VERSION);
      dos.writeByte(envelope.type().code());
      writeString(envelope.sender(), dos);
      writeOptionalString(envelope.receiver(), dos);
      writeOptionalString(envelope.text(), dos);
      writePayload(envelope.payload(), dos);
      dos.flush();
      return bos.toByteArray();
    } catch (IOException e) {
      // a ByteArrayOutputStream does not throw
      throw new UncheckedIOException(e);
    }
  }

  /// @throws MalformedEnvelopeException if the bytes are not exactly one well-formed envelope
  public static Envelope unpickle(byte[] bytes) {
    try (DataInputStream dis = new DataInputStream(new ByteArrayInputStream(bytes))) {
      final byte version = dis.readByte();
      if (version != FORMAT_VERSION) {
        throw new MalformedEnvelopeException("Unsupported format version " + version);
      }
      final byte code = dis.readByte();
      final MessageType type = MessageType.fromCode(code)
          .orElseThrow(() -> new MalformedEnvelopeException("Unknown message type " + code));
      final String sender = readString(dis);
      final String receiver = readOptionalString(dis);
      final String text = readOptionalString(dis);
      final Payload payload = readPayload(dis);
      if (dis.available() > 0) {
        throw new MalformedEnvelopeException(dis.available() + " trailing bytes after envelope");
      }
      return new Envelope(type, sender, receiver, text, payload);
    } catch (MalformedEnvelopeException e) {
      throw e;
    } catch (EOFException e) {
      throw new MalformedEnvelopeException("Truncated envelope", e);
    } catch (IOException | RuntimeException e) {
      // field values the record types reject, such as an Instant that overflows
      throw new MalformedEnvelopeException("Unreadable envelope", e);
    }
  }

  /// Lenient form for receive loops: garbage yields empty rather than an exception.
  public static Optional<Envelope> tryUnpickle(byte[] bytes) {
    try {
      return Optional.of(unpickle(bytes));
    } catch (MalformedEnvelopeException e) {
      LOGGER.fine(() -> "Ignoring malformed envelope of " + bytes.length + " bytes: " + e.getMessage());
      return Optional.empty();
    }
  }

  static void writePayload(Payload payload, DataOutputStream dos) throws IOException {
    if (payload == null) {
      dos.writeByte(NO_PAYLOAD);
    } else if (payload instanceof Payload.FileData file) {
      dos.writeByte(FILE_DATA);
      writeString(file.filename(), dos);
      dos.writeBoolean(file.toGroup());
      dos.writeInt(file.content().length);
      dos.write(file.content());
    } else if (payload instanceof Payload.GroupRef group) {
      dos.writeByte(GROUP_REF);
      writeString(group.name(), dos);
    } else if (payload instanceof Payload.HistoryQuery query) {
      dos.writeByte(HISTORY_QUERY);
      writeString(query.peer(), dos);
      dos.writeBoolean(query.group());
    } else if (payload instanceof Payload.HistoryResult result) {
      dos.writeByte(HISTORY_RESULT);
      writeString(result.peer(), dos);
      dos.writeBoolean(result.group());
      dos.writeInt(result.messages().size());
      for (Payload.HistoryEntry entry : result.messages()) {
        writeString(entry.sender(), dos);
        writeString(entry.receiver(), dos);
        dos.writeByte(entry.type().code());
        writeOptionalString(entry.text(), dos);
        dos.writeLong(entry.timestamp().getEpochSecond());
        dos.writeInt(entry.timestamp().getNano());
      }
    } else if (payload instanceof Payload.UserList list) {
      dos.writeByte(USER_LIST);
      dos.writeInt(list.users().size());
      for (Payload.UserStatus user : list.users()) {
        writeString(user.username(), dos);
        dos.writeBoolean(user.online());
      }
    } else if (payload instanceof Payload.GroupList list) {
      dos.writeByte(GROUP_LIST);
      dos.writeInt(list.groups().size());
      for (Payload.GroupSummary group : list.groups()) {
        writeString(group.name(), dos);
        writeString(group.creator(), dos);
      }
    } else if (payload instanceof Payload.KeyExchange exchange) {
      dos.writeByte(KEY_EXCHANGE);
      writeString(exchange.step().tag(), dos);
      writeOptionalString(exchange.keyMaterial(), dos);
    } else {
      throw new IllegalArgumentException("Unknown payload " + payload.getClass().getName());
    }
  }

  static Payload readPayload(DataInputStream dis) throws IOException {
    final byte tag = dis.readByte();
    switch (tag) {
      case NO_PAYLOAD:
        return null;
      case FILE_DATA: {
        final String filename = readString(dis);
        final boolean toGroup = dis.readBoolean();
        return new Payload.FileData(filename, readBytes(dis), toGroup);
      }
      case GROUP_REF:
        return new Payload.GroupRef(readString(dis));
      case HISTORY_QUERY:
        return new Payload.HistoryQuery(readString(dis), dis.readBoolean());
      case HISTORY_RESULT: {
        final String peer = readString(dis);
        final boolean group = dis.readBoolean();
        final int count = readCount(dis);
        final List<Payload.HistoryEntry> entries = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
          final String sender = readString(dis);
          final String receiver = readString(dis);
          final byte code = dis.readByte();
          final MessageType type = MessageType.fromCode(code)
              .orElseThrow(() -> new MalformedEnvelopeException("Unknown history message type " + code));
          final String text = readOptionalString(dis);
          final Instant timestamp = Instant.ofEpochSecond(dis.readLong(), dis.readInt());
          entries.add(new Payload.HistoryEntry(sender, receiver, type, text, timestamp));
        }
        return new Payload.HistoryResult(peer, group, entries);
      }
      case USER_LIST: {
        final int count = readCount(dis);
        final List<Payload.UserStatus> users = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
          users.add(new Payload.UserStatus(readString(dis), dis.readBoolean()));
        }
        return new Payload.UserList(users);
      }
      case GROUP_LIST: {
        final int count = readCount(dis);
        final List<Payload.GroupSummary> groups = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
          groups.add(new Payload.GroupSummary(readString(dis), readString(dis)));
        }
        return new Payload.GroupList(groups);
      }
      case KEY_EXCHANGE: {
        final String tagText = readString(dis);
        final HandshakeStep step = HandshakeStep.fromTag(tagText)
            .orElseThrow(() -> new MalformedEnvelopeException("Unknown handshake step " + tagText));
        return new Payload.KeyExchange(step, readOptionalString(dis));
      }
      default:
        throw new MalformedEnvelopeException("Unknown payload tag " + tag);
    }
  }

  static void writeString(String value, DataOutputStream dos) throws IOException {
    final byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    dos.writeInt(bytes.length);
    dos.write(bytes);
  }

  static void writeOptionalString(String value, DataOutputStream dos) throws IOException {
    if (value == null) {
      dos.writeBoolean(false);
    } else {
      dos.writeBoolean(true);
      writeString(value, dos);
    }
  }

  static String readString(DataInputStream dis) throws IOException {
    return new String(readBytes(dis), StandardCharsets.UTF_8);
  }

  static String readOptionalString(DataInputStream dis) throws IOException {
    return dis.readBoolean() ? readString(dis) : null;
  }

  static byte[] readBytes(DataInputStream dis) throws IOException {
    final int length = dis.readInt();
    // the input is a byte array so available() is exactly what is left
    if (length < 0 || length > dis.available()) {
      throw new MalformedEnvelopeException("Invalid length " + length + " with " + dis.available() + " bytes left");
    }
    final byte[] bytes = new byte[length];
    dis.readFully(bytes);
    return bytes;
  }

  static int readCount(DataInputStream dis) throws IOException {
    final int count = dis.readInt();
    if (count < 0 || count > dis.available()) {
      throw new MalformedEnvelopeException("Invalid element count " + count);
    }
    return count;
  }
}
