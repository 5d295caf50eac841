// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.network;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;

/// Length prefixed frames: a big-endian int length then that many bytes. TCP is a byte stream so every envelope is
/// framed rather than relying on one write arriving as one read.
public final class Frames {
  public static final int HEADER_BYTES = Integer.BYTES;

  private Frames() {
  }

  public static void write(DataOutputStream out, byte[] frame) throws IOException {
    out.writeInt(frame.length);
    out.write(frame);
    out.flush();
  }

  /// Blocks until a whole frame has arrived.
  ///
  /// @return the frame body
  /// @throws EOFException if the peer closed the stream, cleanly or mid-frame
  /// @throws FrameTooLargeException if the length prefix is negative or above the limit
  public static byte[] read(DataInputStream in, int maxFrameBytes) throws IOException {
    final int length = in.readInt();
    checkLength(length, maxFrameBytes);
    final byte[] frame = new byte[length];
    in.readFully(frame);
    return frame;
  }

  /// A heap buffer holding the header and the body, flipped and ready for a channel write.
  public static ByteBuffer encode(byte[] frame) {
    final ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES + frame.length);
    buffer.putInt(frame.length).put(frame).flip();
    return buffer;
  }

  static void checkLength(int length, int maxFrameBytes) throws FrameTooLargeException {
    if (length < 0 || length > maxFrameBytes) {
      throw new FrameTooLargeException("Invalid frame length: " + length + " limit: " + maxFrameBytes);
    }
  }
}
