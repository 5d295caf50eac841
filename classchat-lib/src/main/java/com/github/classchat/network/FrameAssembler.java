// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.network;

import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.Optional;
import java.util.Queue;

/// Reassembles frames from whatever chunks a non-blocking read happens to return. Not thread safe; one per channel
/// and only touched by the thread that reads it.
public final class FrameAssembler {
  private final int maxFrameBytes;
  private final ByteBuffer header = ByteBuffer.allocate(Frames.HEADER_BYTES);
  private final Queue<byte[]> complete = new ArrayDeque<>();
  private ByteBuffer body;

  public FrameAssembler(int maxFrameBytes) {
    this.maxFrameBytes = maxFrameBytes;
  }

  /// Consumes every remaining byte of the chunk.
  ///
  /// @throws FrameTooLargeException on a bad length prefix, after which the assembler is unusable
  public void append(ByteBuffer chunk) throws FrameTooLargeException {
    while (chunk.hasRemaining()) {
      if (body == null) {
        while (header.hasRemaining() && chunk.hasRemaining()) {
          header.put(chunk.get());
        }
        if (header.hasRemaining()) {
          return;
        }
        header.flip();
        final int length = header.getInt();
        header.clear();
        Frames.checkLength(length, maxFrameBytes);
        body = ByteBuffer.allocate(length);
      }
      final int take = Math.min(body.remaining(), chunk.remaining());
      final ByteBuffer slice = chunk.slice();
      slice.limit(take);
      body.put(slice);
      chunk.position(chunk.position() + take);
      if (!body.hasRemaining()) {
        complete.add(body.array());
        body = null;
      }
    }
  }

  public Optional<byte[]> next() {
    return Optional.ofNullable(complete.poll());
  }
}
