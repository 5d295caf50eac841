// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat;

/// Interface for serializing and deserializing objects to byte arrays
public interface Pickler<T> {
  /// Serializes the given object
  ///
  /// @param object The object to serialize
  /// @return The pickled bytes
  byte[] serialize(T object);

  /// Deserializes an object from the provided bytes
  ///
  /// @param bytes The bytes to read
  /// @return The deserialized object
  T deserialize(byte[] bytes);
}
