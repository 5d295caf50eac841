// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.store;

import java.io.Serializable;
import java.time.Instant;

public record StoredUser(String username, Instant registeredAt, Instant lastSeen) implements Serializable {
  StoredUser seenAt(Instant now) {
    return new StoredUser(username, registeredAt, now);
  }
}
