// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.store;

import java.io.Serializable;
import java.time.Instant;

public record ChatGroup(String name, String creator, Instant createdAt) implements Serializable {
}
