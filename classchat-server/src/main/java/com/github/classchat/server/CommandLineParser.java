// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.classchat.server;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/// Just enough option parsing for `main`: `--name=value`, `--name value`, `-n value` and bare flags.
class CommandLineParser {
  private final Map<String, String> options = new HashMap<>();

  void parse(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("-")) {
        throw new IllegalArgumentException("Unexpected argument: " + arg);
      }
      String option = arg.startsWith("--") ? arg.substring(2) : arg.substring(1);
      if (option.contains("=")) {
        String[] parts = option.split("=", 2);
        options.put(parts[0], parts[1]);
      } else if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
        options.put(option, args[++i]);
      } else {
        options.put(option, "true");
      }
    }
  }

  Optional<String> getOption(String name) {
    return Optional.ofNullable(options.get(name));
  }

  Optional<Integer> getIntOption(String name) {
    return getOption(name).map(value -> {
      try {
        return Integer.parseInt(value);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("--" + name + " expects a number but got " + value, e);
      }
    });
  }

  boolean hasOption(String name) {
    return options.containsKey(name);
  }
}
