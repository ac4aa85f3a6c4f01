// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

import org.jetbrains.annotations.NotNull;

import java.io.File;
import java.io.Serializable;
import java.util.Objects;

/// A location on the file system that is a regular file.
public record RegularFile(@NotNull File asFile) implements Serializable {
  public RegularFile {
    Objects.requireNonNull(asFile, "asFile must not be null");
  }
}
