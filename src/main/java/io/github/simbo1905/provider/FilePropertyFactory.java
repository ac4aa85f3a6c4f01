// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

/// Creates the path-like property wrappers.
public interface FilePropertyFactory {

  DirectoryProperty newDirectoryProperty();

  RegularFileProperty newFileProperty();
}
