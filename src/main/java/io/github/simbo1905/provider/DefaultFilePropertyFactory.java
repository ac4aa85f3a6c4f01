// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

public final class DefaultFilePropertyFactory implements FilePropertyFactory {

  @Override
  public DirectoryProperty newDirectoryProperty() {
    return new DirectoryProperty();
  }

  @Override
  public RegularFileProperty newFileProperty() {
    return new RegularFileProperty();
  }
}
