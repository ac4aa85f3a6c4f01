// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider;

/// A service shared by the work of a build. Implementations need a public constructor that takes their
/// parameters, or a public no-arg constructor.
public interface BuildService<P extends BuildServiceParameters> {
}
