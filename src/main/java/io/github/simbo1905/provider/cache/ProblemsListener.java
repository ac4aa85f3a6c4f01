// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

@FunctionalInterface
public interface ProblemsListener {

  void onProblem(PropertyProblem problem);
}
