// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.provider.cache;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

import static io.github.simbo1905.provider.cache.ProviderCache.LOGGER;

/// Logs each problem at WARNING until `maxProblems` have been seen, then at FINE. All problems are kept.
public final class LoggingProblemsListener implements ProblemsListener {
  private final int maxProblems;
  private final List<PropertyProblem> problems = new ArrayList<>();

  public LoggingProblemsListener(int maxProblems) {
    if (maxProblems < 0) {
      throw new IllegalArgumentException("maxProblems must not be negative, got: " + maxProblems);
    }
    this.maxProblems = maxProblems;
  }

  @Override
  public void onProblem(PropertyProblem problem) {
    problems.add(problem);
    final Level level = problems.size() <= maxProblems ? Level.WARNING : Level.FINE;
    LOGGER.log(level, problem.message(), problem.exception());
    if (problems.size() == maxProblems + 1) {
      LOGGER.warning(() -> "More than " + maxProblems + " problems, further problems are logged at FINE");
    }
  }

  public List<PropertyProblem> problems() {
    return List.copyOf(problems);
  }
}
