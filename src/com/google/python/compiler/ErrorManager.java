/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.python.compiler;

import com.google.common.collect.ImmutableList;

/**
 * An error manager collects the errors and warnings of an analysis and reports them at the end.
 */
public interface ErrorManager extends ErrorHandler {

  /** Writes a report of everything collected so far. */
  void generateReport();

  /** Whether an error was reported whose own default level is {@link CheckLevel#ERROR}. */
  boolean hasHaltingErrors();

  int getErrorCount();

  int getWarningCount();

  ImmutableList<PyError> getErrors();

  ImmutableList<PyError> getWarnings();
}
