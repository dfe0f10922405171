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

import java.io.Serializable;

/** Options for resolving and checking module trees. */
public class AnalysisOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Verify parent links and resolution of each tree after resolving it. */
  private boolean checkTreeIntegrity = false;

  /** Number of modules resolved at the same time. */
  private int numParallelModules = 1;

  /** Log every resolved tree. */
  private boolean printTree = false;

  public AnalysisOptions() {}

  public boolean shouldCheckTreeIntegrity() {
    return checkTreeIntegrity;
  }

  public void setCheckTreeIntegrity(boolean checkTreeIntegrity) {
    this.checkTreeIntegrity = checkTreeIntegrity;
  }

  public int getNumParallelModules() {
    return numParallelModules;
  }

  public void setNumParallelModules(int numParallelModules) {
    this.numParallelModules = numParallelModules;
  }

  public boolean shouldPrintTree() {
    return printTree;
  }

  public void setPrintTree(boolean printTree) {
    this.printTree = printTree;
  }

  /**
   * Checks for option values that cannot work.
   *
   * @throws InvalidOptionsException if an option is out of range
   */
  public void validate() {
    if (numParallelModules < 1) {
      throw new InvalidOptionsException(
          "Need at least one module at a time, got %s.", numParallelModules);
    }
  }

  /** Exception to indicate unusable values in the AnalysisOptions. */
  public static class InvalidOptionsException extends RuntimeException {
    private InvalidOptionsException(String message, Object... args) {
      super(String.format(message, args));
    }
  }
}
