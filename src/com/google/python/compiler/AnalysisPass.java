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

import com.google.python.tree.ModuleNode;

/**
 * Interface for classes that process one module tree.
 *
 * <p>Passes may be run on different modules from different threads, but never on the same module
 * from two threads at once.
 */
public interface AnalysisPass {

  /**
   * Process the tree of one module. Can modify the contents of the tree.
   *
   * @param module Root of the tree
   */
  void process(ModuleNode module);
}
