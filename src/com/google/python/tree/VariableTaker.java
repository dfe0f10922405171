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

package com.google.python.tree;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * A scope that can take variables from its enclosing scopes.
 *
 * <p>Everything resolved through the closure path is recorded as <em>taken</em>. Taken variables
 * that are not module variables are wrapped in a {@link ClosureVariableReference} and are also
 * recorded as the <em>closure</em> of this scope, which code generation uses to allocate cells.
 */
public interface VariableTaker {

  /** Returns the scope this one is defined in. Fixed at construction. */
  VariableProvider getProvider();

  /**
   * Resolves {@code name} through the enclosing scopes. Class scopes are skipped, except for list
   * comprehensions, which see the class body they are in.
   */
  Variable getClosureVariable(String name);

  /** Resolves {@code name} directly in the module, as a {@code global} declaration does. */
  ModuleVariable getModuleClosureVariable(String name);

  /** Returns the non-module variables taken, sorted by name. */
  ImmutableList<Variable> getClosureVariables();

  /** Returns every variable taken, module variables included, in the order they were taken. */
  ImmutableList<Variable> getTakenVariables();

  boolean hasTakenVariable(String name);

  @Nullable Variable getTakenVariable(String name);
}
