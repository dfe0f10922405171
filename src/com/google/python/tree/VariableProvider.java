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

/**
 * A scope that owns variables: modules, classes, functions, lambdas and comprehensions.
 *
 * <p>Each provider keeps an insertion-ordered table of the variables it provides. The table is
 * filled lazily: {@link #getProvidedVariable} creates a variable of the scope's own kind the first
 * time a name is asked for, and returns that same object on every later request.
 */
public interface VariableProvider {

  boolean hasProvidedVariable(String name);

  /** Returns the variable for {@code name} in this scope's table, creating it on a miss. */
  Variable getProvidedVariable(String name);

  /** Puts {@code variable} into the table under its name, replacing any earlier entry. */
  void registerProvidedVariable(Variable variable);

  void registerProvidedVariables(Iterable<? extends Variable> variables);

  /** Returns the table content in insertion order. */
  ImmutableList<Variable> getProvidedVariables();

  /**
   * Returns the variable a binding of {@code name} in this scope stores to.
   *
   * @throws BindingConflictException if the name was already captured from an enclosing non-module
   *     scope and can therefore not become local any more
   */
  Variable getVariableForAssignment(String name);

  /** Returns the variable a use of {@code name} in this scope reads from. */
  Variable getVariableForReference(String name);

  /**
   * Whether references in this scope may be resolved as soon as they are seen. Late scopes wait
   * until every assignment in their body has been seen: an assignment anywhere in the body makes
   * the name local.
   */
  boolean isEarlyClosure();

  /** Whether the scope needs a real dictionary of its locals, e.g. for {@code locals()}. */
  boolean hasLocalsDict();

  /**
   * Whether {@code child}, a direct child of this provider, is evaluated in the scope enclosing
   * this provider instead of in this provider's own scope.
   */
  default boolean evaluatesInEnclosingScope(Node child) {
    return false;
  }

  ModuleNode getParentModule();
}
