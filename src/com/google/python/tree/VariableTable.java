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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** The insertion-ordered name to variable table of one provider. */
final class VariableTable {
  private final Map<String, Variable> variables = new LinkedHashMap<>();

  boolean contains(String name) {
    return variables.containsKey(name);
  }

  @Nullable Variable get(String name) {
    return variables.get(name);
  }

  void put(Variable variable) {
    checkNotNull(variable);
    variables.put(variable.getName(), variable);
  }

  ImmutableList<Variable> getAll() {
    return ImmutableList.copyOf(variables.values());
  }

  /** Returns the local variables, parameters included. */
  ImmutableList<Variable> getLocals() {
    ImmutableList.Builder<Variable> result = ImmutableList.builder();
    for (Variable variable : variables.values()) {
      if (variable.isLocalVariable()) {
        result.add(variable);
      }
    }
    return result.build();
  }

  /** Returns the local variables that are not parameters. */
  ImmutableList<Variable> getUserLocals() {
    ImmutableList.Builder<Variable> result = ImmutableList.builder();
    for (Variable variable : variables.values()) {
      if (variable.isLocalVariable() && !variable.isParameterVariable()) {
        result.add(variable);
      }
    }
    return result.build();
  }
}
