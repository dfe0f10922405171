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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Records what one {@link VariableTaker} took from its enclosing scopes. */
final class ClosureTracker {
  private static final Comparator<Variable> BY_NAME = Comparator.comparing(Variable::getName);

  private final Node taker;
  private final VariableProvider provider;
  private final boolean seesClassScope;

  private final Map<String, Variable> taken = new LinkedHashMap<>();
  private final Map<String, Variable> closure = new LinkedHashMap<>();
  // One reference object per outer variable, so repeated lookups stay identical.
  private final Map<Variable, ClosureVariableReference> references = new HashMap<>();

  ClosureTracker(Node taker, VariableProvider provider, boolean seesClassScope) {
    this.taker = checkNotNull(taker);
    this.provider = checkNotNull(provider);
    this.seesClassScope = seesClassScope;
  }

  VariableProvider getProvider() {
    return provider;
  }

  Variable getClosureVariable(String name) {
    VariableProvider lookup = provider;
    if (!seesClassScope) {
      while (lookup instanceof ClassNode) {
        lookup = ((ClassNode) lookup).getProvider();
      }
    }
    Variable result = lookup.getVariableForReference(name);
    checkState(result != null, "Failed to resolve '%s' for %s in %s", name, taker, lookup);
    return addTaken(result);
  }

  ModuleVariable getModuleClosureVariable(String name) {
    ModuleVariable result = (ModuleVariable) provider.getParentModule().getProvidedVariable(name);
    addTaken(result);
    return result;
  }

  private Variable addTaken(Variable variable) {
    Variable result = variable;
    if (variable.isModuleVariable()) {
      closure.remove(variable.getName());
    } else {
      result =
          references.computeIfAbsent(variable, v -> new ClosureVariableReference(taker, v));
      closure.put(result.getName(), result);
    }
    taken.put(result.getName(), result);
    return result;
  }

  ImmutableList<Variable> getClosureVariables() {
    return ImmutableList.sortedCopyOf(BY_NAME, closure.values());
  }

  ImmutableList<Variable> getTakenVariables() {
    return ImmutableList.copyOf(taken.values());
  }

  boolean hasTakenVariable(String name) {
    return taken.containsKey(name);
  }

  @Nullable Variable getTakenVariable(String name) {
    return taken.get(name);
  }
}
