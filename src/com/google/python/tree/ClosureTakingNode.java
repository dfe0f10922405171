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

/** A scope that is nested in another scope and may take variables from it. */
public abstract class ClosureTakingNode extends ScopeNode implements VariableTaker {

  private final ClosureTracker closureTracker;

  ClosureTakingNode(
      Kind kind,
      SourcePosition position,
      String codePrefix,
      VariableProvider provider,
      ChildSlot... slots) {
    super(kind, position, codePrefix, slots);
    this.closureTracker =
        new ClosureTracker(this, provider, kind == Kind.EXPRESSION_LIST_CONTRACTION);
  }

  /**
   * Reference lookup of the late scopes: names of the own table win, everything else is taken from
   * the enclosing scopes and then remembered in the own table.
   */
  final Variable getVariableForReferenceOrTake(String name) {
    if (hasProvidedVariable(name)) {
      return getProvidedVariable(name);
    }
    Variable result = getClosureVariable(name);
    registerProvidedVariable(result);
    return result;
  }

  @Override
  public final VariableProvider getProvider() {
    return closureTracker.getProvider();
  }

  @Override
  public final Variable getClosureVariable(String name) {
    return closureTracker.getClosureVariable(name);
  }

  @Override
  public final ModuleVariable getModuleClosureVariable(String name) {
    ModuleVariable result = closureTracker.getModuleClosureVariable(name);
    registerProvidedVariable(result);
    return result;
  }

  @Override
  public final ImmutableList<Variable> getClosureVariables() {
    return closureTracker.getClosureVariables();
  }

  @Override
  public final ImmutableList<Variable> getTakenVariables() {
    return closureTracker.getTakenVariables();
  }

  @Override
  public final boolean hasTakenVariable(String name) {
    return closureTracker.hasTakenVariable(name);
  }

  @Override
  public final @Nullable Variable getTakenVariable(String name) {
    return closureTracker.getTakenVariable(name);
  }
}
