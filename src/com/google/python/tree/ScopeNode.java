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

/** Base class of the nodes that open a scope: they provide variables and get a code name. */
public abstract class ScopeNode extends Node implements VariableProvider, NamedCode {

  private final VariableTable variables = new VariableTable();
  private final CodeNameSupplier codeNames;

  ScopeNode(Kind kind, SourcePosition position, String codePrefix, ChildSlot... slots) {
    super(kind, position, slots);
    this.codeNames = new CodeNameSupplier(codePrefix);
  }

  /** Creates the variable this kind of scope materializes for a name it does not have yet. */
  abstract Variable createProvidedVariable(String name);

  @Override
  public final boolean hasProvidedVariable(String name) {
    return variables.contains(name);
  }

  @Override
  public final Variable getProvidedVariable(String name) {
    Variable result = variables.get(name);
    if (result == null) {
      result = createProvidedVariable(name);
      variables.put(result);
    }
    return result;
  }

  @Override
  public final void registerProvidedVariable(Variable variable) {
    variables.put(variable);
  }

  @Override
  public final void registerProvidedVariables(Iterable<? extends Variable> toRegister) {
    for (Variable variable : toRegister) {
      registerProvidedVariable(variable);
    }
  }

  @Override
  public final ImmutableList<Variable> getProvidedVariables() {
    return variables.getAll();
  }

  /** Returns the local variables of this scope, parameters included. */
  public final ImmutableList<Variable> getLocalVariables() {
    return variables.getLocals();
  }

  /** Returns the local variables of this scope that are not parameters. */
  public final ImmutableList<Variable> getUserLocalVariables() {
    return variables.getUserLocals();
  }

  public final ImmutableList<String> getLocalVariableNames() {
    return NodeUtil.getNames(getLocalVariables());
  }

  @Override
  public boolean hasLocalsDict() {
    return false;
  }

  @Override
  public final String getCodePrefix() {
    return codeNames.getCodePrefix();
  }

  @Override
  public final String getCodeName() {
    return codeNames.getCodeName(this);
  }

  @Override
  public final int getChildUid(Node child) {
    return codeNames.nextChildUid(child.getKind());
  }
}
