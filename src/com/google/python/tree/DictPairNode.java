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

/** The key and value produced by each iteration of a dict comprehension. */
public final class DictPairNode extends Node implements VariableTaker {
  private static final ChildSlot KEY = ChildSlot.one("key");
  private static final ChildSlot VALUE = ChildSlot.one("value");

  private final ClosureTracker closureTracker;

  public DictPairNode(VariableProvider provider, Node key, Node value, SourcePosition position) {
    super(Kind.EXPRESSION_DICT_PAIR, position, KEY, VALUE);
    this.closureTracker = new ClosureTracker(this, provider, false);
    initChild(KEY, key);
    initChild(VALUE, value);
  }

  public @Nullable Node getKey() {
    return getChildNode(KEY);
  }

  public @Nullable Node getValue() {
    return getChildNode(VALUE);
  }

  @Override
  public VariableProvider getProvider() {
    return closureTracker.getProvider();
  }

  @Override
  public Variable getClosureVariable(String name) {
    return closureTracker.getClosureVariable(name);
  }

  @Override
  public ModuleVariable getModuleClosureVariable(String name) {
    return closureTracker.getModuleClosureVariable(name);
  }

  @Override
  public ImmutableList<Variable> getClosureVariables() {
    return closureTracker.getClosureVariables();
  }

  @Override
  public ImmutableList<Variable> getTakenVariables() {
    return closureTracker.getTakenVariables();
  }

  @Override
  public boolean hasTakenVariable(String name) {
    return closureTracker.hasTakenVariable(name);
  }

  @Override
  public @Nullable Variable getTakenVariable(String name) {
    return closureTracker.getTakenVariable(name);
  }
}
