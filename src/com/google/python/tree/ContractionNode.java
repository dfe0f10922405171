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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Base class of the comprehension forms and generator expressions.
 *
 * <p>The children are the iterated sources, the loop targets (one per source), the conditions and
 * the produced element. The first source is evaluated in the enclosing scope; everything else is
 * evaluated in the comprehension's own scope.
 */
public abstract class ContractionNode extends ClosureTakingNode {
  private static final ChildSlot SOURCES = ChildSlot.many("sources");
  private static final ChildSlot TARGETS = ChildSlot.many("targets");
  private static final ChildSlot CONDITIONS = ChildSlot.many("conditions");
  private static final ChildSlot BODY = ChildSlot.one(ChildSlot.BODY);

  ContractionNode(
      Kind kind, SourcePosition position, String codePrefix, VariableProvider provider) {
    super(kind, position, codePrefix, provider, SOURCES, TARGETS, CONDITIONS, BODY);
  }

  public @Nullable ImmutableList<Node> getIterateds() {
    return getChildList(SOURCES);
  }

  public void setSources(List<? extends Node> sources) {
    initChildren(SOURCES, sources);
  }

  public int getIteratedsCount() {
    return getChildListOrEmpty(SOURCES).size();
  }

  /** Returns the loop targets, one assignment target per source. */
  public @Nullable ImmutableList<Node> getTargets() {
    return getChildList(TARGETS);
  }

  /** Sets the loop targets. They can only be set once. */
  public void setTargets(List<? extends Node> targets) {
    checkState(getChildList(TARGETS) == null, "Targets of %s already set", this);
    initChildren(TARGETS, targets);
  }

  public @Nullable ImmutableList<Node> getConditions() {
    return getChildList(CONDITIONS);
  }

  public void setConditions(List<? extends Node> conditions) {
    initChildren(CONDITIONS, conditions);
  }

  public @Nullable Node getBody() {
    return getChildNode(BODY);
  }

  public void setBody(@Nullable Node body) {
    initChild(BODY, body);
  }

  @Override
  public boolean evaluatesInEnclosingScope(Node child) {
    ImmutableList<Node> sources = getChildListOrEmpty(SOURCES);
    return !sources.isEmpty() && sources.get(0) == child;
  }

  @Override
  public Variable getVariableForAssignment(String variableName) {
    return getProvidedVariable(variableName);
  }

  @Override
  public Variable getVariableForReference(String variableName) {
    return getVariableForReferenceOrTake(variableName);
  }

  @Override
  public boolean isEarlyClosure() {
    return true;
  }

  @Override
  public String getDetail() {
    return getCodePrefix();
  }
}
