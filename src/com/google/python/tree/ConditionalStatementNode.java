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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * An {@code if}/{@code elif}/{@code else} chain. Branch {@code i} runs for condition {@code i}; an
 * extra trailing branch is the {@code else}.
 */
public final class ConditionalStatementNode extends Node {
  private static final ChildSlot CONDITIONS = ChildSlot.many("conditions");
  private static final ChildSlot BRANCHES = ChildSlot.many("branches");

  public ConditionalStatementNode(
      List<? extends Node> conditions, List<? extends Node> branches, SourcePosition position) {
    super(Kind.STATEMENT_CONDITIONAL, position, CONDITIONS, BRANCHES);
    checkArgument(
        branches.size() == conditions.size() || branches.size() == conditions.size() + 1,
        "%s branches for %s conditions",
        branches.size(),
        conditions.size());
    initChildren(CONDITIONS, conditions);
    initChildren(BRANCHES, branches);
  }

  public ImmutableList<Node> getConditions() {
    return getChildListOrEmpty(CONDITIONS);
  }

  public ImmutableList<Node> getBranches() {
    return getChildListOrEmpty(BRANCHES);
  }
}
