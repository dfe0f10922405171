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

/** {@code a or b or ...}, with at least two operands. */
public final class OrNode extends Node {
  private static final ChildSlot EXPRESSIONS = ChildSlot.many("expressions");

  public OrNode(List<? extends Node> expressions, SourcePosition position) {
    super(Kind.EXPRESSION_CONDITION_OR, position, EXPRESSIONS);
    checkArgument(expressions.size() >= 2, "Need two operands, got %s", expressions.size());
    initChildren(EXPRESSIONS, expressions);
  }

  public ImmutableList<Node> getExpressions() {
    return getChildListOrEmpty(EXPRESSIONS);
  }
}
