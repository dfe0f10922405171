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
 * A possibly chained comparison, {@code a < b <= c}. Comparator {@code i} sits between operands
 * {@code i} and {@code i + 1}.
 */
public final class ComparisonNode extends Node {
  private static final ChildSlot OPERANDS = ChildSlot.many("operands");

  private final ImmutableList<String> comparators;

  public ComparisonNode(
      List<? extends Node> operands, List<String> comparators, SourcePosition position) {
    super(Kind.EXPRESSION_COMPARISON, position, OPERANDS);
    checkArgument(
        !comparators.isEmpty() && operands.size() == comparators.size() + 1,
        "%s operands for %s comparators",
        operands.size(),
        comparators.size());
    for (Node operand : operands) {
      checkArgument(operand.isExpression(), "Not an operand: %s", operand);
    }
    this.comparators = ImmutableList.copyOf(comparators);
    initChildren(OPERANDS, operands);
  }

  public ImmutableList<Node> getOperands() {
    return getChildListOrEmpty(OPERANDS);
  }

  public ImmutableList<String> getComparators() {
    return comparators;
  }

  @Override
  public String getDetail() {
    return String.join(" ", comparators);
  }
}
