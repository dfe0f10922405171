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
import java.util.List;
import org.jspecify.annotations.Nullable;

/** {@code a = b = source}: one source, assigned to each target in turn. */
public final class AssignmentNode extends Node {
  private static final ChildSlot SOURCE = ChildSlot.one("source");
  private static final ChildSlot TARGETS = ChildSlot.many("targets");

  public AssignmentNode(List<? extends Node> targets, Node source, SourcePosition position) {
    super(Kind.STATEMENT_ASSIGNMENT, position, SOURCE, TARGETS);
    initChild(SOURCE, source);
    initChildren(TARGETS, targets);
  }

  public @Nullable Node getSource() {
    return getChildNode(SOURCE);
  }

  public ImmutableList<Node> getTargets() {
    return getChildListOrEmpty(TARGETS);
  }

  @Override
  public String getDetail() {
    ImmutableList<Node> targets = getTargets();
    StringBuilder result = new StringBuilder();
    for (int i = 0; i < targets.size(); i++) {
      result.append(i == 0 ? "" : ", ").append(targets.get(i).getDetail());
    }
    return result.append(" from ").append(getSource()).toString();
  }
}
