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

/** Unpacking assignment, {@code a, (b, c) = ...}. Elements are assignment targets themselves. */
public final class AssignTargetTupleNode extends Node {
  private static final ChildSlot ELEMENTS = ChildSlot.many("elements");

  public AssignTargetTupleNode(List<? extends Node> elements, SourcePosition position) {
    super(Kind.ASSIGN_TO_TUPLE, position, ELEMENTS);
    for (Node element : elements) {
      checkArgument(element.isAssignTarget(), "Not an assignment target: %s", element);
    }
    initChildren(ELEMENTS, elements);
  }

  public ImmutableList<Node> getElements() {
    return getChildListOrEmpty(ELEMENTS);
  }
}
