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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** A tuple or list display, {@code (a, b)} or {@code [a, b]}. */
public final class SequenceCreationNode extends Node {
  private static final ChildSlot ELEMENTS = ChildSlot.many("elements");

  /** What kind of sequence is built. */
  public enum SequenceKind {
    TUPLE,
    LIST
  }

  private final SequenceKind sequenceKind;

  public SequenceCreationNode(
      SequenceKind sequenceKind, List<? extends Node> elements, SourcePosition position) {
    super(Kind.EXPRESSION_MAKE_SEQUENCE, position, ELEMENTS);
    for (Node element : elements) {
      checkArgument(element.isExpression(), "Not an element: %s", element);
    }
    this.sequenceKind = checkNotNull(sequenceKind);
    initChildren(ELEMENTS, elements);
  }

  public SequenceKind getSequenceKind() {
    return sequenceKind;
  }

  public ImmutableList<Node> getElements() {
    return getChildListOrEmpty(ELEMENTS);
  }

  @Override
  public String getDetail() {
    return Ascii.toLowerCase(sequenceKind.name());
  }
}
