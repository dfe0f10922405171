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

import org.jspecify.annotations.Nullable;

/** {@code with expression as target: frame}. */
public final class WithNode extends Node {
  private static final ChildSlot EXPRESSION = ChildSlot.one("expression");
  private static final ChildSlot TARGET = ChildSlot.one("target");
  private static final ChildSlot FRAME = ChildSlot.one("frame");

  public WithNode(Node source, @Nullable Node target, Node body, SourcePosition position) {
    super(Kind.STATEMENT_WITH, position, EXPRESSION, TARGET, FRAME);
    initChild(EXPRESSION, source);
    initChild(TARGET, target);
    initChild(FRAME, body);
  }

  public @Nullable Node getExpression() {
    return getChildNode(EXPRESSION);
  }

  public @Nullable Node getTarget() {
    return getChildNode(TARGET);
  }

  public @Nullable Node getWithBody() {
    return getChildNode(FRAME);
  }
}
