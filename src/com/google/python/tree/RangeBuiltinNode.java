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

/** {@code range(low, high, step)}. Only {@code low} is required. */
public final class RangeBuiltinNode extends Node {
  private static final ChildSlot LOW = ChildSlot.one("low");
  private static final ChildSlot HIGH = ChildSlot.one("high");
  private static final ChildSlot STEP = ChildSlot.one("step");

  public RangeBuiltinNode(
      Node low, @Nullable Node high, @Nullable Node step, SourcePosition position) {
    super(Kind.EXPRESSION_BUILTIN_RANGE, position, LOW, HIGH, STEP);
    initChild(LOW, low);
    initChild(HIGH, high);
    initChild(STEP, step);
  }

  public @Nullable Node getLow() {
    return getChildNode(LOW);
  }

  public @Nullable Node getHigh() {
    return getChildNode(HIGH);
  }

  public @Nullable Node getStep() {
    return getChildNode(STEP);
  }
}
