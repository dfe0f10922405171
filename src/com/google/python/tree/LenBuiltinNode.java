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

/** {@code len(value)}. */
public final class LenBuiltinNode extends Node {
  private static final ChildSlot VALUE = ChildSlot.one("value");

  public LenBuiltinNode(Node value, SourcePosition position) {
    super(Kind.EXPRESSION_BUILTIN_LEN, position, VALUE);
    initChild(VALUE, value);
  }

  public @Nullable Node getValue() {
    return getChildNode(VALUE);
  }
}
