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

/** {@code eval(source, globals, locals)}. */
public final class EvalBuiltinNode extends Node {
  private static final ChildSlot SOURCE = ChildSlot.one("source");
  private static final ChildSlot GLOBALS = ChildSlot.one("globals");
  private static final ChildSlot LOCALS = ChildSlot.one("locals");

  public EvalBuiltinNode(
      Node source, @Nullable Node globals, @Nullable Node locals, SourcePosition position) {
    super(Kind.EXPRESSION_BUILTIN_EVAL, position, SOURCE, GLOBALS, LOCALS);
    initChild(SOURCE, source);
    initChild(GLOBALS, globals);
    initChild(LOCALS, locals);
  }

  public String getMode() {
    return "eval";
  }

  public @Nullable Node getSource() {
    return getChildNode(SOURCE);
  }

  public @Nullable Node getGlobals() {
    return getChildNode(GLOBALS);
  }

  public @Nullable Node getLocals() {
    return getChildNode(LOCALS);
  }
}
