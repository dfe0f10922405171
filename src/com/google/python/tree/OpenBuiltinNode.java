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

/** {@code open(filename, mode, buffering)}. */
public final class OpenBuiltinNode extends Node {
  private static final ChildSlot FILENAME = ChildSlot.one("filename");
  private static final ChildSlot MODE = ChildSlot.one("mode");
  private static final ChildSlot BUFFERING = ChildSlot.one("buffering");

  public OpenBuiltinNode(
      Node filename, @Nullable Node mode, @Nullable Node buffering, SourcePosition position) {
    super(Kind.EXPRESSION_BUILTIN_OPEN, position, FILENAME, MODE, BUFFERING);
    initChild(FILENAME, filename);
    initChild(MODE, mode);
    initChild(BUFFERING, buffering);
  }

  public @Nullable Node getFilename() {
    return getChildNode(FILENAME);
  }

  public @Nullable Node getMode() {
    return getChildNode(MODE);
  }

  public @Nullable Node getBuffering() {
    return getChildNode(BUFFERING);
  }
}
