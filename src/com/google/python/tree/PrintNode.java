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

/** {@code print >>dest, values}. Without a trailing comma a newline is printed at the end. */
public final class PrintNode extends Node {
  private static final ChildSlot DEST = ChildSlot.one("dest");
  private static final ChildSlot VALUES = ChildSlot.many("values");

  private final boolean newline;

  public PrintNode(
      @Nullable Node dest, List<? extends Node> values, boolean newline, SourcePosition position) {
    super(Kind.STATEMENT_PRINT, position, DEST, VALUES);
    this.newline = newline;
    initChild(DEST, dest);
    initChildren(VALUES, values);
  }

  public boolean isNewlinePrint() {
    return newline;
  }

  public @Nullable Node getDestination() {
    return getChildNode(DEST);
  }

  public ImmutableList<Node> getValues() {
    return getChildListOrEmpty(VALUES);
  }
}
