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

/** An ordered block of statements. Sequences may nest. */
public final class StatementsSequenceNode extends Node {
  private static final ChildSlot STATEMENTS = ChildSlot.many("statements");

  public StatementsSequenceNode(List<? extends Node> statements, SourcePosition position) {
    super(Kind.STATEMENTS_SEQUENCE, position, STATEMENTS);
    for (Node statement : statements) {
      checkArgument(
          statement.isStatement() || statement.isStatementsSequence(),
          "Not a statement: %s",
          statement);
    }
    initChildren(STATEMENTS, statements);
  }

  public ImmutableList<Node> getStatements() {
    return getChildListOrEmpty(STATEMENTS);
  }
}
