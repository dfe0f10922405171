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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A named child position of a node kind. A slot either holds at most one node, or an ordered
 * sequence of nodes.
 */
public final class ChildSlot {
  /** The slot name excluded from {@link Node#getSameScopeNodes()}. */
  public static final String BODY = "body";

  private final String name;
  private final boolean sequence;

  private ChildSlot(String name, boolean sequence) {
    this.name = checkNotNull(name);
    this.sequence = sequence;
  }

  /** A slot holding no child or exactly one child. */
  public static ChildSlot one(String name) {
    return new ChildSlot(name, false);
  }

  /** A slot holding an ordered, possibly empty, sequence of children. */
  public static ChildSlot many(String name) {
    return new ChildSlot(name, true);
  }

  public String getName() {
    return name;
  }

  public boolean isSequence() {
    return sequence;
  }

  boolean isBody() {
    return BODY.equals(name);
  }

  @Override
  public String toString() {
    return sequence ? name + "[]" : name;
  }
}
