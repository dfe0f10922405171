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

import org.jspecify.annotations.Nullable;

/** Assignment to {@code expression.attribute}. */
public final class AssignTargetAttributeNode extends Node {
  private static final ChildSlot EXPRESSION = ChildSlot.one("expression");

  private final String attribute;

  public AssignTargetAttributeNode(Node expression, String attribute, SourcePosition position) {
    super(Kind.ASSIGN_TO_ATTRIBUTE, position, EXPRESSION);
    this.attribute = checkNotNull(attribute);
    initChild(EXPRESSION, expression);
  }

  public String getAttributeName() {
    return attribute;
  }

  public @Nullable Node getLookupSource() {
    return getChildNode(EXPRESSION);
  }

  @Override
  public String getDetail() {
    return "to attribute " + attribute;
  }
}
