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

/**
 * A scope-bearing node that gets a generated code name.
 *
 * <p>Code names are deterministic and independent of the source text apart from the node's own
 * identifier: they are built from the code name of the nearest enclosing named-code node and a
 * sequence number that the enclosing node hands out per {@link Kind}.
 */
public interface NamedCode {

  /** The kind-specific prefix of the code name, e.g. {@code "function"}. */
  String getCodePrefix();

  /** Returns the code name, computing it on first request. */
  String getCodeName();

  /**
   * Returns the next sequence number for a named-code descendant of the given node's kind,
   * starting at 1. Every call advances the counter.
   */
  int getChildUid(Node child);
}
