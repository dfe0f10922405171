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
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  private NodeUtil() {}

  /**
   * Returns the node the scope chain continues at: the provider for scope consumers, which may not
   * be attached yet, and the parent otherwise.
   */
  static @Nullable Node getScopeParent(Node n) {
    if (n instanceof VariableTaker) {
      return (Node) ((VariableTaker) n).getProvider();
    }
    return n.hasParent() ? n.getParent() : null;
  }

  /** Returns the nearest enclosing {@link NamedCode}, or null if there is none. */
  static @Nullable NamedCode getEnclosingNamedCode(Node n) {
    for (Node current = getScopeParent(n); current != null; current = getScopeParent(current)) {
      if (current instanceof NamedCode) {
        return (NamedCode) current;
      }
    }
    return null;
  }

  /**
   * Returns the short name used for a scope in full names: the identifier for named nodes, and a
   * fixed word for the anonymous scopes.
   */
  public static String getNiceName(Node n) {
    switch (n.getKind()) {
      case EXPRESSION_LAMBDA_DEF:
        return "lambda";
      case EXPRESSION_GENERATOR_DEF:
        return "genexpr";
      case EXPRESSION_LIST_CONTRACTION:
        return "listcontr";
      case EXPRESSION_SET_CONTRACTION:
        return "setcontr";
      case EXPRESSION_DICT_CONTRACTION:
        return "dictcontr";
      default:
        if (n instanceof NamedNode) {
          return ((NamedNode) n).getName();
        }
        throw new IllegalArgumentException("No name for " + n);
    }
  }

  /**
   * Returns the name of {@code n} prefixed by the nice names of every enclosing scope, joined with
   * {@code "__"}, e.g. {@code "pkg.mod__Outer__method"}. Modules contribute their dotted name.
   */
  public static String getFullName(Node n) {
    if (n instanceof ModuleNode) {
      return ((ModuleNode) n).getFullName();
    }
    StringBuilder result = new StringBuilder(getNiceName(n));
    for (Node current = getScopeParent(n); current != null; current = getScopeParent(current)) {
      if (current instanceof ModuleNode) {
        result.insert(0, ((ModuleNode) current).getFullName() + "__");
        break;
      } else if (current instanceof NamedCode) {
        result.insert(0, getNiceName(current) + "__");
      }
    }
    return result.toString();
  }

  /** Returns the names of the given variables, in order. */
  public static ImmutableList<String> getNames(Iterable<? extends Variable> variables) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (Variable variable : variables) {
      result.add(variable.getName());
    }
    return result.build();
  }

  /** Returns null for a constant {@code None} expression, and the expression otherwise. */
  static @Nullable Node convertNoneConstantToNull(@Nullable Node value) {
    if (value instanceof ConstantNode && ((ConstantNode) value).isNone()) {
      return null;
    }
    return value;
  }
}
