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

package com.google.python.compiler;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.Sets;
import com.google.python.tree.AssignTargetVariableNode;
import com.google.python.tree.ModuleNode;
import com.google.python.tree.Node;
import com.google.python.tree.VariableRefNode;
import java.util.Set;

/**
 * Checks the structural invariants of a tree: each child points back at the node holding it, no
 * node is held twice, and, if requested, every name was resolved.
 *
 * <p>Violations are bugs in whatever built or changed the tree, so they throw {@link
 * IllegalStateException} instead of being reported as diagnostics.
 */
public final class TreeValidator implements AnalysisPass {
  private final boolean requireResolution;

  public TreeValidator(boolean requireResolution) {
    this.requireResolution = requireResolution;
  }

  @Override
  public void process(ModuleNode module) {
    checkState(!module.hasParent(), "Module %s is not a root", module);
    Set<Node> seen = Sets.newIdentityHashSet();
    module.visit(
        n -> {
          checkState(seen.add(n), "Node %s is reachable twice", n);
          for (Node child : n.getVisitableNodes()) {
            checkState(
                child.hasParent() && child.getParent() == n,
                "Child %s of %s has parent %s",
                child,
                n,
                child.hasParent() ? child.getParent() : null);
          }
          if (requireResolution) {
            validateResolved(n);
          }
        });
  }

  private static void validateResolved(Node n) {
    if (n instanceof VariableRefNode) {
      checkState(((VariableRefNode) n).isResolved(), "Unresolved reference %s", n);
    } else if (n instanceof AssignTargetVariableNode) {
      checkState(((AssignTargetVariableNode) n).isResolved(), "Unresolved target %s", n);
    }
  }
}
