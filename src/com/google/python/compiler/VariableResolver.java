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

import com.google.common.collect.ImmutableList;
import com.google.python.tree.AssignTargetVariableNode;
import com.google.python.tree.BindingConflictException;
import com.google.python.tree.ClassNode;
import com.google.python.tree.DeclareGlobalNode;
import com.google.python.tree.FunctionNode;
import com.google.python.tree.ModuleNode;
import com.google.python.tree.Node;
import com.google.python.tree.SourcePosition;
import com.google.python.tree.Variable;
import com.google.python.tree.VariableProvider;
import com.google.python.tree.VariableRefNode;
import com.google.python.tree.VariableTaker;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Binds every name in a module tree to a {@link Variable}.
 *
 * <p>Names in scopes that bind early (modules, classes and the comprehensions other than generator
 * expressions, when every enclosing scope binds early too) are resolved in tree order, as a parser
 * would resolve them while reading the source. All other names are deferred and resolved in three
 * steps:
 *
 * <ol>
 *   <li>the global declarations and bindings of every late scope, so that a reference in a function
 *       sees every local the function has, wherever in the body it is bound;
 *   <li>the names of deferred early scopes, such as a class body inside a function, in tree order;
 *   <li>the references of every late scope.
 * </ol>
 *
 * <p>A binding that conflicts with an earlier capture throws {@link BindingConflictException},
 * positioned at the offending binding. The rest of the module is then left unresolved.
 */
public final class VariableResolver implements AnalysisPass {
  private static final Logger logger = Logger.getLogger(VariableResolver.class.getName());

  public static final DiagnosticType BINDING_CONFLICT =
      DiagnosticType.error(
          "PY_BINDING_CONFLICT",
          "Name ''{0}'' is assigned to in {1}, but was already taken from an enclosing scope");

  private int earlyCount;
  private int deferredCount;

  @Override
  public void process(ModuleNode module) {
    earlyCount = 0;
    deferredCount = 0;
    Map<VariableProvider, LateScope> late = new LinkedHashMap<>();
    List<NameSite> deferredEarly = new ArrayList<>();
    module.visit(
        n -> {
          if (!isUnresolvedNameSite(n)) {
            return;
          }
          VariableProvider provider = n.getParentVariableProvider();
          if (canResolveEarly(provider)) {
            earlyCount++;
            resolve(provider, n);
          } else if (provider.isEarlyClosure()) {
            deferredCount++;
            deferredEarly.add(new NameSite(provider, n));
          } else {
            deferredCount++;
            late.computeIfAbsent(provider, p -> new LateScope()).add(n);
          }
        });

    for (Map.Entry<VariableProvider, LateScope> entry : late.entrySet()) {
      LateScope scope = entry.getValue();
      for (Node n : scope.globals) {
        resolve(entry.getKey(), n);
      }
      for (Node n : scope.bindings) {
        resolve(entry.getKey(), n);
      }
    }
    for (NameSite site : deferredEarly) {
      resolve(site.provider(), site.node());
    }
    for (Map.Entry<VariableProvider, LateScope> entry : late.entrySet()) {
      for (Node n : entry.getValue().references) {
        resolve(entry.getKey(), n);
      }
    }
    logger.fine(
        "Resolved "
            + earlyCount
            + " names early and "
            + deferredCount
            + " names in "
            + late.size()
            + " late scopes of "
            + module.getFullName());
  }

  /**
   * Whether names used directly in {@code provider} can be resolved as soon as they are seen. This
   * holds when every scope from {@code provider} out to the module binds early.
   */
  public static boolean canResolveEarly(VariableProvider provider) {
    VariableProvider current = provider;
    while (current.isEarlyClosure()) {
      if (current instanceof ModuleNode) {
        return true;
      }
      current = ((VariableTaker) current).getProvider();
    }
    return false;
  }

  private static boolean isUnresolvedNameSite(Node n) {
    if (n instanceof VariableRefNode) {
      return !((VariableRefNode) n).isResolved();
    } else if (n instanceof AssignTargetVariableNode) {
      return !((AssignTargetVariableNode) n).isResolved();
    } else if (n instanceof FunctionNode) {
      return ((FunctionNode) n).getTargetVariable() == null;
    } else if (n instanceof ClassNode) {
      return ((ClassNode) n).getTargetVariable() == null;
    }
    return n instanceof DeclareGlobalNode;
  }

  private static void resolve(VariableProvider provider, Node n) {
    if (n instanceof VariableRefNode) {
      VariableRefNode ref = (VariableRefNode) n;
      ref.setVariable(provider.getVariableForReference(ref.getVariableName()));
    } else if (n instanceof AssignTargetVariableNode) {
      AssignTargetVariableNode target = (AssignTargetVariableNode) n;
      target.setTargetVariable(
          bind(provider, target.getTargetVariableName(), target.getSourcePosition()));
    } else if (n instanceof FunctionNode) {
      FunctionNode function = (FunctionNode) n;
      function.setTargetVariable(
          bind(provider, function.getName(), function.getSourcePosition()));
    } else if (n instanceof ClassNode) {
      ClassNode clazz = (ClassNode) n;
      clazz.setTargetVariable(bind(provider, clazz.getName(), clazz.getSourcePosition()));
    } else if (n instanceof DeclareGlobalNode && provider instanceof VariableTaker) {
      // A module level declaration has nothing to bind.
      for (String name : ((DeclareGlobalNode) n).getVariableNames()) {
        ((VariableTaker) provider).getModuleClosureVariable(name);
      }
    }
  }

  private static Variable bind(VariableProvider provider, String name, SourcePosition position) {
    try {
      return provider.getVariableForAssignment(name);
    } catch (BindingConflictException e) {
      throw e.atPosition(position);
    }
  }

  /** The name sites of one late scope, waiting for resolution. */
  private static final class LateScope {
    final List<Node> globals = new ArrayList<>();
    final List<Node> bindings = new ArrayList<>();
    final List<Node> references = new ArrayList<>();

    void add(Node n) {
      if (n instanceof DeclareGlobalNode) {
        globals.add(n);
      } else if (n instanceof VariableRefNode) {
        references.add(n);
      } else {
        bindings.add(n);
      }
    }
  }

  /** A name in an early scope that sits inside a late one. */
  private record NameSite(VariableProvider provider, Node node) {}

  /** Returns the names that are still unresolved in {@code module}, in tree order. */
  public static ImmutableList<String> getUnresolvedNames(ModuleNode module) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    module.visit(
        n -> {
          if (n instanceof VariableRefNode && !((VariableRefNode) n).isResolved()) {
            result.add(((VariableRefNode) n).getVariableName());
          }
        });
    return result.build();
  }
}
