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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CheckReturnValue;
import java.io.IOException;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the analysis tree.
 *
 * <p>Every node has a {@link Kind}, a {@link SourcePosition} and, unless it is a module, exactly
 * one parent. Children live in a fixed table of named {@link ChildSlot}s declared by the concrete
 * kind. A slot holds no child, one child, or an immutable ordered sequence of children; an absent
 * sequence ({@code null}) is distinct from an empty one.
 *
 * <p>The tree owns its children. The parent link is a back-reference used for upward queries such
 * as scope walks and full names. After construction the shape of the tree is only changed through
 * {@link #replaceChild}, which keeps the parent links consistent.
 */
public abstract class Node {

  private final Kind kind;
  private final SourcePosition position;
  private final ImmutableList<ChildSlot> slots;
  private final @Nullable Object[] values;
  private @Nullable Node parent;

  protected Node(Kind kind, SourcePosition position, ChildSlot... slots) {
    this.kind = checkNotNull(kind);
    this.position = checkNotNull(position, "Missing source position for %s", kind);
    this.slots = ImmutableList.copyOf(slots);
    this.values = new Object[slots.length];
  }

  public final Kind getKind() {
    return kind;
  }

  public final SourcePosition getSourcePosition() {
    return position;
  }

  // Children

  /** Returns the declared slots of this node, in declaration order. */
  public final ImmutableList<ChildSlot> getSlots() {
    return slots;
  }

  private int indexOfSlot(String name) {
    for (int i = 0; i < slots.size(); i++) {
      if (slots.get(i).getName().equals(name)) {
        return i;
      }
    }
    throw new IllegalArgumentException("No slot '" + name + "' in " + kind);
  }

  /**
   * Returns the raw content of a slot: {@code null}, a {@link Node}, or an {@code ImmutableList} of
   * nodes for sequence slots.
   */
  public final @Nullable Object getChild(String slotName) {
    return values[indexOfSlot(slotName)];
  }

  /** Stores a single child, or clears the slot when {@code child} is null. */
  public final void setChild(String slotName, @Nullable Node child) {
    int index = indexOfSlot(slotName);
    checkArgument(
        !slots.get(index).isSequence() || child == null,
        "Slot %s of %s takes a sequence",
        slotName,
        kind);
    store(index, child);
  }

  /**
   * Stores a sequence of children. The list is copied into an immutable list, so later changes to
   * the argument have no effect. A null list marks the sequence as absent.
   */
  public final void setChildren(String slotName, @Nullable List<? extends Node> children) {
    int index = indexOfSlot(slotName);
    checkArgument(
        slots.get(index).isSequence(), "Slot %s of %s takes a single node", slotName, kind);
    store(index, children == null ? null : ImmutableList.copyOf(children));
  }

  protected final @Nullable Node getChildNode(ChildSlot slot) {
    return (Node) values[slots.indexOf(slot)];
  }

  @SuppressWarnings("unchecked")
  protected final @Nullable ImmutableList<Node> getChildList(ChildSlot slot) {
    return (ImmutableList<Node>) values[slots.indexOf(slot)];
  }

  /** Like {@link #getChildList}, but an absent sequence reads as empty. */
  protected final ImmutableList<Node> getChildListOrEmpty(ChildSlot slot) {
    ImmutableList<Node> result = getChildList(slot);
    return result == null ? ImmutableList.of() : result;
  }

  protected final void initChild(ChildSlot slot, @Nullable Node child) {
    setChild(slot.getName(), child);
  }

  protected final void initChildren(ChildSlot slot, @Nullable List<? extends Node> children) {
    setChildren(slot.getName(), children);
  }

  private void store(int index, @Nullable Object value) {
    if (value instanceof Node) {
      checkFree((Node) value);
    } else if (value != null) {
      for (Node child : asList(value)) {
        checkFree(child);
      }
    }
    detachAll(values[index]);
    values[index] = value;
    adoptAll(value);
  }

  private void detachAll(@Nullable Object value) {
    if (value instanceof Node) {
      detachFromThis((Node) value);
    } else if (value != null) {
      for (Node child : asList(value)) {
        detachFromThis(child);
      }
    }
  }

  private void detachFromThis(Node child) {
    if (child.parent == this) {
      child.parent = null;
    }
  }

  private void checkFree(Node child) {
    checkState(
        child.parent == null || child.parent == this,
        "Child %s still has parent %s",
        child,
        child.parent);
  }

  private void adoptAll(@Nullable Object value) {
    if (value instanceof Node) {
      ((Node) value).parent = this;
    } else if (value != null) {
      for (Node child : asList(value)) {
        child.parent = this;
      }
    }
  }

  @SuppressWarnings("unchecked")
  private static ImmutableList<Node> asList(Object value) {
    return (ImmutableList<Node>) value;
  }

  /**
   * Returns every present child in slot declaration order, with sequences flattened.
   *
   * <p>This is the view used for generic traversal.
   */
  public ImmutableList<Node> getVisitableNodes() {
    return collectChildren(true);
  }

  /**
   * Returns the children evaluated in the scope this node belongs to. By default these are all
   * children except the {@code body} slot; scope nodes narrow it to their signature-level
   * children.
   */
  public ImmutableList<Node> getSameScopeNodes() {
    return collectChildren(false);
  }

  private ImmutableList<Node> collectChildren(boolean includeBody) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (int i = 0; i < slots.size(); i++) {
      Object value = values[i];
      if (value == null || (!includeBody && slots.get(i).isBody())) {
        continue;
      }
      if (value instanceof Node) {
        result.add((Node) value);
      } else {
        result.addAll(asList(value));
      }
    }
    return result.build();
  }

  /** Returns the name of the slot directly holding {@code child}, found by identity. */
  public final String getSlotOf(Node child) {
    for (int i = 0; i < slots.size(); i++) {
      Object value = values[i];
      if (value == child
          || (value instanceof ImmutableList && indexOf(asList(value), child) >= 0)) {
        return slots.get(i).getName();
      }
    }
    throw new IllegalStateException("Didn't find child " + child + " in " + this);
  }

  /**
   * Substitutes {@code newNode} at the exact position currently held by {@code oldNode}.
   *
   * <p>{@code oldNode} is located by identity among the direct children. The new node takes its
   * place under this node and the old node is detached. {@code newNode} may come from below {@code
   * oldNode}, which unwraps it.
   *
   * @throws IllegalStateException if {@code oldNode} is not a direct child of this node, or if
   *     {@code newNode} is still attached elsewhere in a tree
   */
  public void replaceChild(Node oldNode, Node newNode) {
    checkNotNull(newNode);
    checkState(
        newNode.parent == null || newNode.isDescendantOf(oldNode),
        "Replacement %s still has parent %s",
        newNode,
        newNode.parent);

    for (int i = 0; i < slots.size(); i++) {
      Object value = values[i];
      if (value == oldNode) {
        values[i] = newNode;
        finishReplacement(oldNode, newNode);
        return;
      } else if (value instanceof ImmutableList) {
        ImmutableList<Node> children = asList(value);
        int position = indexOf(children, oldNode);
        if (position >= 0) {
          ImmutableList.Builder<Node> replaced = ImmutableList.builder();
          for (int j = 0; j < children.size(); j++) {
            replaced.add(j == position ? newNode : children.get(j));
          }
          values[i] = replaced.build();
          finishReplacement(oldNode, newNode);
          return;
        }
      }
    }
    throw new IllegalStateException("Didn't find child " + oldNode + " in " + this);
  }

  private void finishReplacement(Node oldNode, Node newNode) {
    if (oldNode.parent == this) {
      oldNode.parent = null;
    }
    newNode.parent = this;
  }

  private static int indexOf(List<Node> nodes, Node node) {
    for (int i = 0; i < nodes.size(); i++) {
      if (nodes.get(i) == node) {
        return i;
      }
    }
    return -1;
  }

  /** Swaps {@code replacement} and its subtree into the position of {@code this}. */
  public final void replaceWith(Node replacement) {
    getParent().replaceChild(this, replacement);
  }

  // Parents

  /**
   * Returns the parent of this node. Every node except modules must have one.
   *
   * @throws IllegalStateException if this is a non-module node that was never attached
   */
  public final @Nullable Node getParent() {
    checkState(parent != null || isModule(), "Node without parent: %s", this);
    return parent;
  }

  public final boolean hasParent() {
    return parent != null;
  }

  /** Is this Node the same as {@code node} or a descendant of {@code node}? */
  public final boolean isDescendantOf(Node node) {
    for (Node n = this; n != null; n = n.parent) {
      if (n == node) {
        return true;
      }
    }
    return false;
  }

  /** Returns the depth of this node, where a root has level 1. */
  public final int getLevel() {
    return parent == null ? 1 : parent.getLevel() + 1;
  }

  /** Returns the closest enclosing function definition, or null at module level. */
  public final @Nullable FunctionNode getParentFunction() {
    Node current = parent;
    while (current != null && !(current instanceof FunctionNode)) {
      current = current.parent;
    }
    return (FunctionNode) current;
  }

  /**
   * Returns the module this node belongs to. Scope consumers follow their provider link, so this
   * also works for scopes whose subtree is not yet attached to the module.
   */
  public final ModuleNode getParentModule() {
    Node current = this;
    while (!(current instanceof ModuleNode)) {
      if (current instanceof VariableTaker) {
        current = (Node) ((VariableTaker) current).getProvider();
      } else {
        current = current.getParent();
      }
    }
    return (ModuleNode) current;
  }

  /**
   * Returns the scope whose variables names in this node are looked up in.
   *
   * <p>The walk stops at the nearest enclosing {@link VariableProvider}, except for the children a
   * provider evaluates in its defining scope: function defaults and decorators, lambda defaults,
   * class decorators and bases, and the outermost iterable of a comprehension. For those the walk
   * continues to the next provider out.
   */
  public final VariableProvider getParentVariableProvider() {
    Node previous = this;
    Node current = getParent();
    while (!(current instanceof VariableProvider)) {
      previous = current;
      current = current.getParent();
    }
    VariableProvider provider = (VariableProvider) current;
    if (provider.evaluatesInEnclosingScope(previous)) {
      return current.getParentVariableProvider();
    }
    return provider;
  }

  // Traversal

  /**
   * Visits this node and then every visitable child, depth first and left to right. There is no
   * early exit; a visitor that wants to stop has to track that itself.
   */
  public final void visit(NodeVisitor visitor) {
    visitor.visit(this);
    for (Node child : getVisitableNodes()) {
      child.visit(visitor);
    }
  }

  // Kind predicates

  public final boolean isModule() {
    return kind.isModule();
  }

  public final boolean isPackage() {
    return kind == Kind.PACKAGE;
  }

  public final boolean isStatement() {
    return kind.isStatement();
  }

  public final boolean isStatementsSequence() {
    return kind == Kind.STATEMENTS_SEQUENCE;
  }

  public final boolean isExpression() {
    return kind.isExpression();
  }

  public final boolean isBuiltin() {
    return kind.isBuiltin();
  }

  public final boolean isAssignTarget() {
    return kind.isAssignTarget();
  }

  public final boolean isFunction() {
    return kind == Kind.STATEMENT_FUNCTION_DEF;
  }

  public final boolean isClass() {
    return kind == Kind.STATEMENT_CLASS_DEF;
  }

  public final boolean isLambda() {
    return kind == Kind.EXPRESSION_LAMBDA_DEF;
  }

  public final boolean isGeneratorExpression() {
    return kind == Kind.EXPRESSION_GENERATOR_DEF;
  }

  public final boolean isContraction() {
    return kind.isContraction();
  }

  public final boolean isVariableReference() {
    return kind == Kind.EXPRESSION_VARIABLE_REF;
  }

  public final boolean isConstantReference() {
    return kind == Kind.EXPRESSION_CONSTANT_REF;
  }

  // Printing

  /** Description of the node, for {@link #toString} and graphical display. */
  public String getDescription() {
    return kind + " at " + position.getAsString();
  }

  /** Details of the node, for {@link #toString} and graphical display. */
  public String getDetail() {
    return "";
  }

  @Override
  public final String toString() {
    String detail = getDetail();
    if (detail.isEmpty()) {
      return "<Node " + getDescription() + ">";
    }
    return "<Node " + getDescription() + " " + detail + ">";
  }

  @CheckReturnValue
  public final String toStringTree() {
    try {
      StringBuilder s = new StringBuilder();
      appendStringTree(s);
      return s.toString();
    } catch (IOException e) {
      throw new RuntimeException("Should not happen\n" + e);
    }
  }

  public final void appendStringTree(Appendable appendable) throws IOException {
    toStringTreeHelper(this, 0, appendable);
  }

  private static void toStringTreeHelper(Node n, int level, Appendable sb) throws IOException {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n.toString());
    sb.append('\n');
    for (Node child : n.getVisitableNodes()) {
      toStringTreeHelper(child, level + 1, sb);
    }
  }
}
