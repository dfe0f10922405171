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

import static com.google.common.truth.Truth.assertThat;
import static com.google.python.tree.testing.NodeSubject.assertNode;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.python.tree.AssignTargetVariableNode;
import com.google.python.tree.AssignmentNode;
import com.google.python.tree.BindingConflictException;
import com.google.python.tree.ClassNode;
import com.google.python.tree.ConstantNode;
import com.google.python.tree.DeclareGlobalNode;
import com.google.python.tree.ExpressionStatementNode;
import com.google.python.tree.ForLoopNode;
import com.google.python.tree.FunctionNode;
import com.google.python.tree.GeneratorExpressionNode;
import com.google.python.tree.LambdaNode;
import com.google.python.tree.ListContractionNode;
import com.google.python.tree.ModuleNode;
import com.google.python.tree.Node;
import com.google.python.tree.NodeUtil;
import com.google.python.tree.ParameterSpec;
import com.google.python.tree.ReturnNode;
import com.google.python.tree.SourcePosition;
import com.google.python.tree.StatementsSequenceNode;
import com.google.python.tree.Variable;
import com.google.python.tree.VariableProvider;
import com.google.python.tree.VariableRefNode;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link VariableResolver} */
@RunWith(JUnit4.class)
public final class VariableResolverTest {
  private static final SourcePosition POS = SourcePosition.of("mod.py", 1);

  private ModuleNode module;

  @Before
  public void setUp() {
    module = new ModuleNode("mod", null, POS);
  }

  private static StatementsSequenceNode block(Node... statements) {
    return new StatementsSequenceNode(ImmutableList.copyOf(statements), POS);
  }

  private static VariableRefNode ref(String name) {
    return new VariableRefNode(name, POS);
  }

  private static AssignTargetVariableNode target(String name) {
    return new AssignTargetVariableNode(name, POS);
  }

  private static AssignmentNode assign(AssignTargetVariableNode target, Node source) {
    return new AssignmentNode(ImmutableList.of(target), source, POS);
  }

  private static AssignmentNode assign(String name, int value) {
    return assign(target(name), new ConstantNode(value, POS));
  }

  private static FunctionNode function(VariableProvider provider, String name, String... params) {
    return new FunctionNode(
        provider,
        name,
        null,
        ParameterSpec.of(params),
        ImmutableList.of(),
        ImmutableList.of(),
        POS);
  }

  private static ClassNode clazz(VariableProvider provider, String name) {
    return new ClassNode(provider, name, null, ImmutableList.of(), ImmutableList.of(), POS);
  }

  private void resolve() {
    new VariableResolver().process(module);
  }

  @Test
  public void testModuleLevelNames() {
    AssignTargetVariableNode x = target("x");
    VariableRefNode use = ref("x");
    module.setBody(
        block(assign(x, new ConstantNode(1, POS)), new ExpressionStatementNode(use, POS)));

    resolve();

    assertThat(x.getTargetVariable().isModuleVariable()).isTrue();
    assertNode(use).isResolvedTo(x.getTargetVariable());
  }

  @Test
  public void testReferenceBeforeAssignmentInFunctionIsLocal() {
    FunctionNode f = function(module, "f");
    VariableRefNode use = ref("y");
    AssignTargetVariableNode y = target("y");
    f.setBody(block(new ExpressionStatementNode(use, POS), assign(y, new ConstantNode(1, POS))));
    module.setBody(block(f, assign("y", 2)));

    resolve();

    assertThat(y.getTargetVariable().isLocalVariable()).isTrue();
    assertNode(use).isResolvedTo(y.getTargetVariable());
    assertThat(f.getTargetVariable()).isSameInstanceAs(module.getProvidedVariable("f"));
  }

  @Test
  public void testClosureOverParameter() {
    FunctionNode f = function(module, "f", "x");
    FunctionNode g = function(f, "g");
    VariableRefNode inG = ref("x");
    g.setBody(block(new ReturnNode(inG, POS)));
    VariableRefNode inF = ref("x");
    f.setBody(block(assign(target("y"), inF), g));
    module.setBody(block(f));

    resolve();

    assertThat(inF.getVariable().isParameterVariable()).isTrue();
    assertThat(inG.getVariable().isClosureReference()).isTrue();
    assertThat(inG.getVariable().getOriginalVariable()).isSameInstanceAs(inF.getVariable());
    assertThat(g.getClosureVariables()).containsExactly(inG.getVariable());
    assertThat(f.getLocalVariableNames()).containsExactly("x", "y", "g").inOrder();
    assertThat(f.getClosureVariables()).isEmpty();
    assertThat(VariableResolver.getUnresolvedNames(module)).isEmpty();
  }

  @Test
  public void testLaterAssignmentMakesNameLocalForWholeBody() {
    FunctionNode f = function(module, "f");
    FunctionNode g = function(f, "g");
    VariableRefNode inG = ref("late");
    g.setBody(block(new ReturnNode(inG, POS)));
    f.setBody(block(g, assign("late", 1)));
    module.setBody(block(assign("late", 0), f));

    resolve();

    assertThat(inG.getVariable().isClosureReference()).isTrue();
    assertThat(inG.getVariable().getOriginalVariable().getOwner()).isSameInstanceAs(f);
  }

  @Test
  public void testGlobalDeclaration() {
    FunctionNode f = function(module, "f");
    AssignTargetVariableNode counter = target("counter");
    f.setBody(
        block(
            new DeclareGlobalNode(ImmutableList.of("counter"), POS),
            assign(counter, new ConstantNode(1, POS))));
    module.setBody(block(f));

    resolve();

    assertThat(counter.getTargetVariable()).isSameInstanceAs(module.getProvidedVariable("counter"));
    assertThat(f.getUserLocalVariables()).isEmpty();
  }

  @Test
  public void testClassBodyResolvesInOrder() {
    ClassNode c = clazz(module, "C");
    FunctionNode method = function(c, "method", "self");
    VariableRefNode inMethod = ref("attr");
    method.setBody(block(new ReturnNode(inMethod, POS)));
    AssignTargetVariableNode attr = target("attr");
    VariableRefNode inBody = ref("attr");
    c.setBody(
        block(assign(attr, new ConstantNode(1, POS)), assign(target("copy"), inBody), method));
    module.setBody(block(c));

    resolve();

    assertThat(attr.getTargetVariable().isClassVariable()).isTrue();
    assertNode(inBody).isResolvedTo(attr.getTargetVariable());
    assertThat(inMethod.getVariable().isModuleVariable()).isTrue();
    assertThat(NodeUtil.getNames(c.getClassVariables()))
        .containsExactly("attr", "copy", "method")
        .inOrder();
    assertThat(c.getTargetVariable().isModuleVariable()).isTrue();
  }

  @Test
  public void testClassInFunctionReadsEnclosingLocalBeforeOwnBinding() {
    FunctionNode f = function(module, "f");
    ClassNode c = clazz(f, "C");
    VariableRefNode before = ref("x");
    AssignTargetVariableNode classX = target("x");
    VariableRefNode after = ref("x");
    c.setBody(
        block(
            assign(target("y"), before),
            assign(classX, new ConstantNode(2, POS)),
            assign(target("z"), after)));
    AssignTargetVariableNode localX = target("x");
    f.setBody(block(assign(localX, new ConstantNode(1, POS)), c));
    module.setBody(block(f));

    resolve();

    assertThat(localX.getTargetVariable().getOwner()).isSameInstanceAs(f);
    assertThat(before.getVariable().isClosureReference()).isTrue();
    assertThat(before.getVariable().getOriginalVariable())
        .isSameInstanceAs(localX.getTargetVariable());
    assertThat(classX.getTargetVariable().isClassVariable()).isTrue();
    assertNode(after).isResolvedTo(classX.getTargetVariable());
    assertThat(c.getTargetVariable()).isSameInstanceAs(f.getProvidedVariable("C"));
  }

  @Test
  public void testClassInFunctionSeesLaterFunctionBinding() {
    FunctionNode f = function(module, "f");
    ClassNode c = clazz(f, "C");
    VariableRefNode use = ref("late");
    c.setBody(block(assign(target("copy"), use)));
    AssignTargetVariableNode late = target("late");
    f.setBody(block(c, assign(late, new ConstantNode(1, POS))));
    module.setBody(block(f));

    resolve();

    assertThat(use.getVariable().getOriginalVariable())
        .isSameInstanceAs(late.getTargetVariable());
  }

  @Test
  public void testClassInFunctionRebindingIsSeenInOrder() {
    FunctionNode f = function(module, "f");
    ClassNode c = clazz(f, "C");
    AssignTargetVariableNode first = target("a");
    VariableRefNode between = ref("a");
    AssignTargetVariableNode second = target("a");
    VariableRefNode last = ref("a");
    c.setBody(
        block(
            assign(first, new ConstantNode(1, POS)),
            assign(target("b"), between),
            assign(second, new ConstantNode(2, POS)),
            assign(target("d"), last)));
    f.setBody(block(c));
    module.setBody(block(f));

    resolve();

    assertNode(between).isResolvedTo(first.getTargetVariable());
    assertNode(last).isResolvedTo(second.getTargetVariable());
    assertThat(first.getTargetVariable()).isNotSameInstanceAs(second.getTargetVariable());
  }

  @Test
  public void testDefaultsResolveInEnclosingScope() {
    VariableRefNode defaultValue = ref("a");
    FunctionNode f =
        new FunctionNode(
            module,
            "f",
            null,
            new ParameterSpec(ImmutableList.of("a"), null, null, 1),
            ImmutableList.of(defaultValue),
            ImmutableList.of(),
            POS);
    VariableRefNode inBody = ref("a");
    f.setBody(block(new ReturnNode(inBody, POS)));
    module.setBody(block(f));

    resolve();

    assertThat(defaultValue.getVariable().isModuleVariable()).isTrue();
    assertThat(inBody.getVariable().isParameterVariable()).isTrue();
  }

  @Test
  public void testListContractionVariableLeaks() {
    FunctionNode f = function(module, "f");
    ListContractionNode contraction = new ListContractionNode(f, POS);
    VariableRefNode items = ref("items");
    AssignTargetVariableNode i = target("i");
    VariableRefNode element = ref("i");
    contraction.setSources(ImmutableList.of(items));
    contraction.setTargets(ImmutableList.of(i));
    contraction.setBody(element);
    VariableRefNode afterwards = ref("i");
    f.setBody(
        block(
            new ExpressionStatementNode(contraction, POS),
            new ReturnNode(afterwards, POS)));
    module.setBody(block(f));

    resolve();

    assertThat(f.getLocalVariableNames()).containsExactly("i");
    assertThat(afterwards.getVariable().getOwner()).isSameInstanceAs(f);
    assertThat(element.getVariable().getOriginalVariable())
        .isSameInstanceAs(afterwards.getVariable());
    assertThat(items.getVariable().isModuleVariable()).isTrue();
  }

  @Test
  public void testLoopTargetInFunction() {
    FunctionNode f = function(module, "f");
    AssignTargetVariableNode item = target("item");
    VariableRefNode use = ref("item");
    f.setBody(
        block(
            new ForLoopNode(
                ref("items"),
                item,
                block(new ExpressionStatementNode(use, POS)),
                null,
                POS)));
    module.setBody(block(f));

    resolve();

    assertThat(item.getTargetVariable().getOwner()).isSameInstanceAs(f);
    assertNode(use).isResolvedTo(item.getTargetVariable());
  }

  @Test
  public void testCanResolveEarly() {
    FunctionNode f = function(module, "f");
    ClassNode topClass = clazz(module, "C");

    assertThat(VariableResolver.canResolveEarly(module)).isTrue();
    assertThat(VariableResolver.canResolveEarly(topClass)).isTrue();
    assertThat(VariableResolver.canResolveEarly(new ListContractionNode(topClass, POS))).isTrue();
    assertThat(VariableResolver.canResolveEarly(f)).isFalse();
    assertThat(VariableResolver.canResolveEarly(clazz(f, "Inner"))).isFalse();
    assertThat(VariableResolver.canResolveEarly(new GeneratorExpressionNode(module, POS)))
        .isFalse();
    assertThat(
            VariableResolver.canResolveEarly(
                new LambdaNode(module, ParameterSpec.empty(), ImmutableList.of(), POS)))
        .isFalse();
  }

  @Test
  public void testBindingConflictIsPositionedAtBinding() {
    FunctionNode outer = function(module, "outer", "x");
    FunctionNode inner = function(outer, "inner");
    AssignTargetVariableNode x = new AssignTargetVariableNode("x", POS.atLine(5));
    inner.setBody(block(assign(x, new ConstantNode(1, POS))));
    outer.setBody(block(inner));
    module.setBody(block(outer));
    Variable captured = inner.getVariableForReference("x");

    BindingConflictException e = assertThrows(BindingConflictException.class, this::resolve);

    assertThat(captured.isClosureReference()).isTrue();
    assertThat(e.getVariableName()).isEqualTo("x");
    assertThat(e.getScope()).isSameInstanceAs(inner);
    assertThat(e.getPosition().getLine()).isEqualTo(5);
  }

  @Test
  public void testUnresolvedNames() {
    module.setBody(
        block(new ExpressionStatementNode(ref("a"), POS), new ReturnNode(ref("b"), POS)));

    assertThat(VariableResolver.getUnresolvedNames(module)).containsExactly("a", "b").inOrder();
    resolve();
    assertThat(VariableResolver.getUnresolvedNames(module)).isEmpty();
  }

  @Test
  public void testSecondRunKeepsVariables() {
    VariableRefNode use = ref("x");
    module.setBody(block(assign("x", 1), new ExpressionStatementNode(use, POS)));
    resolve();
    Variable first = use.getVariable();

    resolve();

    assertNode(use).isResolvedTo(first);
  }
}
