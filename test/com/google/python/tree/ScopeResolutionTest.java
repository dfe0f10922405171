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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for the variable lookup of the scope nodes: {@link ModuleNode}, {@link FunctionNode},
 * {@link ClassNode}, {@link LambdaNode} and the {@link ContractionNode}s.
 */
@RunWith(JUnit4.class)
public final class ScopeResolutionTest {
  private static final SourcePosition POS = SourcePosition.of("pkg/mod.py", 1);

  private ModuleNode module;

  @Before
  public void setUp() {
    module = new ModuleNode("mod", "pkg", POS);
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

  @Test
  public void testModuleVariablesAreMemoized() {
    Variable assigned = module.getVariableForAssignment("x");
    Variable referenced = module.getVariableForReference("x");

    assertThat(referenced).isSameInstanceAs(assigned);
    assertThat(assigned.isModuleVariable()).isTrue();
    assertThat(assigned.getOwner()).isSameInstanceAs(module);
    assertThat(module.getProvidedVariables()).containsExactly(assigned);
    assertThat(module.getLocalVariables()).isEmpty();
  }

  @Test
  public void testParametersAreLocals() {
    FunctionNode f = function(module, "f", "a", "b");

    assertThat(f.getLocalVariableNames()).containsExactly("a", "b").inOrder();
    assertThat(f.getUserLocalVariables()).isEmpty();
    Variable a = f.getVariableForReference("a");
    assertThat(a.isParameterVariable()).isTrue();
    assertThat(a.isLocalVariable()).isTrue();
    assertThat(f.getParameters().getVariables()).contains(a);
  }

  @Test
  public void testClosureOverParameter() {
    FunctionNode f = function(module, "f", "x");
    FunctionNode g = function(f, "g");

    Variable y = f.getVariableForAssignment("y");
    Variable x = g.getVariableForReference("x");

    assertThat(x.isClosureReference()).isTrue();
    assertThat(x.getOwner()).isSameInstanceAs(g);
    assertThat(x.getOriginalVariable()).isSameInstanceAs(f.getVariableForReference("x"));
    assertThat(((ClosureVariableReference) x).getReferencer()).isSameInstanceAs(g);
    assertThat(g.getVariableForReference("x")).isSameInstanceAs(x);
    assertThat(g.getClosureVariables()).containsExactly(x);
    assertThat(f.getLocalVariableNames()).containsExactly("x", "y").inOrder();
    assertThat(f.getUserLocalVariables()).containsExactly(y);
    assertThat(f.getClosureVariables()).isEmpty();
  }

  @Test
  public void testClosureChainsThroughIntermediateScope() {
    FunctionNode f = function(module, "f", "x");
    FunctionNode g = function(f, "g");
    LambdaNode h = new LambdaNode(g, ParameterSpec.empty(), ImmutableList.of(), POS);

    Variable x = h.getVariableForReference("x");

    ClosureVariableReference reference = (ClosureVariableReference) x;
    assertThat(reference.getReferenced().isClosureReference()).isTrue();
    assertThat(reference.getReferenced().getOwner()).isSameInstanceAs(g);
    assertThat(x.getOriginalVariable()).isSameInstanceAs(f.getVariableForReference("x"));
    assertThat(NodeUtil.getNames(g.getClosureVariables())).containsExactly("x");
  }

  @Test
  public void testClosureVariablesAreSortedByName() {
    FunctionNode f = function(module, "f", "b", "a");
    FunctionNode g = function(f, "g");

    g.getVariableForReference("b");
    g.getVariableForReference("a");

    assertThat(NodeUtil.getNames(g.getClosureVariables())).containsExactly("a", "b").inOrder();
    assertThat(NodeUtil.getNames(g.getTakenVariables())).containsExactly("b", "a").inOrder();
  }

  @Test
  public void testModuleVariablesNeedNoClosure() {
    FunctionNode f = function(module, "f");
    FunctionNode g = function(f, "g");

    Variable len = g.getVariableForReference("len");

    assertThat(len).isSameInstanceAs(module.getVariableForReference("len"));
    assertThat(g.getClosureVariables()).isEmpty();
    assertThat(g.hasTakenVariable("len")).isTrue();
    assertThat(f.getTakenVariable("len")).isSameInstanceAs(len);
  }

  @Test
  public void testClassScopeIsInvisibleToMethods() {
    ClassNode c = clazz(module, "C");
    FunctionNode method = function(c, "method", "self");

    Variable attribute = c.getVariableForAssignment("attr");
    Variable seenByMethod = method.getVariableForReference("attr");

    assertThat(attribute.isClassVariable()).isTrue();
    assertThat(c.getVariableForReference("attr")).isSameInstanceAs(attribute);
    assertThat(seenByMethod.isModuleVariable()).isTrue();
    assertThat(c.getClassVariables()).containsExactly(attribute);
  }

  @Test
  public void testListContractionSeesClassScope() {
    ClassNode c = clazz(module, "C");
    Variable attribute = c.getVariableForAssignment("attr");
    ListContractionNode listContraction = new ListContractionNode(c, POS);
    SetContractionNode setContraction = new SetContractionNode(c, POS);

    Variable fromList = listContraction.getVariableForReference("attr");
    Variable fromSet = setContraction.getVariableForReference("attr");

    assertThat(fromList.getOriginalVariable()).isSameInstanceAs(attribute);
    assertThat(fromSet.isModuleVariable()).isTrue();
  }

  @Test
  public void testClassAssignmentCreatesFreshVariable() {
    ClassNode c = clazz(module, "C");

    Variable first = c.getVariableForAssignment("x");
    Variable second = c.getVariableForAssignment("x");

    assertThat(second).isNotSameInstanceAs(first);
    assertThat(c.getVariableForReference("x")).isSameInstanceAs(second);
  }

  @Test
  public void testListContractionVariableLeaksIntoFunction() {
    FunctionNode f = function(module, "f");
    ListContractionNode contraction = new ListContractionNode(f, POS);

    Variable i = contraction.getVariableForAssignment("i");

    assertThat(f.getLocalVariableNames()).containsExactly("i");
    assertThat(i.isClosureReference()).isTrue();
    assertThat(i.getOriginalVariable()).isSameInstanceAs(f.getVariableForReference("i"));
    assertThat(contraction.getVariableForAssignment("i")).isSameInstanceAs(i);
  }

  @Test
  public void testListContractionVariableLeaksIntoModule() {
    ListContractionNode contraction = new ListContractionNode(module, POS);

    Variable i = contraction.getVariableForAssignment("i");

    assertThat(i).isSameInstanceAs(module.getVariableForReference("i"));
    assertThat(contraction.getClosureVariables()).isEmpty();
  }

  @Test
  public void testGeneratorExpressionVariablesStayInside() {
    FunctionNode f = function(module, "f");
    GeneratorExpressionNode generator = new GeneratorExpressionNode(f, POS);
    DictContractionNode dictContraction = new DictContractionNode(f, POS);

    Variable i = generator.getVariableForAssignment("i");
    Variable k = dictContraction.getVariableForAssignment("k");

    assertThat(i.isLoopVariable()).isTrue();
    assertThat(i.getOwner()).isSameInstanceAs(generator);
    assertThat(k.isLoopVariable()).isTrue();
    assertThat(f.getLocalVariables()).isEmpty();
    assertThat(generator.isEarlyClosure()).isFalse();
    assertThat(dictContraction.isEarlyClosure()).isTrue();
  }

  @Test
  public void testDictPairTakesFromContraction() {
    DictContractionNode contraction = new DictContractionNode(module, POS);
    Variable k = contraction.getVariableForAssignment("k");
    DictPairNode pair =
        new DictPairNode(
            contraction, new VariableRefNode("k", POS), new VariableRefNode("v", POS), POS);

    Variable taken = pair.getClosureVariable("k");

    assertThat(taken.getOriginalVariable()).isSameInstanceAs(k);
    assertThat(pair.getClosureVariables()).containsExactly(taken);
    assertThat(pair.getParentModule()).isSameInstanceAs(module);
  }

  @Test
  public void testGlobalDeclarationKeepsAssignmentsGlobal() {
    FunctionNode f = function(module, "f");

    ModuleVariable declared = f.getModuleClosureVariable("counter");
    Variable assigned = f.getVariableForAssignment("counter");

    assertThat(assigned).isSameInstanceAs(declared);
    assertThat(declared.getModule()).isSameInstanceAs(module);
    assertThat(f.getUserLocalVariables()).isEmpty();
  }

  @Test
  public void testAssignmentAfterCaptureConflicts() {
    FunctionNode outer = function(module, "outer", "x");
    FunctionNode inner = function(outer, "inner");
    inner.getVariableForReference("x");

    BindingConflictException e =
        assertThrows(BindingConflictException.class, () -> inner.getVariableForAssignment("x"));

    assertThat(e.getVariableName()).isEqualTo("x");
    assertThat(e.getScope()).isSameInstanceAs(inner);
    assertThat(e.getMessage()).contains("Function 'inner'");
    SourcePosition moved = POS.atLine(7);
    assertThat(e.atPosition(moved).getPosition()).isEqualTo(moved);
  }

  @Test
  public void testLambdaBindsLate() {
    LambdaNode lambda = new LambdaNode(module, ParameterSpec.of("a"), ImmutableList.of(), POS);

    assertThat(lambda.isEarlyClosure()).isFalse();
    assertThat(lambda.getVariableForReference("a").isParameterVariable()).isTrue();
    assertThat(lambda.getVariableForReference("b").isModuleVariable()).isTrue();
  }

  @Test
  public void testFullNames() {
    ClassNode c = clazz(module, "C");
    FunctionNode method = function(c, "method", "self");
    LambdaNode lambda = new LambdaNode(method, ParameterSpec.empty(), ImmutableList.of(), POS);

    assertThat(module.getFullName()).isEqualTo("pkg.mod");
    assertThat(c.getFullName()).isEqualTo("pkg.mod__C");
    assertThat(method.getFullName()).isEqualTo("pkg.mod__C__method");
    assertThat(NodeUtil.getFullName(lambda)).isEqualTo("pkg.mod__C__method__lambda");
    assertThat(method.getParentModule()).isSameInstanceAs(module);
  }

  @Test
  public void testDescriptions() {
    FunctionNode f =
        new FunctionNode(
            module,
            "f",
            null,
            new ParameterSpec(ImmutableList.of("a"), "args", "kwargs", 0),
            ImmutableList.of(),
            ImmutableList.of(),
            POS.atLine(3));

    assertThat(f.getDescription())
        .isEqualTo("Function 'f' with ParameterSpec(a, *args, **kwargs) at pkg/mod.py:3");
    assertThat(f.getVariableForReference("a").toString())
        .isEqualTo("<ParameterVariable 'a' of " + f.getDescription() + ">");
  }
}
