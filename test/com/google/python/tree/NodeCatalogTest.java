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
import static com.google.python.tree.testing.NodeSubject.assertNode;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.python.tree.SequenceCreationNode.SequenceKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for the construction checks and accessors of the statement and expression nodes. */
@RunWith(JUnit4.class)
public final class NodeCatalogTest {
  private static final SourcePosition POS = SourcePosition.of("test.py", 1);

  private static VariableRefNode ref(String name) {
    return new VariableRefNode(name, POS);
  }

  private static StatementsSequenceNode block(Node... statements) {
    return new StatementsSequenceNode(ImmutableList.copyOf(statements), POS);
  }

  @Test
  public void testStatementsSequenceRejectsExpressions() {
    assertThrows(IllegalArgumentException.class, () -> block(ref("x")));
  }

  @Test
  public void testRaise() {
    VariableRefNode type = ref("ValueError");
    VariableRefNode value = ref("message");

    RaiseNode raise = new RaiseNode(type, value, null, POS);

    assertThat(raise.isReraise()).isFalse();
    assertThat(raise.getExceptionParameters()).containsExactly(type, value).inOrder();
    assertThat(new RaiseNode(null, null, null, POS).isReraise()).isTrue();
    assertThrows(IllegalArgumentException.class, () -> new RaiseNode(null, ref("v"), null, POS));
    assertThrows(
        IllegalArgumentException.class, () -> new RaiseNode(ref("t"), null, ref("tb"), POS));
  }

  @Test
  public void testTryExceptNeedsHandlers() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new TryExceptNode(block(new PassNode(POS)), ImmutableList.of(), null, POS));
  }

  @Test
  public void testExceptHandlerBranchIsInSameScope() {
    VariableRefNode type = ref("KeyError");
    AssignTargetVariableNode target = new AssignTargetVariableNode("e", POS);
    StatementsSequenceNode branch = block(new PassNode(POS));
    ExceptHandlerNode handler = new ExceptHandlerNode(type, target, branch, POS);
    TryExceptNode tryExcept =
        new TryExceptNode(block(new PassNode(POS)), ImmutableList.of(handler), null, POS);

    assertNode(handler).hasSameScopeNodesExactly(type, target, branch).hasParent(tryExcept);
    assertThat(tryExcept.getHandlers()).containsExactly(handler);
    assertThat(tryExcept.getBlockNoRaise()).isNull();
  }

  @Test
  public void testConditionalStatementBranchCount() {
    ConditionalStatementNode conditional =
        new ConditionalStatementNode(
            ImmutableList.of(ref("a")),
            ImmutableList.of(block(new PassNode(POS)), block(new PassNode(POS))),
            POS);

    assertThat(conditional.getBranches()).hasSize(2);
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new ConditionalStatementNode(
                ImmutableList.of(ref("a")), ImmutableList.of(), POS));
  }

  @Test
  public void testExecNormalizesNone() {
    ExecNode globalsOnly =
        new ExecNode(ref("code"), ConstantNode.none(POS), ConstantNode.none(POS), POS);
    VariableRefNode globals = ref("g");
    ExecNode withLocals = new ExecNode(ref("code"), globals, ref("l"), POS);

    assertThat(globalsOnly.getGlobals()).isNull();
    assertThat(globalsOnly.getLocals()).isNull();
    assertThat(withLocals.getGlobals()).isSameInstanceAs(globals);
    assertThat(withLocals.getMode()).isEqualTo("exec");
  }

  @Test
  public void testImports() {
    ImportFromNode star = new ImportFromNode("os", null, "os.py", ImmutableList.of(), POS);
    ImportFromNode named =
        new ImportFromNode(
            "os",
            null,
            "os.py",
            ImmutableList.of(ImportSpec.of("path"), new ImportSpec("sep", "s", null, null)),
            POS);

    assertThat(star.isStarImport()).isTrue();
    assertThat(star.getDetail()).isEqualTo("os: *");
    assertThat(named.isStarImport()).isFalse();
    assertThat(named.getDetail()).isEqualTo("os: path;sep as s");
    assertThat(named.getImports().get(1).getLocalName()).isEqualTo("s");
    assertThrows(
        IllegalArgumentException.class, () -> new ImportModuleNode(ImmutableList.of(), POS));
  }

  @Test
  public void testFunctionCallArguments() {
    VariableRefNode called = ref("f");
    VariableRefNode positional = ref("a");
    VariableRefNode named = ref("b");

    FunctionCallNode call =
        new FunctionCallNode(
            called, ImmutableList.of(positional), ImmutableMap.of("key", named), null, null, POS);

    assertNode(call).hasVisitableNodesExactly(called, positional, named);
    assertThat(call.getNamedArguments()).containsExactly("key", named);
    assertThat(call.hasOnlyPositionalArguments()).isFalse();
    assertThat(call.isEmptyCall()).isFalse();
    FunctionCallNode empty =
        new FunctionCallNode(ref("g"), ImmutableList.of(), ImmutableMap.of(), null, null, POS);
    assertThat(empty.isEmptyCall()).isTrue();
  }

  @Test
  public void testComparisonOperandCount() {
    ComparisonNode chained =
        new ComparisonNode(
            ImmutableList.of(ref("a"), ref("b"), ref("c")), ImmutableList.of("<", "<="), POS);

    assertThat(chained.getDetail()).isEqualTo("< <=");
    assertThrows(
        IllegalArgumentException.class,
        () -> new ComparisonNode(ImmutableList.of(ref("a")), ImmutableList.of("=="), POS));
  }

  @Test
  public void testBooleanOperatorsNeedTwoOperands() {
    assertThat(new AndNode(ImmutableList.of(ref("a"), ref("b")), POS).getExpressions()).hasSize(2);
    assertThrows(
        IllegalArgumentException.class, () -> new OrNode(ImmutableList.of(ref("a")), POS));
  }

  @Test
  public void testSequenceCreation() {
    SequenceCreationNode tuple =
        new SequenceCreationNode(SequenceKind.TUPLE, ImmutableList.of(ref("a")), POS);

    assertThat(tuple.getDetail()).isEqualTo("tuple");
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new SequenceCreationNode(
                SequenceKind.LIST, ImmutableList.of(new PassNode(POS)), POS));
  }

  @Test
  public void testDeclareGlobalHasNoChildren() {
    DeclareGlobalNode global = new DeclareGlobalNode(ImmutableList.of("a", "b"), POS);

    assertThat(global.getVariableNames()).containsExactly("a", "b").inOrder();
    assertNode(global).hasVisitableNodesExactly();
  }

  @Test
  public void testLoopsIndicateBreakContinue() {
    WhileLoopNode loop = new WhileLoopNode(ref("cond"), block(new PassNode(POS)), null, POS);

    assertThat(loop.needsExceptionBreakContinue()).isFalse();
    loop.markAsExceptionBreakContinue();
    assertThat(loop.needsExceptionBreakContinue()).isTrue();
  }

  @Test
  public void testBuiltinsAreExpressions() {
    RangeBuiltinNode range = new RangeBuiltinNode(new ConstantNode(10, POS), null, null, POS);

    assertThat(range.isBuiltin()).isTrue();
    assertThat(range.isExpression()).isTrue();
    assertThat(range.getLow()).isNotNull();
    assertThat(range.getHigh()).isNull();
    assertThat(new LenBuiltinNode(ref("xs"), POS).getKind())
        .isEqualTo(Kind.EXPRESSION_BUILTIN_LEN);
  }

  @Test
  public void testFramesStayInScope() {
    VariableRefNode manager = ref("lock");
    AssignTargetVariableNode target = new AssignTargetVariableNode("held", POS);
    StatementsSequenceNode withBody = block(new PassNode(POS));
    WithNode with = new WithNode(manager, target, withBody, POS);
    VariableRefNode condition = ref("running");
    StatementsSequenceNode loopBody = block(new PassNode(POS));
    StatementsSequenceNode noEnter = block(new PassNode(POS));
    WhileLoopNode loop = new WhileLoopNode(condition, loopBody, noEnter, POS);

    assertNode(with).hasSameScopeNodesExactly(manager, target, withBody);
    assertThat(with.getWithBody()).isSameInstanceAs(withBody);
    assertNode(loop).hasSameScopeNodesExactly(condition, noEnter, loopBody);
    assertThat(loop.getLoopBody()).isSameInstanceAs(loopBody);
    assertThat(loop.getNoEnter()).isSameInstanceAs(noEnter);
  }

  @Test
  public void testStatementAccessors() {
    VariableRefNode destination = ref("stream");
    VariableRefNode value = ref("text");
    PrintNode print = new PrintNode(destination, ImmutableList.of(value), false, POS);
    VariableRefNode failure = ref("message");
    AssertNode assertion = new AssertNode(ref("ok"), failure, POS);
    StatementsSequenceNode tried = block(new PassNode(POS));
    StatementsSequenceNode fin = block(new PassNode(POS));
    TryFinallyNode tryFinally = new TryFinallyNode(tried, fin, POS);
    ImportModuleNode imports =
        new ImportModuleNode(
            ImmutableList.of(ImportSpec.of("missing"), new ImportSpec("os", null, null, "os.py")),
            POS);

    assertThat(print.isNewlinePrint()).isFalse();
    assertThat(print.getDestination()).isSameInstanceAs(destination);
    assertThat(print.getValues()).containsExactly(value);
    assertThat(assertion.getArgument()).isSameInstanceAs(failure);
    assertThat(tryFinally.getBlockTry()).isSameInstanceAs(tried);
    assertThat(tryFinally.getBlockFinal()).isSameInstanceAs(fin);
    assertThat(imports.getModuleFilenames()).containsExactly("os.py");
    assertThat(imports.getDetail()).isEqualTo("missing;os");
  }

  @Test
  public void testExpressionAccessors() {
    VariableRefNode name = ref("name");
    VariableRefNode bases = ref("bases");
    VariableRefNode dict = ref("dict");
    Type3BuiltinNode type = new Type3BuiltinNode(name, bases, dict, POS);
    VariableRefNode key = ref("k");
    DictionaryCreationNode dictionary =
        new DictionaryCreationNode(ImmutableList.of(key), ImmutableList.of(ref("v")), POS);
    OpenBuiltinNode open = new OpenBuiltinNode(ref("path"), null, null, POS);
    VariableRefNode subscribed = ref("items");
    AssignTargetSubscriptNode subscript =
        new AssignTargetSubscriptNode(subscribed, new ConstantNode(0, POS), POS);

    assertNode(type).hasVisitableNodesExactly(name, bases, dict);
    assertThat(type.getTypeName()).isSameInstanceAs(name);
    assertThat(type.getBases()).isSameInstanceAs(bases);
    assertThat(type.getDict()).isSameInstanceAs(dict);
    assertThat(dictionary.getKeys()).containsExactly(key);
    assertThrows(
        IllegalArgumentException.class,
        () -> new DictionaryCreationNode(ImmutableList.of(key), ImmutableList.of(), POS));
    assertThat(open.getMode()).isNull();
    assertThat(open.getBuffering()).isNull();
    assertThat(subscript.getSubscribed()).isSameInstanceAs(subscribed);
    assertThat(subscript.isAssignTarget()).isTrue();
  }
}
