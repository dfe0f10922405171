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
 * The kind tag of every node in the analysis tree.
 *
 * <p>Each concrete {@link Node} subclass owns exactly one constant. The set is closed, so adding a
 * node class means adding a constant here, and two classes can never share a tag.
 */
public enum Kind {
  MODULE(Family.MODULE),
  PACKAGE(Family.MODULE),

  STATEMENTS_SEQUENCE(Family.STATEMENT_SEQUENCE),

  STATEMENT_CLASS_DEF(Family.STATEMENT),
  STATEMENT_FUNCTION_DEF(Family.STATEMENT),
  STATEMENT_ASSIGNMENT(Family.STATEMENT),
  STATEMENT_ASSIGNMENT_INPLACE(Family.STATEMENT),
  STATEMENT_EXPRESSION(Family.STATEMENT),
  STATEMENT_PRINT(Family.STATEMENT),
  STATEMENT_RETURN(Family.STATEMENT),
  STATEMENT_IMPORT_MODULE(Family.STATEMENT),
  STATEMENT_IMPORT_FROM(Family.STATEMENT),
  STATEMENT_RAISE_EXCEPTION(Family.STATEMENT),
  STATEMENT_ASSERT(Family.STATEMENT),
  STATEMENT_WITH(Family.STATEMENT),
  STATEMENT_FOR_LOOP(Family.STATEMENT),
  STATEMENT_WHILE_LOOP(Family.STATEMENT),
  STATEMENT_CONDITIONAL(Family.STATEMENT),
  STATEMENT_CONTINUE_LOOP(Family.STATEMENT),
  STATEMENT_BREAK_LOOP(Family.STATEMENT),
  STATEMENT_PASS(Family.STATEMENT),
  STATEMENT_TRY_FINALLY(Family.STATEMENT),
  STATEMENT_TRY_EXCEPT(Family.STATEMENT),
  STATEMENT_EXCEPT_HANDLER(Family.STATEMENT),
  STATEMENT_DECLARE_GLOBAL(Family.STATEMENT),
  STATEMENT_EXEC(Family.STATEMENT),

  ASSIGN_TO_VARIABLE(Family.ASSIGN_TARGET),
  ASSIGN_TO_ATTRIBUTE(Family.ASSIGN_TARGET),
  ASSIGN_TO_SUBSCRIPT(Family.ASSIGN_TARGET),
  ASSIGN_TO_SLICE(Family.ASSIGN_TARGET),
  ASSIGN_TO_TUPLE(Family.ASSIGN_TARGET),

  EXPRESSION_CONSTANT_REF(Family.EXPRESSION),
  EXPRESSION_VARIABLE_REF(Family.EXPRESSION),
  EXPRESSION_LAMBDA_DEF(Family.EXPRESSION),
  EXPRESSION_GENERATOR_DEF(Family.EXPRESSION),
  EXPRESSION_LIST_CONTRACTION(Family.EXPRESSION),
  EXPRESSION_SET_CONTRACTION(Family.EXPRESSION),
  EXPRESSION_DICT_CONTRACTION(Family.EXPRESSION),
  EXPRESSION_DICT_PAIR(Family.EXPRESSION),
  EXPRESSION_YIELD(Family.EXPRESSION),
  EXPRESSION_FUNCTION_CALL(Family.EXPRESSION),
  EXPRESSION_BINARY_OPERATION(Family.EXPRESSION),
  EXPRESSION_UNARY_OPERATION(Family.EXPRESSION),
  EXPRESSION_MAKE_SEQUENCE(Family.EXPRESSION),
  EXPRESSION_MAKE_DICTIONARY(Family.EXPRESSION),
  EXPRESSION_MAKE_SET(Family.EXPRESSION),
  EXPRESSION_ATTRIBUTE_REF(Family.EXPRESSION),
  EXPRESSION_SUBSCRIPTION_REF(Family.EXPRESSION),
  EXPRESSION_SLICE_REF(Family.EXPRESSION),
  EXPRESSION_SLICEOBJ_REF(Family.EXPRESSION),
  EXPRESSION_COMPARISON(Family.EXPRESSION),
  EXPRESSION_CONDITIONAL(Family.EXPRESSION),
  EXPRESSION_CONDITION_OR(Family.EXPRESSION),
  EXPRESSION_CONDITION_AND(Family.EXPRESSION),
  EXPRESSION_CONDITION_NOT(Family.EXPRESSION),

  EXPRESSION_BUILTIN_IMPORT(Family.BUILTIN),
  EXPRESSION_BUILTIN_GLOBALS(Family.BUILTIN),
  EXPRESSION_BUILTIN_LOCALS(Family.BUILTIN),
  EXPRESSION_BUILTIN_DIR(Family.BUILTIN),
  EXPRESSION_BUILTIN_VARS(Family.BUILTIN),
  EXPRESSION_BUILTIN_EVAL(Family.BUILTIN),
  EXPRESSION_BUILTIN_OPEN(Family.BUILTIN),
  EXPRESSION_BUILTIN_CHR(Family.BUILTIN),
  EXPRESSION_BUILTIN_ORD(Family.BUILTIN),
  EXPRESSION_BUILTIN_TYPE1(Family.BUILTIN),
  EXPRESSION_BUILTIN_TYPE3(Family.BUILTIN),
  EXPRESSION_BUILTIN_RANGE(Family.BUILTIN),
  EXPRESSION_BUILTIN_LEN(Family.BUILTIN);

  /** The broad node families. Builtin calls are a sub-family of expressions. */
  public enum Family {
    MODULE,
    STATEMENT,
    STATEMENT_SEQUENCE,
    EXPRESSION,
    BUILTIN,
    ASSIGN_TARGET
  }

  private final Family family;

  Kind(Family family) {
    this.family = family;
  }

  public Family getFamily() {
    return family;
  }

  public boolean isModule() {
    return family == Family.MODULE;
  }

  public boolean isStatement() {
    return family == Family.STATEMENT;
  }

  public boolean isExpression() {
    return family == Family.EXPRESSION || family == Family.BUILTIN;
  }

  public boolean isBuiltin() {
    return family == Family.BUILTIN;
  }

  public boolean isAssignTarget() {
    return family == Family.ASSIGN_TARGET;
  }

  /** Whether this kind is one of the comprehension forms (generator expressions included). */
  public boolean isContraction() {
    switch (this) {
      case EXPRESSION_GENERATOR_DEF:
      case EXPRESSION_LIST_CONTRACTION:
      case EXPRESSION_SET_CONTRACTION:
      case EXPRESSION_DICT_CONTRACTION:
        return true;
      default:
        return false;
    }
  }
}
