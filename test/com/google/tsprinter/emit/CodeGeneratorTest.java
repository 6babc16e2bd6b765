/*
 * Copyright 2004 The Closure Compiler Authors.
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

package com.google.tsprinter.emit;

import static com.google.common.truth.Truth.assertThat;

import com.google.tsprinter.ast.IR;
import com.google.tsprinter.ast.Node;
import com.google.tsprinter.ast.Node.ListSlot;
import com.google.tsprinter.ast.Node.Prop;
import com.google.tsprinter.ast.Node.Slot;
import com.google.tsprinter.ast.NodeFlags;
import com.google.tsprinter.ast.NodeList;
import com.google.tsprinter.ast.SourceFile;
import com.google.tsprinter.ast.SyntaxKind;
import com.google.tsprinter.emit.EmitOptions.ScriptTarget;
import com.google.tsprinter.emit.TransformContext.EmitNotification;
import com.google.tsprinter.emit.TransformContext.NodeEmitter;
import com.google.tsprinter.emit.TransformContext.NodeSubstitution;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodeGeneratorTest extends CodePrinterTestBase {

  @Test
  public void testEmptyFile() {
    assertThat(printStatements()).isEmpty();
  }

  @Test
  public void testLiterals() {
    assertPrint(
        "f(1, \"a\\nb\", true, null, /a+/g);",
        IR.exprResult(
            IR.call(
                IR.name("f"),
                IR.number(1),
                IR.string("a\nb"),
                IR.trueNode(),
                IR.nullNode(),
                IR.regex("/a+/g"))));
  }

  @Test
  public void testNewExpression() {
    assertPrint("new C;", IR.exprResult(IR.newNode(IR.name("C"), null)));
    assertPrint("new C(1);", IR.exprResult(IR.newNode(IR.name("C"), NodeList.of(IR.number(1)))));
  }

  @Test
  public void testVariableStatements() {
    assertPrint(
        lines("var x = 1;", "let y;", "const z = \"s\";"),
        IR.var(IR.name("x"), IR.number(1)),
        IR.let(IR.name("y"), null),
        IR.constNode(IR.name("z"), IR.string("s")));
    assertPrint(
        "var a, b = 2;",
        IR.varStatement(
            NodeFlags.NONE,
            IR.variableDeclaration(IR.name("a"), null),
            IR.variableDeclaration(IR.name("b"), IR.number(2))));
  }

  @Test
  public void testBinaryExpressions() {
    assertPrint(
        "a = 1, b + c;",
        IR.exprResult(
            IR.comma(
                IR.assign(IR.name("a"), IR.number(1)),
                IR.binary(IR.name("b"), SyntaxKind.PLUS_TOKEN, IR.name("c")))));
    assertPrint(
        "a || b && c;",
        IR.exprResult(
            IR.binary(
                IR.name("a"),
                SyntaxKind.BAR_BAR_TOKEN,
                IR.binary(IR.name("b"), SyntaxKind.AMPERSAND_AMPERSAND_TOKEN, IR.name("c")))));
  }

  @Test
  public void testUnaryExpressions() {
    assertPrint(
        "- -x;",
        IR.exprResult(
            IR.prefix(SyntaxKind.MINUS_TOKEN, IR.prefix(SyntaxKind.MINUS_TOKEN, IR.name("x")))));
    assertPrint(
        "+ ++x;",
        IR.exprResult(
            IR.prefix(SyntaxKind.PLUS_TOKEN, IR.prefix(SyntaxKind.PLUS_PLUS_TOKEN, IR.name("x")))));
    assertPrint(
        "-+x;",
        IR.exprResult(
            IR.prefix(SyntaxKind.MINUS_TOKEN, IR.prefix(SyntaxKind.PLUS_TOKEN, IR.name("x")))));
    assertPrint("!x;", IR.exprResult(IR.prefix(SyntaxKind.EXCLAMATION_TOKEN, IR.name("x"))));
    assertPrint("x--;", IR.exprResult(IR.postfix(IR.name("x"), SyntaxKind.MINUS_MINUS_TOKEN)));
    assertPrint(
        "typeof x;", IR.exprResult(IR.unaryKeyword(SyntaxKind.TYPE_OF_EXPRESSION, IR.name("x"))));
    assertPrint(
        "delete o.p;",
        IR.exprResult(
            IR.unaryKeyword(SyntaxKind.DELETE_EXPRESSION, IR.getprop(IR.name("o"), "p"))));
    assertPrint(
        "void 0;", IR.exprResult(IR.unaryKeyword(SyntaxKind.VOID_EXPRESSION, IR.number(0))));
  }

  @Test
  public void testConditional() {
    assertPrint(
        "a ? b : c;", IR.exprResult(IR.hook(IR.name("a"), IR.name("b"), IR.name("c"))));
  }

  @Test
  public void testArrayLiteral() {
    assertPrint(
        "var a = [1, , 2];",
        IR.var(IR.name("a"), IR.arraylit(IR.number(1), IR.omitted(), IR.number(2))));
    assertPrint("var a = [];", IR.var(IR.name("a"), IR.arraylit()));
  }

  @Test
  public void testArrayLiteralWithSpread() {
    assertPrint(
        "f([...xs]);",
        IR.exprResult(IR.call(IR.name("f"), IR.arraylit(IR.spread(IR.name("xs"))))));
  }

  @Test
  public void testObjectLiteral() {
    assertPrint(
        "var o = { a: 1, b };",
        IR.var(
            IR.name("o"),
            IR.objectlit(
                IR.propertyAssignment(IR.name("a"), IR.number(1)),
                IR.shorthandPropertyAssignment(IR.name("b")))));
    assertPrint("var o = {};", IR.var(IR.name("o"), IR.objectlit()));
  }

  @Test
  public void testMultiLineObjectLiteral() {
    Node literal =
        IR.objectlit(
            IR.propertyAssignment(IR.name("a"), IR.number(1)),
            IR.shorthandPropertyAssignment(IR.name("b")));
    literal.putBooleanProp(Prop.MULTI_LINE, true);

    assertPrint(lines("var o = {", "    a: 1,", "    b", "};"), IR.var(IR.name("o"), literal));
  }

  @Test
  public void testObjectLiteralTrailingComma() {
    NodeList properties =
        NodeList.of(IR.propertyAssignment(IR.name("a"), IR.number(1))).withTrailingComma(true);

    Node es3 =
        new Node(SyntaxKind.OBJECT_LITERAL_EXPRESSION).setList(ListSlot.PROPERTIES, properties);
    assertPrint("var o = { a: 1 };", IR.var(IR.name("o"), es3));

    options.setTarget(ScriptTarget.ES5);
    NodeList es5Properties =
        NodeList.of(IR.propertyAssignment(IR.name("a"), IR.number(1))).withTrailingComma(true);
    Node es5 =
        new Node(SyntaxKind.OBJECT_LITERAL_EXPRESSION).setList(ListSlot.PROPERTIES, es5Properties);
    assertPrint("var o = { a: 1, };", IR.var(IR.name("o"), es5));
  }

  @Test
  public void testPropertyAccess() {
    assertPrint("a.b.c;", IR.exprResult(IR.getprop(IR.getprop(IR.name("a"), "b"), "c")));
    assertPrint("a[0];", IR.exprResult(IR.getelem(IR.name("a"), IR.number(0))));
  }

  @Test
  public void testPropertyAccessOnIntegerLiteral() {
    assertPrint("1..toString();", IR.exprResult(IR.call(IR.getprop(IR.number(1), "toString"))));
    assertPrint(
        "1.5.toFixed();", IR.exprResult(IR.call(IR.getprop(IR.number(1.5), "toFixed"))));
  }

  @Test
  public void testConstantValue() {
    resolver = new ConstantResolver("Name", 3);
    assertPrint("3 /* Name */;", IR.exprResult(IR.getprop(IR.name("E"), "Name")));
    assertPrint("3 /* Name */;", IR.exprResult(IR.getelem(IR.name("E"), IR.name("Name"))));
  }

  @Test
  public void testConstantValueWithoutComments() {
    resolver = new ConstantResolver("Name", 3);
    options.setRemoveComments(true);
    assertPrint("3;", IR.exprResult(IR.getprop(IR.name("E"), "Name")));
    assertPrint(
        "3..toString();",
        IR.exprResult(IR.call(IR.getprop(IR.getprop(IR.name("E"), "Name"), "toString"))));
  }

  @Test
  public void testConstantValueNotInlinedForIsolatedModules() {
    resolver = new ConstantResolver("Name", 3);
    options.setIsolatedModules(true);
    assertPrint("E.Name;", IR.exprResult(IR.getprop(IR.name("E"), "Name")));
  }

  @Test
  public void testTemplates() {
    options.setTarget(ScriptTarget.ES6);
    assertPrint(
        "`a${x}b`;",
        IR.exprResult(
            IR.templateExpression(
                IR.templateLiteral(SyntaxKind.TEMPLATE_HEAD, "a"),
                IR.templateSpan(
                    IR.name("x"), IR.templateLiteral(SyntaxKind.TEMPLATE_TAIL, "b")))));
    assertPrint(
        "tag `x`;",
        IR.exprResult(
            IR.taggedTemplate(
                IR.name("tag"),
                IR.templateLiteral(SyntaxKind.NO_SUBSTITUTION_TEMPLATE_LITERAL, "x"))));
  }

  @Test
  public void testFunctionDeclaration() {
    assertPrint(
        "function f(a, b) { return a; }",
        IR.function(
            IR.name("f"),
            NodeList.of(IR.param("a"), IR.param("b")),
            IR.block(IR.returnNode(IR.name("a")))));
  }

  @Test
  public void testMultiLineFunctionBody() {
    Node body = IR.block(IR.returnNode(IR.name("a")));
    body.putBooleanProp(Prop.MULTI_LINE, true);

    assertPrint(
        lines("function f(a) {", "    return a;", "}"),
        IR.function(IR.name("f"), NodeList.of(IR.param("a")), body));
  }

  @Test
  public void testExportedFunction() {
    Node function = IR.function(IR.name("f"), NodeList.empty(), IR.block());
    function.setList(ListSlot.MODIFIERS, IR.token(SyntaxKind.EXPORT_KEYWORD));

    assertPrint("export function f() { }", function);
  }

  @Test
  public void testFunctionExpression() {
    assertPrint(
        "var g = function () { };",
        IR.var(IR.name("g"), IR.functionExpression(null, NodeList.empty(), IR.block())));
  }

  @Test
  public void testParameters() {
    Node rest = IR.param("rest").putBooleanProp(Prop.DOT_DOT_DOT, true);
    Node optional = IR.param("b").putBooleanProp(Prop.QUESTION, true);
    Node withDefault = IR.param("c").setChild(Slot.INITIALIZER, IR.number(1));

    assertPrint(
        "function f(b?, c = 1, ...rest) { }",
        IR.function(IR.name("f"), NodeList.of(optional, withDefault, rest), IR.block()));
  }

  @Test
  public void testArrowFunctions() {
    assertPrint(
        "var f = x => x + 1;",
        IR.var(
            IR.name("f"),
            IR.arrowFunction(
                NodeList.of(IR.param("x")),
                IR.binary(IR.name("x"), SyntaxKind.PLUS_TOKEN, IR.number(1)))));
    assertPrint(
        "var f = (a, b) => a;",
        IR.var(
            IR.name("f"),
            IR.arrowFunction(NodeList.of(IR.param("a"), IR.param("b")), IR.name("a"))));
  }

  @Test
  public void testPrologueDirectives() {
    assertPrint(
        lines("function f() {", "    \"use strict\";", "    return;", "}"),
        IR.function(
            IR.name("f"),
            NodeList.empty(),
            IR.block(IR.exprResult(IR.string("use strict")), IR.returnNode(null))));
    assertPrint(
        lines("\"use strict\";", "f();"),
        IR.exprResult(IR.string("use strict")),
        IR.exprResult(IR.call(IR.name("f"))));
  }

  @Test
  public void testIfElse() {
    assertPrint(
        lines("if (x) {", "    a();", "}", "else {", "    b();", "}"),
        IR.ifNode(
            IR.name("x"),
            IR.block(IR.exprResult(IR.call(IR.name("a")))),
            IR.block(IR.exprResult(IR.call(IR.name("b"))))));
  }

  @Test
  public void testIfWithoutBlock() {
    assertPrint(
        lines("if (x)", "    a();"),
        IR.ifNode(IR.name("x"), IR.exprResult(IR.call(IR.name("a"))), null));
  }

  @Test
  public void testElseIf() {
    assertPrint(
        lines("if (x) { }", "else if (y) { }"),
        IR.ifNode(IR.name("x"), IR.block(), IR.ifNode(IR.name("y"), IR.block(), null)));
  }

  @Test
  public void testLoops() {
    assertPrint("while (x) { }", IR.whileNode(IR.name("x"), IR.block()));
    assertPrint(
        lines("do {", "    f();", "} while (x);"),
        IR.doNode(IR.block(IR.exprResult(IR.call(IR.name("f")))), IR.name("x")));
    assertPrint(
        "for (let i = 0; i < 10; i++) { }",
        IR.forNode(
            IR.variableDeclarationList(
                NodeFlags.LET, IR.variableDeclaration(IR.name("i"), IR.number(0))),
            IR.binary(IR.name("i"), SyntaxKind.LESS_THAN_TOKEN, IR.number(10)),
            IR.postfix(IR.name("i"), SyntaxKind.PLUS_PLUS_TOKEN),
            IR.block()));
    assertPrint("for (;;) { }", IR.forNode(null, null, null, IR.block()));
    assertPrint(
        "for (const v of xs) { }",
        IR.forOf(
            IR.variableDeclarationList(
                NodeFlags.CONST, IR.variableDeclaration(IR.name("v"), null)),
            IR.name("xs"),
            IR.block()));
  }

  @Test
  public void testForInWithExpressionInitializer() {
    assertPrint("for ((k) in o) { }", IR.forIn(IR.name("k"), IR.name("o"), IR.block()));
  }

  @Test
  public void testLabelsBreakAndContinue() {
    assertPrint(
        lines("L: while (true) {", "    break L;", "}"),
        IR.label(IR.name("L"), IR.whileNode(IR.trueNode(), IR.block(IR.breakNode(IR.name("L"))))));
    assertPrint(
        lines("while (true) {", "    continue;", "}"),
        IR.whileNode(IR.trueNode(), IR.block(IR.continueNode(null))));
  }

  @Test
  public void testSwitch() {
    assertPrint(
        lines("switch (x) {", "    case 1: f();", "    default: break;", "}"),
        IR.switchNode(
            IR.name("x"),
            IR.caseNode(IR.number(1), IR.exprResult(IR.call(IR.name("f")))),
            IR.defaultCase(IR.breakNode(null))));
  }

  @Test
  public void testSwitchClauseWithSeveralStatements() {
    assertPrint(
        lines("switch (x) {", "    case 1:", "        a();", "        b();", "}"),
        IR.switchNode(
            IR.name("x"),
            IR.caseNode(
                IR.number(1),
                IR.exprResult(IR.call(IR.name("a"))),
                IR.exprResult(IR.call(IR.name("b"))))));
  }

  @Test
  public void testTryCatchFinally() {
    assertPrint(
        lines("try {", "    a();", "}", "catch (e) { }", "finally {", "    b();", "}"),
        IR.tryCatchFinally(
            IR.block(IR.exprResult(IR.call(IR.name("a")))),
            IR.catchClause(IR.variableDeclaration(IR.name("e"), null), IR.block()),
            IR.block(IR.exprResult(IR.call(IR.name("b"))))));
  }

  @Test
  public void testSimpleStatements() {
    assertPrint(
        lines(";", "debugger;", "throw e;"),
        IR.empty(),
        IR.debugger(),
        IR.throwNode(IR.name("e")));
  }

  @Test
  public void testClass() {
    assertPrint(
        lines("class C extends B {", "    m() { }", "}"),
        IR.classDeclaration(
            IR.name("C"),
            NodeList.of(
                IR.heritageClause(
                    SyntaxKind.EXTENDS_KEYWORD, IR.expressionWithTypeArguments(IR.name("B")))),
            IR.method(IR.name("m"), NodeList.empty(), IR.block())));
  }

  @Test
  public void testClassMembers() {
    Node staticProperty = IR.propertyDeclaration(IR.name("count"), IR.number(0));
    staticProperty.setList(ListSlot.MODIFIERS, IR.token(SyntaxKind.STATIC_KEYWORD));

    assertPrint(
        lines(
            "class C {",
            "    static count = 0;",
            "    constructor(a) { }",
            "    get x() { }",
            "}"),
        IR.classDeclaration(
            IR.name("C"),
            null,
            staticProperty,
            IR.constructor(NodeList.of(IR.param("a")), IR.block()),
            IR.getter(IR.name("x"), IR.block())));
  }

  @Test
  public void testEnum() {
    assertPrint(
        lines("enum E {", "    A,", "    B = 2", "}"),
        IR.enumDeclaration(
            IR.name("E"),
            IR.enumMember(IR.name("A"), null),
            IR.enumMember(IR.name("B"), IR.number(2))));
  }

  @Test
  public void testNamespace() {
    assertPrint(
        lines("namespace N {", "    var x = 1;", "}"),
        IR.namespace(IR.name("N"), IR.moduleBlock(IR.var(IR.name("x"), IR.number(1)))));
  }

  @Test
  public void testNestedNamespaceNames() {
    assertPrint(
        "namespace A.B { }",
        IR.namespace(IR.name("A"), IR.namespace(IR.name("B"), IR.moduleBlock())));
  }

  @Test
  public void testImportsAndExports() {
    assertPrint(
        "import d, { a as b } from \"./m\";",
        IR.importDeclaration(
            IR.importClause(
                IR.name("d"), IR.namedImports(IR.importSpecifier(IR.name("a"), IR.name("b")))),
            IR.string("./m")));
    assertPrint(
        "import * as ns from \"./m\";",
        IR.importDeclaration(
            IR.importClause(null, IR.namespaceImport(IR.name("ns"))), IR.string("./m")));
    assertPrint("import \"./m\";", IR.importDeclaration(null, IR.string("./m")));
    assertPrint("export * from \"./m\";", IR.exportDeclaration(null, IR.string("./m")));
    assertPrint(
        "export { a };",
        IR.exportDeclaration(IR.namedExports(IR.exportSpecifier(null, IR.name("a"))), null));
    assertPrint("export = x;", IR.exportAssignment(IR.name("x"), true));
    assertPrint("export default x;", IR.exportAssignment(IR.name("x"), false));
    assertPrint(
        "import m = require(\"m\");",
        IR.importEquals(IR.name("m"), IR.externalModuleReference(IR.string("m"))));
  }

  @Test
  public void testTypes() {
    assertPrint(
        "x as A | number[];",
        IR.exprResult(
            IR.asExpression(
                IR.name("x"),
                IR.unionType(
                    IR.typeReference(IR.name("A")),
                    IR.arrayType(IR.token(SyntaxKind.NUMBER_KEYWORD))))));
    assertPrint(
        "<Map<string, T>>x;",
        IR.exprResult(
            IR.typeAssertion(
                IR.typeReference(
                    IR.name("Map"),
                    IR.token(SyntaxKind.STRING_KEYWORD),
                    IR.typeReference(IR.name("T"))),
                IR.name("x"))));
  }

  @Test
  public void testJsx() {
    Node attribute =
        new Node(SyntaxKind.JSX_ATTRIBUTE)
            .setChild(Slot.NAME, IR.name("id"))
            .setChild(Slot.INITIALIZER, IR.string("a"));
    Node opening =
        new Node(SyntaxKind.JSX_OPENING_ELEMENT)
            .setChild(Slot.TAG_NAME, IR.name("div"))
            .setList(ListSlot.ATTRIBUTES, attribute);
    Node closing = new Node(SyntaxKind.JSX_CLOSING_ELEMENT).setChild(Slot.TAG_NAME, IR.name("div"));
    Node element =
        new Node(SyntaxKind.JSX_ELEMENT)
            .setChild(Slot.OPENING_ELEMENT, opening)
            .setList(ListSlot.CHILDREN, new Node(SyntaxKind.JSX_TEXT).setText("hi"))
            .setChild(Slot.CLOSING_ELEMENT, closing);

    assertPrint("<div id=\"a\">hi</div>;", IR.exprResult(element));
  }

  @Test
  public void testNotEmittedStatement() {
    Node original = IR.exprResult(IR.call(IR.name("gone")));
    assertPrint(
        "f();", IR.notEmittedStatement(original), IR.exprResult(IR.call(IR.name("f"))));
  }

  @Test
  public void testPartiallyEmittedExpression() {
    Node original = IR.name("original");
    assertPrint("x;", IR.exprResult(IR.partiallyEmitted(IR.name("x"), original)));
  }

  @Test
  public void testTempVariables() {
    Node temp = IR.tempVariable();
    assertPrint(
        lines("var _a = 1;", "var _b = 2;", "_a;"),
        IR.var(temp, IR.number(1)),
        IR.var(IR.tempVariable(), IR.number(2)),
        IR.exprResult(temp));
  }

  @Test
  public void testTempVariableInNestedScopeAvoidsOuterNames() {
    assertPrint(
        lines("var _a;", "function f() {", "    var _b;", "}"),
        IR.var(IR.tempVariable(), null),
        IR.function(
            IR.name("f"), NodeList.empty(), multiLine(IR.block(IR.var(IR.tempVariable(), null)))));
  }

  @Test
  public void testIndentedObjectLiteralStartsTempScope() {
    Node value = IR.name("v");
    Node literal = IR.objectlit(IR.propertyAssignment(IR.name("a"), value));
    context.setEmitFlags(literal, EmitFlags.INDENTED);
    PrintSession session = new PrintSession();
    List<Integer> tempFlagsAtValue = new ArrayList<>();
    context.setEmitNotification(
        new EmitNotification() {
          @Override
          public boolean isEnabled(Node node) {
            return node == value;
          }

          @Override
          public void onEmitNode(Node node, NodeEmitter emitCallback) {
            tempFlagsAtValue.add(session.getTempFlags());
            emitCallback.emit(node);
          }
        });
    IndentingTextWriter writer = new IndentingTextWriter("\n");
    CodeGenerator generator =
        new CodeGenerator(
            options,
            writer,
            SourceMapWriter.NULL,
            new DefaultCommentWriter(writer, SourceMapWriter.NULL, options),
            context,
            resolver,
            session);

    generator.printSourceFile(IR.script("test.ts", IR.var(IR.tempVariable(), literal)));

    assertThat(writer.getText()).isEqualTo("var _a = { a: v };\n");
    assertThat(tempFlagsAtValue).containsExactly(0);
    assertThat(session.getTempFlags()).isEqualTo(1);
  }

  @Test
  public void testLoopAndUniqueNames() {
    assertPrint(
        lines("var _i, _n, _a;", "var foo_1;"),
        IR.varStatement(
            NodeFlags.NONE,
            IR.variableDeclaration(IR.loopVariable(), null),
            IR.variableDeclaration(IR.loopVariable(), null),
            IR.variableDeclaration(IR.loopVariable(), null)),
        IR.var(IR.uniqueName("foo"), null));
  }

  @Test
  public void testGeneratedNamesAvoidFileIdentifiers() {
    SourceFile file = new SourceFile("test.ts", "_a; foo_1;");
    file.setList(
        ListSlot.STATEMENTS,
        IR.var(IR.tempVariable(), null),
        IR.var(IR.uniqueName("foo"), null));

    assertThat(print(file)).isEqualTo(lines("var _b;", "var foo_2;", ""));
  }

  @Test
  public void testGeneratedNamesAvoidGlobals() {
    resolver =
        new EmitResolver() {
          @Override
          public @Nullable Double getConstantValue(Node node) {
            return null;
          }

          @Override
          public boolean hasGlobalName(String name) {
            return name.equals("_a");
          }
        };
    assertPrint("var _b;", IR.var(IR.tempVariable(), null));
  }

  @Test
  public void testExpressionSubstitution() {
    CountingSubstitution substitution = new CountingSubstitution("x", "y");
    context.setExpressionSubstitution(substitution);

    assertPrint("f(y);", IR.exprResult(IR.call(IR.name("f"), IR.name("x"))));
    assertThat(substitution.calls).isEqualTo(1);
  }

  @Test
  public void testSubstituteIsNotSubstitutedAgain() {
    // Replaces every identifier with a fresh one, which would never end if the replacement were
    // substituted in turn.
    NodeSubstitution everyName =
        new NodeSubstitution() {
          @Override
          public boolean isEnabled(Node node) {
            return node.isKind(SyntaxKind.IDENTIFIER);
          }

          @Override
          public Node substitute(Node node) {
            return IR.name(node.getText() + "2");
          }
        };
    context.setExpressionSubstitution(everyName);
    context.setIdentifierSubstitution(everyName);

    assertPrint("x2;", IR.exprResult(IR.name("x")));
  }

  @Test
  public void testIdentifierSubstitution() {
    CountingSubstitution substitution = new CountingSubstitution("x", "renamed");
    context.setIdentifierSubstitution(substitution);

    assertPrint("var renamed = x;", IR.var(IR.name("x"), IR.name("x")));
    assertThat(substitution.calls).isEqualTo(1);
  }

  @Test
  public void testNoSubstitutionFlag() {
    CountingSubstitution substitution = new CountingSubstitution("x", "y");
    context.setExpressionSubstitution(substitution);
    Node x = IR.name("x");
    context.setEmitFlags(x, EmitFlags.NO_SUBSTITUTION);

    assertPrint("x;", IR.exprResult(x));
    assertThat(substitution.calls).isEqualTo(0);
  }

  @Test
  public void testEmitNotification() {
    List<Node> notified = new ArrayList<>();
    context.setEmitNotification(
        new EmitNotification() {
          @Override
          public boolean isEnabled(Node node) {
            return node.isKind(SyntaxKind.EXPRESSION_STATEMENT);
          }

          @Override
          public void onEmitNode(Node node, NodeEmitter emitCallback) {
            notified.add(node);
            Node call = node.getChild(Slot.EXPRESSION);
            if (!call.getChild(Slot.EXPRESSION).getText().equals("hidden")) {
              emitCallback.emit(node);
            }
          }
        });
    Node a = IR.exprResult(IR.call(IR.name("a")));
    Node hidden = IR.exprResult(IR.call(IR.name("hidden")));
    Node c = IR.exprResult(IR.call(IR.name("c")));

    assertPrint(lines("a();", "c();"), a, hidden, c);
    assertThat(notified).containsExactly(a, hidden, c).inOrder();
  }

  @Test
  public void testHoistedDeclarationsFollowFunctionBody() {
    Node g = IR.exprResult(IR.call(IR.name("g")));
    context.setEmitNotification(new Hoisting(g));

    assertPrint(
        lines("function f() {", "    g();", "    var t;", "}"),
        IR.function(IR.name("f"), NodeList.empty(), multiLine(IR.block(g))));
  }

  @Test
  public void testHoistedDeclarationsFollowFileStatements() {
    Node g = IR.exprResult(IR.call(IR.name("g")));
    context.setEmitNotification(new Hoisting(g));

    assertPrint(lines("g();", "var t;"), g);
  }

  @Test
  public void testHoistedDeclarationsInModuleBlock() {
    Node g = IR.exprResult(IR.call(IR.name("g")));
    context.setEmitNotification(new Hoisting(g));

    assertPrint(
        lines("namespace N {", "    g();", "    var t;", "}"),
        IR.namespace(IR.name("N"), IR.moduleBlock(g)));
  }

  @Test
  public void testSingleLineBlockFlag() {
    Node block = IR.block(IR.exprResult(IR.call(IR.name("a"))));
    context.setEmitFlags(block, EmitFlags.SINGLE_LINE);

    assertPrint("while (x) { a(); }", IR.whileNode(IR.name("x"), block));
  }

  @Test
  public void testStartsOnNewLine() {
    Node call =
        IR.call(IR.name("f"), IR.name("a"), IR.name("b").setStartsOnNewLine(true));

    assertPrint(lines("f(a,", "    b);"), IR.exprResult(call));
  }

  private static Node multiLine(Node block) {
    return block.putBooleanProp(Prop.MULTI_LINE, true);
  }

  /** Resolves one property name to a constant. */
  private static final class ConstantResolver implements EmitResolver {
    private final String name;
    private final double value;

    ConstantResolver(String name, double value) {
      this.name = name;
      this.value = value;
    }

    @Override
    public @Nullable Double getConstantValue(Node node) {
      Node property =
          node.isKind(SyntaxKind.PROPERTY_ACCESS_EXPRESSION)
              ? node.getChild(Slot.NAME)
              : node.getChild(Slot.ARGUMENT_EXPRESSION);
      return property != null && name.equals(property.getText()) ? value : null;
    }

    @Override
    public boolean hasGlobalName(String name) {
      return false;
    }
  }

  private static final class CountingSubstitution implements NodeSubstitution {
    private final String from;
    private final String to;
    int calls;

    CountingSubstitution(String from, String to) {
      this.from = from;
      this.to = to;
    }

    @Override
    public boolean isEnabled(Node node) {
      return node.isKind(SyntaxKind.IDENTIFIER) && from.equals(node.getText());
    }

    @Override
    public Node substitute(Node node) {
      calls++;
      return IR.name(to);
    }
  }

  /** Hoists a {@code var t} into the current environment when a given statement is printed. */
  private final class Hoisting implements EmitNotification {
    private final Node trigger;

    Hoisting(Node trigger) {
      this.trigger = trigger;
    }

    @Override
    public boolean isEnabled(Node node) {
      return node == trigger;
    }

    @Override
    public void onEmitNode(Node node, NodeEmitter emitCallback) {
      context.hoistVariableDeclaration(IR.name("t"));
      emitCallback.emit(node);
    }
  }
}
