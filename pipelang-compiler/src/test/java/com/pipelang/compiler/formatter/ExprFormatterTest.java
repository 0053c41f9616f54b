package com.pipelang.compiler.formatter;

import com.pipelang.compiler.ast.SourceLocation;
import com.pipelang.compiler.ast.expr.*;
import com.pipelang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExprFormatter 单元测试
 */
class ExprFormatterTest {

    private static final SourceLocation LOC = SourceLocation.UNKNOWN;

    private String format(String source) {
        return ExprFormatter.format(Parser.parse(source, "<test>"));
    }

    @Nested
    @DisplayName("括号")
    class ParenthesesTests {

        @Test
        @DisplayName("去掉多余括号")
        void testRedundantParens() {
            assertEquals("a + b * c", format("(a + (b * c))"));
            assertEquals("a - b - c", format("(a - b) - c"));
        }

        @Test
        @DisplayName("保留必要括号")
        void testRequiredParens() {
            assertEquals("(a + b) * c", format("(a + b) * c"));
            assertEquals("a - (b - c)", format("a - (b - c)"));
            assertEquals("(-2) ** 2", format("(-2) ** 2"));
            assertEquals("2 ** -1", format("2 ** -1"));
            assertEquals("(a < b) == c", format("(a < b) == c"));
        }

        @Test
        @DisplayName("lambda 作为被调用者加括号")
        void testLambdaCallee() {
            LambdaExpr lambda = new LambdaExpr(LOC, Collections.singletonList("Z"),
                    new BinaryExpr(LOC, new Identifier(LOC, "Z"), BinaryExpr.BinaryOp.ADD,
                            new Literal(LOC, 1L, Literal.LiteralKind.INT)));
            CallExpr call = CallExpr.of(LOC, lambda, Collections.singletonList(new Identifier(LOC, "x")));
            assertEquals("(lambda Z: Z + 1)(x)", ExprFormatter.format(call));
        }

        @Test
        @DisplayName("not 与比较")
        void testNot() {
            assertEquals("not a == b", format("not (a == b)"));
            assertEquals("not a and b", format("(not a) and b"));
        }
    }

    @Nested
    @DisplayName("节点输出")
    class NodeTests {

        @Test
        @DisplayName("嵌套调用")
        void testNestedCalls() {
            Expression tree = CallExpr.of(LOC, new Identifier(LOC, "add"), Arrays.asList(
                    CallExpr.of(LOC, new Identifier(LOC, "double"),
                            Collections.singletonList(new Literal(LOC, 3L, Literal.LiteralKind.INT))),
                    new Literal(LOC, 1L, Literal.LiteralKind.INT)));
            assertEquals("add(double(3), 1)", ExprFormatter.format(tree));
        }

        @Test
        @DisplayName("字面量")
        void testLiterals() {
            assertEquals("[1, 2.5, \"s\", True, None]", format("[1, 2.5, 's', True, None]"));
            assertEquals("\"a\\\"b\"", format("'a\"b'"));
        }

        @Test
        @DisplayName("元组、集合与字典")
        void testCollections() {
            assertEquals("(1,)", format("(1,)"));
            assertEquals("()", format("()"));
            assertEquals("{1, 2}", format("{1, 2}"));
            assertEquals("{\"a\": 1}", format("{'a': 1}"));
        }

        @Test
        @DisplayName("推导式")
        void testComprehensions() {
            assertEquals("[x * 2 for x in xs if x > 1]", format("[x*2 for x in xs if x>1]"));
            assertEquals("{k: v for k, v in d}", format("{k:v for k,v in d}"));
            assertEquals("sum((x for x in xs))", format("sum(x for x in xs)"));
        }

        @Test
        @DisplayName("f-string 转义花括号")
        void testInterpolation() {
            assertEquals("f\"{{a}} = {a + 1}\"", format("f'{{a}} = {a+1}'"));
        }

        @Test
        @DisplayName("命名参数与标记")
        void testNamedArgsAndAnnotation() {
            assertEquals("f(x, k=1)", format("f(x, k = 1)"));
            assertEquals("@pipes(placeholder=\"__\") a >> b", format("@pipes(placeholder='__') a >> b"));
        }
    }

    @Test
    @DisplayName("输出可被重新解析为同样的文本")
    void testReparse() {
        String[] sources = {
                "a >> f(1) >> _.x",
                "(lambda a: a ** 2)(2)",
                "{1: [x for x in range(3)]}",
                "-a ** -b",
                "f\"{_}!\"",
        };
        for (String source : sources) {
            String once = format(source);
            assertEquals(once, format(once), source);
        }
    }
}
