package com.pipelang.compiler.parser;

import com.pipelang.compiler.ast.expr.*;
import com.pipelang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.pipelang.compiler.formatter.ExprFormatter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Expression parse(String source) {
        return Parser.parse(source, "<test>");
    }

    /** 解析后重新打印，用于断言结构 */
    private String roundTrip(String source) {
        return ExprFormatter.format(parse(source));
    }

    @Nested
    @DisplayName("运算符优先级")
    class PrecedenceTests {

        @Test
        @DisplayName(">> 左结合")
        void testShiftLeftAssociative() {
            BinaryExpr expr = (BinaryExpr) parse("a >> b >> c");
            assertEquals(BinaryOp.SHR, expr.getOperator());
            assertInstanceOf(BinaryExpr.class, expr.getLeft());
            assertEquals("c", ((Identifier) expr.getRight()).getName());
        }

        @Test
        @DisplayName("加法比移位绑定更紧")
        void testAdditiveBindsTighterThanShift() {
            BinaryExpr expr = (BinaryExpr) parse("a >> _ + 1");
            assertEquals(BinaryOp.SHR, expr.getOperator());
            BinaryExpr right = (BinaryExpr) expr.getRight();
            assertEquals(BinaryOp.ADD, right.getOperator());
        }

        @Test
        @DisplayName("** 右结合且高于一元负号")
        void testPower() {
            BinaryExpr expr = (BinaryExpr) parse("2 ** 3 ** 2");
            assertEquals(BinaryOp.POW, expr.getOperator());
            assertInstanceOf(BinaryExpr.class, expr.getRight());

            UnaryExpr neg = (UnaryExpr) parse("-2 ** 2");
            assertEquals(UnaryExpr.UnaryOp.NEG, neg.getOperator());
            assertInstanceOf(BinaryExpr.class, neg.getOperand());
        }

        @Test
        @DisplayName("|> 优先级最低")
        void testPipelineLowest() {
            BinaryExpr expr = (BinaryExpr) parse("a or b |> f");
            assertEquals(BinaryOp.PIPE, expr.getOperator());
            assertEquals(BinaryOp.OR, ((BinaryExpr) expr.getLeft()).getOperator());
        }

        @Test
        @DisplayName("链式比较展开为 and")
        void testComparisonChain() {
            BinaryExpr expr = (BinaryExpr) parse("a < b < c");
            assertEquals(BinaryOp.AND, expr.getOperator());
            assertEquals("a < b and b < c", ExprFormatter.format(expr));
        }

        @Test
        @DisplayName("位运算层级")
        void testBitwiseLevels() {
            assertEquals("a | b ^ c & d << 1", roundTrip("a | (b ^ (c & (d << 1)))"));
            assertEquals("(a | b) & c", roundTrip("(a | b) & c"));
        }
    }

    @Nested
    @DisplayName("后缀表达式")
    class PostfixTests {

        @Test
        @DisplayName("成员、调用与下标")
        void testPostfixChain() {
            CallExpr call = (CallExpr) parse("_.items()[0].name(1)");
            MemberExpr callee = (MemberExpr) call.getCallee();
            assertEquals("name", callee.getMember());
            assertInstanceOf(IndexExpr.class, callee.getTarget());
        }

        @Test
        @DisplayName("命名参数")
        void testNamedArguments() {
            CallExpr call = (CallExpr) parse("f(1, 2, key=3)");
            assertEquals(2, call.getPositionalArgs().size());
            assertEquals(1, call.getNamedArgs().size());
            assertEquals("key", call.getNamedArgs().get(0).getName());
        }

        @Test
        @DisplayName("命名参数之后不能出现位置参数")
        void testPositionalAfterNamed() {
            assertThrows(ParseException.class, () -> parse("f(k=1, 2)"));
        }

        @Test
        @DisplayName("生成器作为唯一参数")
        void testGeneratorArgument() {
            CallExpr call = (CallExpr) parse("sum(x * 2 for x in xs)");
            ComprehensionExpr gen = (ComprehensionExpr) call.getArgs().get(0).getValue();
            assertEquals(ComprehensionExpr.ComprehensionKind.GENERATOR, gen.getKind());
        }
    }

    @Nested
    @DisplayName("集合与推导式")
    class CollectionTests {

        @Test
        @DisplayName("元组、列表、集合与字典")
        void testCollections() {
            assertEquals(CollectionLiteral.CollectionKind.TUPLE, ((CollectionLiteral) parse("()")).getKind());
            assertEquals(1, ((CollectionLiteral) parse("(1,)")).getElements().size());
            assertInstanceOf(Literal.class, parse("(1)"));
            assertEquals(CollectionLiteral.CollectionKind.LIST, ((CollectionLiteral) parse("[1, 2,]")).getKind());
            assertEquals(CollectionLiteral.CollectionKind.SET, ((CollectionLiteral) parse("{1, 2}")).getKind());
            CollectionLiteral dict = (CollectionLiteral) parse("{'a': 1, 'b': _}");
            assertEquals(CollectionLiteral.CollectionKind.DICT, dict.getKind());
            assertEquals(2, dict.getMapEntries().size());
        }

        @Test
        @DisplayName("空花括号为字典")
        void testEmptyBraces() {
            CollectionLiteral dict = (CollectionLiteral) parse("{}");
            assertEquals(CollectionLiteral.CollectionKind.DICT, dict.getKind());
        }

        @Test
        @DisplayName("多重 for 与 if 子句")
        void testComprehensionClauses() {
            ComprehensionExpr comp = (ComprehensionExpr) parse("[x + y for x in a if x > 1 for y in b if y]");
            assertEquals(2, comp.getGenerators().size());
            assertEquals(List.of("x"), comp.getGenerators().get(0).getTargets());
            assertEquals(1, comp.getGenerators().get(0).getConditions().size());
        }

        @Test
        @DisplayName("字典推导式与解构目标")
        void testDictComprehension() {
            ComprehensionExpr comp = (ComprehensionExpr) parse("{k: v for k, v in _.items()}");
            assertEquals(ComprehensionExpr.ComprehensionKind.DICT, comp.getKind());
            assertEquals(List.of("k", "v"), comp.getGenerators().get(0).getTargets());
            assertNotNull(comp.getValue());
        }
    }

    @Nested
    @DisplayName("lambda、f-string 与标记")
    class SpecialFormTests {

        @Test
        @DisplayName("lambda 多参数")
        void testLambda() {
            LambdaExpr lambda = (LambdaExpr) parse("lambda a, b: a + b");
            assertEquals(List.of("a", "b"), lambda.getParams());
        }

        @Test
        @DisplayName("lambda 作为操作数必须加括号")
        void testBareLambdaOperand() {
            assertThrows(ParseException.class, () -> parse("2 >> lambda a: a"));
            assertInstanceOf(BinaryExpr.class, parse("2 >> (lambda a: a ** 2)"));
        }

        @Test
        @DisplayName("f-string 拆分为文本与表达式")
        void testInterpolation() {
            StringInterpolation s = (StringInterpolation) parse("f\"x={_ + 1}, {{raw}}\"");
            assertEquals(3, s.getParts().size());
            assertEquals("x=", ((StringInterpolation.LiteralPart) s.getParts().get(0)).getValue());
            assertInstanceOf(BinaryExpr.class,
                    ((StringInterpolation.ExprPart) s.getParts().get(1)).getExpression());
            assertEquals(", {raw}", ((StringInterpolation.LiteralPart) s.getParts().get(2)).getValue());
        }

        @Test
        @DisplayName("f-string 空插值报错")
        void testEmptyInterpolation() {
            assertThrows(ParseException.class, () -> parse("f\"{}\""));
        }

        @Test
        @DisplayName("前缀标记")
        void testAnnotation() {
            AnnotatedExpr expr = (AnnotatedExpr) parse("@pipes(placeholder='__', debug=True) 1 >> f");
            AnnotatedExpr.Annotation ann = expr.findAnnotation("pipes");
            assertNotNull(ann);
            assertEquals(2, ann.getArgs().size());
            assertInstanceOf(BinaryExpr.class, expr.getBody());
        }

        @Test
        @DisplayName("无参数标记")
        void testBareAnnotation() {
            AnnotatedExpr expr = (AnnotatedExpr) parse("@pipes a >> b");
            assertFalse(expr.getAnnotations().get(0).hasArgs());
        }

        @Test
        @DisplayName("标记名后有空格时括号属于主体")
        void testSpacedParenthesisIsBody() {
            AnnotatedExpr expr = (AnnotatedExpr) parse("@pipes (1 + 2) * 10");
            assertFalse(expr.getAnnotations().get(0).hasArgs());
            BinaryExpr body = (BinaryExpr) expr.getBody();
            assertEquals(BinaryOp.MUL, body.getOperator());
            assertEquals("(1 + 2) * 10", ExprFormatter.format(body));
        }

        @Test
        @DisplayName("带参数标记后的括号表达式")
        void testArgumentsThenParenthesizedBody() {
            AnnotatedExpr expr = (AnnotatedExpr) parse("@pipes(debug=True) (lambda Z: Z + 1)(2)");
            assertEquals(1, expr.getAnnotations().get(0).getArgs().size());
            assertInstanceOf(CallExpr.class, expr.getBody());
        }

        @Test
        @DisplayName("打印结果可重新解析")
        void testAnnotationRoundTrip() {
            String[] sources = {
                    "@pipes (lambda Z: Z * 10 + 3)(double(x))",
                    "@pipes(placeholder=\"__\") (a + b) * c",
                    "@trace @pipes (1, 2)",
            };
            for (String source : sources) {
                assertEquals(source, roundTrip(source), source);
                assertEquals(source, roundTrip(roundTrip(source)), source);
            }
        }
    }

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        @Test
        @DisplayName("表达式后多余 token")
        void testTrailingTokens() {
            ParseException e = assertThrows(ParseException.class, () -> parse("a b"));
            assertEquals("<test>", e.getFileName());
            assertEquals(1, e.getLine());
            assertEquals(3, e.getColumn());
            assertEquals("Unexpected token after expression", e.getRawMessage());
            assertEquals("Unexpected token after expression at <test>:line 1, column 3 (found 'b')", e.getMessage());
        }

        @Test
        @DisplayName("输入提前结束")
        void testEndOfInput() {
            ParseException e = assertThrows(ParseException.class, () -> parse("1 +"));
            assertTrue(e.getMessage().contains("(found end of input)"), e.getMessage());
        }

        @Test
        @DisplayName("缺少右括号")
        void testMissingParen() {
            ParseException e = assertThrows(ParseException.class, () -> parse("f(1, 2"));
            assertEquals("RPAREN", e.getExpected());
        }

        @Test
        @DisplayName("词法错误转为解析异常")
        void testLexerError() {
            assertThrows(ParseException.class, () -> parse("a $ b"));
        }
    }
}
