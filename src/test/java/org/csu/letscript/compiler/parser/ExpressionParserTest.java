package org.csu.letscript.compiler.parser;

import org.csu.letscript.common.exception.InvalidExpressionException;
import org.csu.letscript.common.exception.InvalidNumberLiteralException;
import org.csu.letscript.common.exception.ParseException;
import org.csu.letscript.compiler.lexer.Token;
import org.csu.letscript.compiler.lexer.TokenType;
import org.csu.letscript.compiler.parser.ast.ExpressionNode;
import org.csu.letscript.compiler.parser.ast.BinaryExpressionNode;
import org.csu.letscript.compiler.parser.ast.IdentifierNode;
import org.csu.letscript.compiler.parser.ast.NumberLiteralNode;
import org.csu.letscript.support.Tokens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExpressionParser 的单元测试: 字面量、括号、优先级与结合性
 */
public class ExpressionParserTest {

    private ExpressionParser parser;

    @BeforeEach
    void setUp() {
        parser = new ExpressionParser();
    }

    private ExpressionNode parse(String source) {
        return parser.parseExpression(Tokens.of(source));
    }

    private static NumberLiteralNode num(double value) {
        return new NumberLiteralNode(value);
    }

    private static IdentifierNode id(String name) {
        return new IdentifierNode(name);
    }

    private static BinaryExpressionNode bin(ExpressionNode left, TokenType op, ExpressionNode right) {
        return new BinaryExpressionNode(left, op, right);
    }

    @Test
    void testSingleNumber() {
        assertEquals(num(42), parse("42"));
        assertEquals(num(3.5), parse("3.5"));
    }

    @Test
    void testSingleIdentifier() {
        assertEquals(id("total"), parse("total"));
    }

    @Test
    void testMultiplicationBindsTighter() {
        assertEquals(
                bin(bin(num(2), TokenType.MUL, num(3)), TokenType.PLUS, num(4)),
                parse("2 * 3 + 4"));
        assertEquals(
                bin(num(4), TokenType.PLUS, bin(num(2), TokenType.MUL, num(3))),
                parse("4 + 2 * 3"));
    }

    @Test
    void testParenthesesOverridePrecedence() {
        assertEquals(
                bin(bin(num(2), TokenType.PLUS, num(3)), TokenType.MUL, num(4)),
                parse("( 2 + 3 ) * 4"));
    }

    @Test
    void testSubtractionIsLeftAssociative() {
        assertEquals(
                bin(bin(id("a"), TokenType.MINUS, id("b")), TokenType.MINUS, id("c")),
                parse("a - b - c"));
    }

    @Test
    void testDivisionIsLeftAssociative() {
        assertEquals(
                bin(bin(id("a"), TokenType.DIV, id("b")), TokenType.MUL, id("c")),
                parse("a / b * c"));
    }

    @Test
    void testMixedAdditiveOperatorsAreLeftAssociative() {
        assertEquals(
                bin(bin(id("a"), TokenType.PLUS, id("b")), TokenType.MINUS, id("c")),
                parse("a + b - c"));
    }

    @Test
    void testRedundantParenthesesAreStripped() {
        assertEquals(id("x"), parse("( ( x ) )"));
        assertEquals(bin(num(1), TokenType.PLUS, num(2)), parse("( ( 1 + 2 ) )"));
    }

    @Test
    void testSeparateGroupsAreNotTreatedAsOneGroup() {
        assertEquals(
                bin(id("a"), TokenType.PLUS, id("b")),
                parse("( a ) + ( b )"));
    }

    @Test
    void testNestedParenthesesInsideOperand() {
        assertEquals(
                bin(id("a"), TokenType.MUL, bin(id("b"), TokenType.MINUS, bin(id("c"), TokenType.DIV, num(2)))),
                parse("a * ( b - ( c / 2 ) )"));
    }

    @Test
    void testFullyParenthesizedDetection() {
        assertTrue(ExpressionParser.isFullyParenthesized(Tokens.of("( a + b )")));
        assertTrue(ExpressionParser.isFullyParenthesized(Tokens.of("( ( a ) )")));
        assertFalse(ExpressionParser.isFullyParenthesized(Tokens.of("( a ) + ( b )")));
        assertFalse(ExpressionParser.isFullyParenthesized(Tokens.of("( a + b")));
        assertFalse(ExpressionParser.isFullyParenthesized(Tokens.of("( ( a )")));
        assertFalse(ExpressionParser.isFullyParenthesized(List.of()));
    }

    @Test
    void testUnterminatedGroupFails() {
        assertThrows(InvalidExpressionException.class, () -> parse("( 1 + 2"));
    }

    @Test
    void testUnopenedGroupFails() {
        assertThrows(InvalidExpressionException.class, () -> parse("1 + 2 )"));
    }

    @Test
    void testOperatorOnlyInsideGroupFails() {
        // '+' 只存在于括号内，任何一层都无法在顶层切分
        assertThrows(InvalidExpressionException.class, () -> parse("x ( 1 + 2 )"));
    }

    @Test
    void testEmptyExpressionFails() {
        InvalidExpressionException e = assertThrows(InvalidExpressionException.class,
                () -> parser.parseExpression(List.of()));
        assertTrue(e.getTokens().isEmpty());
    }

    @Test
    void testEmptyParenthesesFail() {
        assertThrows(InvalidExpressionException.class, () -> parse("( )"));
    }

    @Test
    void testMissingOperandFails() {
        assertThrows(InvalidExpressionException.class, () -> parse("1 +"));
        assertThrows(InvalidExpressionException.class, () -> parse("* 2"));
        assertThrows(InvalidExpressionException.class, () -> parse("- 1"));
    }

    @Test
    void testAdjacentOperandsFail() {
        InvalidExpressionException e = assertThrows(InvalidExpressionException.class, () -> parse("1 2"));
        assertEquals(Tokens.of("1 2"), e.getTokens());
    }

    @Test
    void testNonExpressionTokenFails() {
        assertThrows(InvalidExpressionException.class, () -> parse("="));
        assertThrows(InvalidExpressionException.class, () -> parse("let"));
    }

    @Test
    void testMalformedNumberIsReported() {
        Token bad = Tokens.token(TokenType.NUMBER, "12abc");
        InvalidNumberLiteralException e = assertThrows(InvalidNumberLiteralException.class,
                () -> parser.parseExpression(List.of(bad)));

        assertEquals(bad, e.getLiteral());
        assertEquals(List.of(bad), e.getTokens());
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    void testNonFiniteNumberIsReported() {
        assertThrows(InvalidNumberLiteralException.class,
                () -> parser.parseExpression(List.of(Tokens.token(TokenType.NUMBER, "NaN"))));
        assertThrows(InvalidNumberLiteralException.class,
                () -> parser.parseExpression(List.of(Tokens.token(TokenType.NUMBER, "1e999"))));
    }

    @Test
    void testMalformedNumberInsideBinaryExpression() {
        List<Token> tokens = List.of(
                Tokens.token(TokenType.IDENT, "a"),
                Tokens.token(TokenType.PLUS, "+"),
                Tokens.token(TokenType.NUMBER, "1.2.3"));
        assertThrows(ParseException.class, () -> parser.parseExpression(tokens));
    }

    @Test
    void testNestingLimit() {
        ExpressionParser shallow = new ExpressionParser(2);

        assertEquals(id("x"), shallow.parseExpression(Tokens.of("( ( x ) )")));
        assertThrows(InvalidExpressionException.class,
                () -> shallow.parseExpression(Tokens.of("( ( ( x ) ) )")));
    }

    @Test
    void testLongFlatChainIsNotNesting() {
        List<Token> tokens = Tokens.of("1" + " + 1".repeat(299));

        ExpressionNode node = parser.parseExpression(tokens);

        int terms = 1;
        while (node instanceof BinaryExpressionNode binary) {
            assertEquals(num(1), binary.right());
            node = binary.left();
            terms++;
        }
        assertEquals(num(1), node);
        assertEquals(300, terms);
    }

    @Test
    void testFlatChainWithinSmallLimit() {
        ExpressionParser shallow = new ExpressionParser(1);

        assertDoesNotThrow(() -> shallow.parseExpression(Tokens.of("1 + 2 + 3 + 4 + 5 + 6 + 7 + 8 + 9")));
        assertDoesNotThrow(() -> shallow.parseExpression(Tokens.of("( a ) * ( b ) - ( c + d ) / ( e )")));
        assertThrows(InvalidExpressionException.class,
                () -> shallow.parseExpression(Tokens.of("a + ( b * ( c - d ) )")));
    }

    @Test
    void testDeepNestingFailsGracefully() {
        StringBuilder source = new StringBuilder();
        int depth = ExpressionParser.DEFAULT_MAX_NESTING_DEPTH + 10;
        source.append("( ".repeat(depth)).append("1").append(" )".repeat(depth));

        assertThrows(InvalidExpressionException.class, () -> parse(source.toString()));
    }

    @Test
    void testNonDecimalNumberTextIsReported() {
        for (String text : List.of("0x1p3", "1d", "1f", "Infinity")) {
            assertThrows(InvalidNumberLiteralException.class,
                    () -> parser.parseExpression(List.of(Tokens.token(TokenType.NUMBER, text))), text);
        }
    }

    @Test
    void testDecimalNumberForms() {
        assertEquals(num(0.5), parse("0.5"));
        assertEquals(num(1500), parse("1.5e3"));
        assertEquals(num(7), parse("007"));
    }

    @Test
    void testInvalidNestingLimitRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ExpressionParser(0));
    }
}
