package org.csu.letscript.compiler.parser;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.csu.letscript.common.exception.InvalidExpressionException;
import org.csu.letscript.common.exception.InvalidNumberLiteralException;
import org.csu.letscript.compiler.lexer.Token;
import org.csu.letscript.compiler.lexer.TokenType;
import org.csu.letscript.compiler.parser.ast.ExpressionNode;
import org.csu.letscript.compiler.parser.ast.BinaryExpressionNode;
import org.csu.letscript.compiler.parser.ast.IdentifierNode;
import org.csu.letscript.compiler.parser.ast.NumberLiteralNode;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 表达式解析器
 * 不使用文法引擎，而是在顶层运算符处切分 Token 区间并递归解析两侧，
 * 以此处理运算符优先级和括号。
 */
public class ExpressionParser {

    private static final Logger log = LogManager.getLogger(ExpressionParser.class);

    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    // 按尝试顺序排列: 先找加减，找到的运算符成为最外层节点，因此乘除结合得更紧
    private static final List<Set<TokenType>> PRECEDENCE_TIERS = List.of(
            Set.of(TokenType.PLUS, TokenType.MINUS),
            Set.of(TokenType.MUL, TokenType.DIV)
    );

    private final int maxNestingDepth;

    public ExpressionParser() {
        this(DEFAULT_MAX_NESTING_DEPTH);
    }

    public ExpressionParser(int maxNestingDepth) {
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public ExpressionNode parseExpression(List<Token> tokens) {
        return parseExpression(tokens, 0);
    }

    /**
     * 规则按顺序尝试，先匹配者胜出:
     * 单个字面量 -> 整体被括号包围 -> 二元表达式 -> 报错。
     *
     * @param depth 当前所处的括号嵌套层数，只在剥掉一对括号时加一
     */
    private ExpressionNode parseExpression(List<Token> tokens, int depth) {
        if (depth > maxNestingDepth) {
            throw new InvalidExpressionException(
                    "Expression nesting exceeds the limit of " + maxNestingDepth, tokens);
        }

        if (tokens.size() == 1) {
            Token token = tokens.get(0);
            if (token.type() == TokenType.NUMBER) {
                return parseNumberLiteral(token);
            }
            if (token.type() == TokenType.IDENT) {
                return parseIdentifier(token);
            }
        }

        if (isFullyParenthesized(tokens)) {
            log.debug("strip parentheses at depth {}", depth);
            return parseExpression(tokens.subList(1, tokens.size() - 1), depth + 1);
        }

        boolean hasOperator = tokens.stream().anyMatch(token -> token.type().isArithmeticOperator());
        if (hasOperator) {
            return parseBinaryExpression(tokens, depth);
        }

        throw new InvalidExpressionException("Invalid expression", tokens);
    }

    private BinaryExpressionNode parseBinaryExpression(List<Token> tokens, int depth) {
        for (Set<TokenType> operators : PRECEDENCE_TIERS) {
            Optional<TokenSplitResult> split = TokenSplitter.splitByTopLevelOperator(tokens, operators);
            if (split.isPresent()) {
                TokenSplitResult result = split.get();
                log.debug("split binary expression at '{}'", result.operator().value());
                ExpressionNode left = parseExpression(result.left(), depth);
                ExpressionNode right = parseExpression(result.right(), depth);
                return new BinaryExpressionNode(left, result.operator().type(), right);
            }
        }
        throw new InvalidExpressionException("Invalid binary expression", tokens);
    }

    /**
     * 首个 Token 为 LPAREN、末个为 RPAREN，且从左向右的括号深度恰好在最后一个 Token 处
     * 第一次回到 0 时，才认为整个区间被一对括号包围。
     * 像 (a) + (b) 这样深度提前归零的区间不算，括号不配对的区间也不算。
     */
    static boolean isFullyParenthesized(List<Token> tokens) {
        if (tokens.isEmpty()
                || tokens.get(0).type() != TokenType.LPAREN
                || tokens.get(tokens.size() - 1).type() != TokenType.RPAREN) {
            return false;
        }

        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type();
            if (type == TokenType.LPAREN) {
                depth++;
            } else if (type == TokenType.RPAREN) {
                depth--;
            }
            if (depth == 0 && i < tokens.size() - 1) {
                return false;
            }
        }
        return depth == 0;
    }

    IdentifierNode parseIdentifier(Token token) {
        return new IdentifierNode(token.value());
    }

    /**
     * 只接受十进制写法 (可带指数)，十六进制浮点数、"1d"、"NaN" 之类的文本一律视为非法。
     */
    NumberLiteralNode parseNumberLiteral(Token token) {
        double value;
        try {
            value = new BigDecimal(token.value()).doubleValue();
        } catch (NumberFormatException e) {
            throw new InvalidNumberLiteralException(token, e);
        }
        if (!Double.isFinite(value)) {
            throw new InvalidNumberLiteralException(token, null);
        }
        return new NumberLiteralNode(value);
    }
}
