package org.csu.letscript.compiler.parser.ast;

import org.csu.letscript.compiler.lexer.TokenType;

import java.util.Objects;

/**
 * AST 节点: 表示一个二元算术表达式 (e.g., a * 2)
 * operator 只能是 PLUS / MINUS / MUL / DIV。
 */
public record BinaryExpressionNode(
        ExpressionNode left,
        TokenType operator,
        ExpressionNode right
) implements ExpressionNode {

    public BinaryExpressionNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        if (operator == null || !operator.isArithmeticOperator()) {
            throw new IllegalArgumentException("Not an arithmetic operator: " + operator);
        }
    }

    @Override
    public NodeType nodeType() {
        return NodeType.BINARY_EXPRESSION;
    }
}
