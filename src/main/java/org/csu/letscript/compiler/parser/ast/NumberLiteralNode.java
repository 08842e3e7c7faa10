package org.csu.letscript.compiler.parser.ast;

/**
 * AST 节点: 数字字面量，值已从 Token 原文转换完成。
 */
public record NumberLiteralNode(double value) implements ExpressionNode {

    @Override
    public NodeType nodeType() {
        return NodeType.NUMBER_LITERAL;
    }
}
