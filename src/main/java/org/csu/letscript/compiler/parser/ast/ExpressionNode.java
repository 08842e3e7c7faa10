package org.csu.letscript.compiler.parser.ast;

/**
 * 表达式节点: 数字字面量、标识符或二元运算。
 */
public sealed interface ExpressionNode extends Node
        permits NumberLiteralNode, IdentifierNode, BinaryExpressionNode {
}
