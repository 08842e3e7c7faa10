package org.csu.letscript.compiler.parser.ast;

/**
 * 所有 AST 节点的公共接口。
 * 节点种类是封闭的，消费方可以对其做穷尽的 switch / instanceof 分派。
 */
public sealed interface Node permits ProgramNode, StatementNode, ExpressionNode {

    NodeType nodeType();
}
