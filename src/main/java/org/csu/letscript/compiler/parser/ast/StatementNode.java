package org.csu.letscript.compiler.parser.ast;

/**
 * 语句节点: let 绑定或 print 输出。
 */
public sealed interface StatementNode extends Node permits LetStatementNode, PrintStatementNode {
}
