package org.csu.letscript.compiler.parser.ast;

import java.util.List;

/**
 * AST 根节点: 按源码顺序 (即执行顺序) 保存所有语句。
 */
public record ProgramNode(List<StatementNode> body) implements Node {

    public ProgramNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.PROGRAM;
    }
}
