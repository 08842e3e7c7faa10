package org.csu.letscript.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 表示一个标识符，如变量名。
 */
public record IdentifierNode(String name) implements ExpressionNode {

    public IdentifierNode {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public NodeType nodeType() {
        return NodeType.IDENTIFIER;
    }
}
