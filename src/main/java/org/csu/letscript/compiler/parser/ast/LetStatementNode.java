package org.csu.letscript.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: let 绑定语句 (e.g., let x = 1 + 2)
 */
public record LetStatementNode(IdentifierNode name, ExpressionNode value) implements StatementNode {

    public LetStatementNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public NodeType nodeType() {
        return NodeType.LET_STATEMENT;
    }
}
