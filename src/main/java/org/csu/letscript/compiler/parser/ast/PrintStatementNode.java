package org.csu.letscript.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: print 输出语句 (e.g., print a * 2)
 */
public record PrintStatementNode(ExpressionNode value) implements StatementNode {

    public PrintStatementNode {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public NodeType nodeType() {
        return NodeType.PRINT_STATEMENT;
    }
}
