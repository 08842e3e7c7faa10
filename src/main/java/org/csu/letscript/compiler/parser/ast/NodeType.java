package org.csu.letscript.compiler.parser.ast;

/**
 * AST 节点的种类。
 */
public enum NodeType {
    PROGRAM,
    LET_STATEMENT,
    PRINT_STATEMENT,
    IDENTIFIER,
    NUMBER_LITERAL,
    BINARY_EXPRESSION
}
