package org.csu.letscript.compiler.lexer;

/**
 * 词法单元的类型，即“种别码”。
 *
 * 这是一个封闭集合：解析器只认识这里列出的类型。
 */
public enum TokenType {
    // ---- 字面量与标识符 ----
    NUMBER,     // 42, 3.14
    IDENT,      // x, total

    // ---- 算术运算符 ----
    PLUS,       // +
    MINUS,      // -
    MUL,        // *
    DIV,        // /

    // ---- 符号 ----
    EQUAL,      // =
    SEMICOLON,  // ;
    LPAREN,     // (
    RPAREN,     // )

    // ---- 关键字 ----
    LET,        // "let"
    PRINT;      // "print"

    public boolean isArithmeticOperator() {
        return this == PLUS || this == MINUS || this == MUL || this == DIV;
    }
}
