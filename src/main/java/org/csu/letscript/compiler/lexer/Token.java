package org.csu.letscript.compiler.lexer;

import java.util.Objects;

/**
 * 由外部词法分析器产出的词法单元。
 *
 * @param type  词法单元的类型 (种别码)，完全决定该单元在语法中的角色
 * @param value 词法单元的原始文本 (词素值)
 */
public record Token(TokenType type, String value) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return type + " '" + value + "'";
    }
}
