package org.csu.letscript.common.exception;

import lombok.Getter;
import org.csu.letscript.compiler.lexer.Token;

import java.util.List;

/**
 * NUMBER 类型的 Token 无法转换为有限的数值。
 * 这属于词法分析器违反约定，单独成类以便与普通语法错误区分。
 */
@Getter
public class InvalidNumberLiteralException extends ParseException {

    private final Token literal;

    public InvalidNumberLiteralException(Token literal, Throwable cause) {
        super("Invalid number literal '" + literal.value() + "'", List.of(literal));
        this.literal = literal;
        if (cause != null) {
            initCause(cause);
        }
    }
}
